package com.automate.CodeAudit.jobs;

import com.automate.CodeAudit.Config.AsyncConfig;
import com.automate.CodeAudit.Service.LinesCountService;
import com.automate.CodeAudit.entity.AnalysisEntity;
import com.automate.CodeAudit.entity.AnalysisStatus;
import com.automate.CodeAudit.repository.AnalysisRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Background analysis of an uploaded project. Each status change is committed
 * on its own so that the analysis can be followed while the job runs.
 */
@Slf4j
@Component
public class AnalysisJob {

    private final AnalysisRepository analysisRepository;
    private final LinesCountService linesCountService;
    private final TransactionTemplate transactionTemplate;

    public AnalysisJob(AnalysisRepository analysisRepository,
                       LinesCountService linesCountService,
                       TransactionTemplate transactionTemplate) {
        this.analysisRepository = analysisRepository;
        this.linesCountService = linesCountService;
        this.transactionTemplate = transactionTemplate;
    }

    @Async(AsyncConfig.ANALYSIS_EXECUTOR)
    public void runAnalysis(UUID projectId) {
        log.info("Analysis started for project {}", projectId);
        update(projectId, a -> {
            a.setStatus(AnalysisStatus.RUNNING);
            a.setStartedAt(LocalDateTime.now());
        });
        try {
            linesCountService.countLines(projectId);
        } catch (RuntimeException e) {
            log.error("Analysis failed for project {}: {}", projectId, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            update(projectId, a -> {
                a.setStatus(AnalysisStatus.FAILED);
                a.setErrorMessage(message);
                a.setFinishedAt(LocalDateTime.now());
            });
            return;
        }
        update(projectId, a -> {
            a.setStatus(AnalysisStatus.FINISHED);
            a.setFinishedAt(LocalDateTime.now());
        });
        log.info("Analysis finished for project {}", projectId);
    }

    private void update(UUID projectId, Consumer<AnalysisEntity> change) {
        transactionTemplate.executeWithoutResult(status ->
                analysisRepository.findByProject_ProjectId(projectId).ifPresentOrElse(
                        analysis -> {
                            change.accept(analysis);
                            analysisRepository.save(analysis);
                        },
                        () -> log.warn("No analysis to update for project {}", projectId)));
    }
}
