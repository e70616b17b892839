package com.automate.CodeAudit.jobs;

import com.automate.CodeAudit.entity.AnalysisEntity;
import com.automate.CodeAudit.entity.AnalysisStatus;
import com.automate.CodeAudit.repository.AnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

@Component
public class InterruptedAnalysisCleanupJob {
    private static final Logger log = LoggerFactory.getLogger(InterruptedAnalysisCleanupJob.class);
    static final String INTERRUPTED_MESSAGE = "Analysis interrupted by a server restart";

    private final AnalysisRepository analysisRepository;

    public InterruptedAnalysisCleanupJob(AnalysisRepository analysisRepository) {
        this.analysisRepository = analysisRepository;
    }

    /** No job survives a restart, so analyses left QUEUED or RUNNING are failed. */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public int failInterruptedAnalyses() {
        List<AnalysisEntity> interrupted =
                analysisRepository.findByStatusIn(EnumSet.of(AnalysisStatus.QUEUED, AnalysisStatus.RUNNING));
        LocalDateTime now = LocalDateTime.now();
        for (AnalysisEntity analysis : interrupted) {
            analysis.setStatus(AnalysisStatus.FAILED);
            analysis.setErrorMessage(INTERRUPTED_MESSAGE);
            analysis.setFinishedAt(now);
        }
        analysisRepository.saveAll(interrupted);
        if (!interrupted.isEmpty()) {
            log.warn("{} interrupted analyses marked as failed", interrupted.size());
        }
        return interrupted.size();
    }
}
