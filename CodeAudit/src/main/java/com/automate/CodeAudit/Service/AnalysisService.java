package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.dto.request.FindingsImportRequest;
import com.automate.CodeAudit.dto.response.AnalysisResponse;
import com.automate.CodeAudit.entity.AnalysisEntity;
import com.automate.CodeAudit.entity.AnalysisStatus;
import com.automate.CodeAudit.entity.OccurrenceEntity;
import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.VulnerabilityEntity;
import com.automate.CodeAudit.entity.VulnerableDependencyEntity;
import com.automate.CodeAudit.exception.ProjectNotFoundException;
import com.automate.CodeAudit.jobs.AnalysisJob;
import com.automate.CodeAudit.repository.AnalysisRepository;
import com.automate.CodeAudit.repository.ProjectsRepository;
import com.automate.CodeAudit.utilities.CweSeverityUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.UUID;

@Slf4j
@Service
public class AnalysisService {

    private final ProjectsRepository projectsRepository;
    private final AnalysisRepository analysisRepository;
    private final AnalysisJob analysisJob;
    private final TransactionTemplate transactionTemplate;

    public AnalysisService(ProjectsRepository projectsRepository,
                           AnalysisRepository analysisRepository,
                           AnalysisJob analysisJob,
                           TransactionTemplate transactionTemplate) {
        this.projectsRepository = projectsRepository;
        this.analysisRepository = analysisRepository;
        this.analysisJob = analysisJob;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Queues an analysis of the project and hands it to the analysis pool.
     * The queued state is committed before the job starts. When the pool
     * refuses the job the analysis is marked FAILED so it can be started again.
     */
    public AnalysisResponse startAnalysis(UUID projectId) {
        AnalysisEntity queued = transactionTemplate.execute(status -> {
            AnalysisEntity analysis = findOrCreate(projectId);
            if (analysis.getStatus() == AnalysisStatus.QUEUED || analysis.getStatus() == AnalysisStatus.RUNNING) {
                throw new ResponseStatusException(HttpStatus.CONFLICT,
                        "Analysis already in progress for project: " + projectId);
            }
            analysis.setStatus(AnalysisStatus.QUEUED);
            analysis.setErrorMessage(null);
            analysis.setStartedAt(null);
            analysis.setFinishedAt(null);
            return analysisRepository.save(analysis);
        });
        log.info("Analysis queued for project {}", projectId);
        try {
            analysisJob.runAnalysis(projectId);
        } catch (RuntimeException e) {
            log.error("Cannot schedule analysis for project {}: {}", projectId, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            transactionTemplate.executeWithoutResult(status -> {
                queued.setStatus(AnalysisStatus.FAILED);
                queued.setErrorMessage("Cannot schedule analysis: " + message);
                queued.setFinishedAt(LocalDateTime.now());
                analysisRepository.save(queued);
            });
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE,
                    "Cannot schedule analysis for project: " + projectId, e);
        }
        return toResponse(queued);
    }

    @Transactional(readOnly = true)
    public AnalysisResponse getAnalysis(UUID projectId) {
        return analysisRepository.findByProject_ProjectId(projectId)
                .map(AnalysisService::toResponse)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No analysis for project: " + projectId));
    }

    /**
     * Stores the findings of the upstream scanners, replacing the previous
     * ones. A vulnerability without severity gets the severity of its CWE.
     */
    @Transactional
    public AnalysisResponse importFindings(UUID projectId, FindingsImportRequest req) {
        AnalysisEntity analysis = findOrCreate(projectId);
        if (analysis.getStatus() == null) {
            analysis.setStatus(AnalysisStatus.FINISHED);
            analysis.setFinishedAt(LocalDateTime.now());
        }

        analysis.getVulnerabilities().clear();
        for (FindingsImportRequest.Vulnerability v : req.getVulnerabilities()) {
            VulnerabilityEntity vuln = new VulnerabilityEntity();
            vuln.setAnalysis(analysis);
            vuln.setTitle(v.getTitle());
            vuln.setDescription(v.getDescription());
            vuln.setCwe(v.getCwe());
            vuln.setOwasp(v.getOwasp());
            vuln.setSeverity(v.getSeverity() != null ? v.getSeverity() : CweSeverityUtil.classify(v.getCwe()));
            for (FindingsImportRequest.Occurrence o : v.getOccurrences()) {
                OccurrenceEntity occ = new OccurrenceEntity();
                occ.setVulnerability(vuln);
                occ.setFilePath(o.getFilePath());
                occ.setLineStart(o.getLineStart());
                occ.setLineEnd(o.getLineEnd());
                occ.setMatchString(o.getMatchString());
                vuln.getOccurrences().add(occ);
            }
            analysis.getVulnerabilities().add(vuln);
        }

        analysis.getVulnerableDependencies().clear();
        for (FindingsImportRequest.VulnerableDependency d : req.getVulnerableDependencies()) {
            VulnerableDependencyEntity dep = new VulnerableDependencyEntity();
            dep.setAnalysis(analysis);
            dep.setPackageName(d.getPackageName());
            dep.setVersion(d.getVersion());
            dep.setEcosystem(d.getEcosystem());
            dep.setAdvisoryId(d.getAdvisoryId());
            dep.setSeverity(d.getSeverity());
            dep.setSourceFiles(new ArrayList<>(d.getSourceFiles()));
            analysis.getVulnerableDependencies().add(dep);
        }

        AnalysisEntity saved = analysisRepository.save(analysis);
        log.info("Findings imported for project {}: {} vulnerabilities, {} vulnerable dependencies",
                projectId, saved.getVulnerabilities().size(), saved.getVulnerableDependencies().size());
        return toResponse(saved);
    }

    private AnalysisEntity findOrCreate(UUID projectId) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        return analysisRepository.findByProject_ProjectId(projectId).orElseGet(() -> {
            AnalysisEntity analysis = new AnalysisEntity();
            analysis.setProject(project);
            project.setAnalysis(analysis);
            return analysis;
        });
    }

    static AnalysisResponse toResponse(AnalysisEntity a) {
        return new AnalysisResponse(
                a.getProject().getProjectId(),
                a.getStatus(),
                a.getStartedAt(),
                a.getFinishedAt(),
                a.getErrorMessage(),
                a.getVulnerabilities().size(),
                a.getVulnerableDependencies().size()
        );
    }
}
