package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.entity.AnalysisEntity;
import com.automate.CodeAudit.entity.ProjectLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.Severity;
import com.automate.CodeAudit.exception.ProjectNotFoundException;
import com.automate.CodeAudit.repository.AnalysisRepository;
import com.automate.CodeAudit.repository.ProjectsRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Project risk level (0 - 100). Mainly driven by the severity of the SAST
 * findings, adjusted with the severity of vulnerable dependencies (SCA).
 */
@Service
public class RiskService {

    // base level from the most severe vulnerability
    private static final Map<Severity, Integer> VULNERABILITY_RISK = Map.of(
            Severity.CRITICAL, 75,
            Severity.HIGH, 60,
            Severity.MEDIUM, 40,
            Severity.LOW, 20
    );

    // adjustment from the most severe vulnerable dependency
    private static final Map<Severity, Integer> DEPENDENCY_ADJUSTMENT = Map.of(
            Severity.CRITICAL, 10,
            Severity.HIGH, 8,
            Severity.MEDIUM, 5,
            Severity.LOW, 2
    );

    private final ProjectsRepository projectsRepository;
    private final AnalysisRepository analysisRepository;

    public RiskService(ProjectsRepository projectsRepository, AnalysisRepository analysisRepository) {
        this.projectsRepository = projectsRepository;
        this.analysisRepository = analysisRepository;
    }

    @Transactional(readOnly = true)
    public int calculateRiskLevel(UUID projectId) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        AnalysisEntity analysis = analysisRepository.findByProject_ProjectId(projectId).orElse(null);
        return score(analysis, project.getProjectLinesCount());
    }

    /** Total number of vulnerability occurrences of the project, 0 without analysis. */
    @Transactional(readOnly = true)
    public long countOccurrences(UUID projectId) {
        if (!projectsRepository.existsById(projectId)) {
            throw new ProjectNotFoundException(projectId);
        }
        return analysisRepository.countOccurrencesByProjectId(projectId);
    }

    /**
     * Risk level from already loaded findings. Returns 0 without analysis or
     * when the project has no line of code. At most one base level and one
     * adjustment contribute, so the result never exceeds 85.
     */
    public static int score(AnalysisEntity analysis, ProjectLinesCountEntity linesCount) {
        if (analysis == null) {
            return 0;
        }
        if (linesCount == null || linesCount.getTotalCodeCount() <= 0) {
            return 0;
        }
        int riskLevel = 0;
        for (Severity severity : Severity.DESCENDING) {
            if (hasVulnerabilityWithSeverity(analysis, severity)) {
                riskLevel = VULNERABILITY_RISK.get(severity);
                break;
            }
        }
        for (Severity severity : Severity.DESCENDING) {
            if (hasVulnerableDependencyWithSeverity(analysis, severity)) {
                riskLevel += DEPENDENCY_ADJUSTMENT.get(severity);
                break;
            }
        }
        return riskLevel;
    }

    static boolean hasVulnerabilityWithSeverity(AnalysisEntity analysis, Severity severity) {
        return analysis.getVulnerabilities().stream()
                .anyMatch(v -> v.getSeverity() == severity);
    }

    static boolean hasVulnerableDependencyWithSeverity(AnalysisEntity analysis, Severity severity) {
        return analysis.getVulnerableDependencies().stream()
                .anyMatch(d -> d.getSeverity() == severity);
    }
}
