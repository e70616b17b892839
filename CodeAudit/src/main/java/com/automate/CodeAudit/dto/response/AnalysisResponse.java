package com.automate.CodeAudit.dto.response;

import com.automate.CodeAudit.entity.AnalysisStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record AnalysisResponse(
        UUID projectId,
        AnalysisStatus status,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        String errorMessage,
        int vulnerabilities,
        int vulnerableDependencies
) {}
