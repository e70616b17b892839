package com.automate.CodeAudit.dto.response;

import com.automate.CodeAudit.entity.AnalysisStatus;

import java.time.LocalDateTime;
import java.util.UUID;

public record ProjectResponse(
        UUID projectId,
        String name,
        String archiveFilename,
        String archiveSha256,
        LocalDateTime createdAt,
        AnalysisStatus analysisStatus
) {}
