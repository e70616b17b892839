package com.automate.CodeAudit.dto.response;

import java.util.List;

public record ProjectDetailResponse(
        ProjectResponse project,
        int riskLevel,
        long occurrences,
        long totalCodeCount,
        List<LanguageLinesCountResponse> topLanguages,
        List<String> supportedLanguages
) {}
