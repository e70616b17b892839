package com.automate.CodeAudit.dto.response;

public record LanguageLinesCountResponse(
        String language,
        long fileCount,
        long lineCount,
        long blankCount,
        long commentCount,
        long codeCount,
        long complexityCount
) {}
