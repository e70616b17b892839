package com.automate.CodeAudit.dto.response;

public record RuleSyncReport(
        int filesParsed,
        int rulesCreated,
        int rulesUpdated
) {
}
