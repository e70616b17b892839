package com.automate.CodeAudit.dto.response;

import com.automate.CodeAudit.entity.Severity;

import java.util.List;

public record RuleResponse(
        Long ruleId,
        String title,
        String filePath,
        String repository,
        String category,
        String cwe,
        String owasp,
        Severity severity,
        List<String> languages
) {}
