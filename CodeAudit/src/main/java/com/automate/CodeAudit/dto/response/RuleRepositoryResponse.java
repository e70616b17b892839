package com.automate.CodeAudit.dto.response;

import java.time.LocalDateTime;

public record RuleRepositoryResponse(
        Long repositoryId,
        String name,
        String description,
        String uri,
        LocalDateTime lastUpdateOn
) {}
