package com.automate.CodeAudit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class RuleRepositoryNotFoundException extends ResponseStatusException {
    public RuleRepositoryNotFoundException(Long id) {
        super(HttpStatus.NOT_FOUND, "Rule repository not found with id: " + id);
    }

    public RuleRepositoryNotFoundException(String name) {
        super(HttpStatus.NOT_FOUND, "Rule repository not found with name: " + name);
    }
}
