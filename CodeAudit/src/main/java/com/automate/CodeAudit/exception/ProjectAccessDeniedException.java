package com.automate.CodeAudit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class ProjectAccessDeniedException extends ResponseStatusException {
    public ProjectAccessDeniedException(UUID projectId) {
        super(HttpStatus.FORBIDDEN, "Access denied to project: " + projectId);
    }
}
