package com.automate.CodeAudit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

public class ProjectNotFoundException extends ResponseStatusException {
    public ProjectNotFoundException(UUID id) {
        super(HttpStatus.NOT_FOUND, "Project not found with id: " + id);
    }
}
