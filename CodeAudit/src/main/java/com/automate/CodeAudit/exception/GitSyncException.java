package com.automate.CodeAudit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class GitSyncException extends ResponseStatusException {
    public GitSyncException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "Error synchronizing rule repository: " + message, cause);
    }
}
