package com.automate.CodeAudit.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

// Uploaded archive rejected: "invalid zip file" or "encrypted zip file"
public class InvalidArchiveException extends ResponseStatusException {
    public InvalidArchiveException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }
}
