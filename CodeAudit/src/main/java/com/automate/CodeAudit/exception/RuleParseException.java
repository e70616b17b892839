package com.automate.CodeAudit.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@Getter
public class RuleParseException extends ResponseStatusException {
    private final String filePath;

    public RuleParseException(String filePath, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "Malformed rule file: " + filePath, cause);
        this.filePath = filePath;
    }
}
