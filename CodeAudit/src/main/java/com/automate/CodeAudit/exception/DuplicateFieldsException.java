package com.automate.CodeAudit.exception;

import lombok.Getter;
import java.util.List;

/**
 * A project or rule repository would clash with an existing one on a unique field.
 */
@Getter
public class DuplicateFieldsException extends RuntimeException {
    private final String resource;
    private final List<String> duplicateFields;

    public DuplicateFieldsException(String resource, List<String> duplicateFields) {
        super(resource + " already exists with the same " + String.join(", ", duplicateFields));
        this.resource = resource;
        this.duplicateFields = List.copyOf(duplicateFields);
    }
}
