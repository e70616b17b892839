package com.automate.CodeAudit.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class RuleRepositoryCreateRequest {
    // used as checkout folder name
    @NotBlank
    @Pattern(regexp = "[A-Za-z0-9._-]+", message = "name may only contain letters, digits, '.', '_' and '-'")
    private String name;

    private String description;

    @NotBlank
    private String uri;
}
