package com.automate.CodeAudit.dto.request;

import com.automate.CodeAudit.entity.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Findings produced by the upstream SAST and SCA scanners for one project.
 * An import replaces the findings previously stored for the project.
 */
@Data
public class FindingsImportRequest {

    @NotNull
    @Valid
    private List<Vulnerability> vulnerabilities = new ArrayList<>();

    @NotNull
    @Valid
    private List<VulnerableDependency> vulnerableDependencies = new ArrayList<>();

    @Data
    public static class Vulnerability {
        @NotBlank
        private String title;
        private String description;
        private String cwe;
        private String owasp;
        // derived from the CWE when missing
        private Severity severity;
        @NotNull
        @Valid
        private List<Occurrence> occurrences = new ArrayList<>();
    }

    @Data
    public static class Occurrence {
        @NotBlank
        private String filePath;
        private Integer lineStart;
        private Integer lineEnd;
        private String matchString;
    }

    @Data
    public static class VulnerableDependency {
        @NotBlank
        private String packageName;
        private String version;
        private String ecosystem;
        private String advisoryId;
        @NotNull
        private Severity severity;
        @NotNull
        private List<String> sourceFiles = new ArrayList<>();
    }
}
