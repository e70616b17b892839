package com.automate.CodeAudit.Config;

import jakarta.validation.constraints.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties("codeaudit")
public class CodeAuditProperties {

    /** Root folder of uploaded projects, one sub-folder per project id. */
    @NotBlank
    private String projectsPath = "data/projects";

    /** Sub-folder of a project folder receiving the extracted archive. */
    @NotBlank
    private String extractFolderName = "extract";

    /** Root folder of rule repository checkouts, one sub-folder per repository name. */
    @NotBlank
    private String rulesPath = "data/rules";

    @NotEmpty
    private List<String> ruleExtensions = List.of(".yml", ".yaml");

    private Scc scc = new Scc();

    private Git git = new Git();

    private AnalysisPool analysisPool = new AnalysisPool();

    private Admin admin = new Admin();

    @Data
    public static class Scc {
        @NotBlank
        private String binary = "scc";

        @NotNull
        private Duration timeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Git {
        @Min(1) @Max(3600)
        private int timeoutSeconds = 300;
    }

    @Data
    public static class AnalysisPool {
        @Positive
        private int corePoolSize = 2;

        @Positive
        private int maxPoolSize = 4;

        @PositiveOrZero
        private int queueCapacity = 100;
    }

    /** Account created on startup when the users table is empty. No password, no account. */
    @Data
    public static class Admin {
        @NotBlank
        private String username = "admin";

        private String password;
    }
}
