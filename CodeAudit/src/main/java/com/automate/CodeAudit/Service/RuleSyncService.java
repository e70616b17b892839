package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.dto.response.RuleSyncReport;
import com.automate.CodeAudit.entity.RuleEntity;
import com.automate.CodeAudit.entity.RuleRepositoryEntity;
import com.automate.CodeAudit.entity.SupportedLanguageEntity;
import com.automate.CodeAudit.exception.RuleParseException;
import com.automate.CodeAudit.exception.RuleRepositoryNotFoundException;
import com.automate.CodeAudit.repository.RuleRepositoriesRepository;
import com.automate.CodeAudit.repository.RulesRepository;
import com.automate.CodeAudit.repository.SupportedLanguagesRepository;
import com.automate.CodeAudit.utilities.CweSeverityUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Imports rule files of the rule repository checkouts into the database.
 * Rules are keyed by their file path, relative to the rules root, so that
 * re-running a synchronization updates rules in place and keeps their ids.
 */
@Slf4j
@Service
public class RuleSyncService {

    private enum FileOutcome { CREATED, UPDATED, EMPTY }

    private final RulesRepository rulesRepository;
    private final RuleRepositoriesRepository ruleRepositoriesRepository;
    private final SupportedLanguagesRepository supportedLanguagesRepository;
    private final TransactionTemplate transactionTemplate;
    private final List<String> ruleExtensions;

    public RuleSyncService(RulesRepository rulesRepository,
                           RuleRepositoriesRepository ruleRepositoriesRepository,
                           SupportedLanguagesRepository supportedLanguagesRepository,
                           TransactionTemplate transactionTemplate,
                           CodeAuditProperties properties) {
        this.rulesRepository = rulesRepository;
        this.ruleRepositoriesRepository = ruleRepositoriesRepository;
        this.supportedLanguagesRepository = supportedLanguagesRepository;
        this.transactionTemplate = transactionTemplate;
        this.ruleExtensions = List.copyOf(properties.getRuleExtensions());
    }

    /** Synchronizes every repository checkout found under the rules root. */
    public RuleSyncReport sync(Path rulesRoot) {
        return sync(rulesRoot, rulesRoot);
    }

    /** Synchronizes the checkout of a single repository, located under the rules root. */
    public RuleSyncReport sync(Path rulesRoot, String repositoryName) {
        return sync(rulesRoot, rulesRoot.resolve(repositoryName));
    }

    private RuleSyncReport sync(Path rulesRoot, Path folder) {
        int files = 0;
        int created = 0;
        int updated = 0;
        for (Path file : listRuleFiles(folder)) {
            String filePath = toLogicalPath(rulesRoot, file);
            // one transaction per file, a malformed file only rolls back itself
            FileOutcome outcome = transactionTemplate.execute(status -> syncFile(file, filePath));
            files++;
            if (outcome == FileOutcome.CREATED) {
                created++;
            } else if (outcome == FileOutcome.UPDATED) {
                updated++;
            }
        }
        log.info("Rules synchronized from {}: {} files, {} created, {} updated", folder, files, created, updated);
        return new RuleSyncReport(files, created, updated);
    }

    private FileOutcome syncFile(Path file, String filePath) {
        Object document = load(file, filePath);
        if (!(document instanceof Map<?, ?> root) || !(root.get("rules") instanceof List<?> entries)) {
            log.debug("No rules in {}", filePath);
            return FileOutcome.EMPTY;
        }

        String[] segments = filePath.split("/");
        String repositoryName = segments[0];
        String category = segments.length > 2
                ? String.join(".", List.of(segments).subList(1, segments.length - 1))
                : "";
        RuleRepositoryEntity repository = ruleRepositoriesRepository.findByName(repositoryName)
                .orElseThrow(() -> new RuleRepositoryNotFoundException(repositoryName));
        List<SupportedLanguageEntity> supportedLanguages = supportedLanguagesRepository.findAll();

        FileOutcome outcome = FileOutcome.EMPTY;
        for (Object item : entries) {
            if (!(item instanceof Map<?, ?> entry) || entry.get("id") == null) {
                throw new RuleParseException(filePath, new IllegalArgumentException("rule entry without id"));
            }
            RuleEntity rule = rulesRepository.findByFilePath(filePath).orElse(null);
            if (rule == null) {
                rule = new RuleEntity();
                rule.setTitle(String.valueOf(entry.get("id")));
                rule.setFilePath(filePath);
                outcome = FileOutcome.CREATED;
            } else if (outcome == FileOutcome.EMPTY) {
                outcome = FileOutcome.UPDATED;
            }
            rule.setRepository(repository);
            rule.setCategory(category);

            if (entry.get("languages") instanceof List<?> languages) {
                for (Object language : languages) {
                    for (SupportedLanguageEntity sl : supportedLanguages) {
                        if (language != null && sl.matches(language.toString())) {
                            rule.getLanguages().add(sl);
                        }
                    }
                }
            }

            if (entry.get("metadata") instanceof Map<?, ?> metadata) {
                if (metadata.get("cwe") != null) {
                    rule.setCwe(metadata.get("cwe").toString());
                }
                Object owasp = metadata.get("owasp");
                if (owasp instanceof List<?> owaspList) {
                    if (!owaspList.isEmpty() && owaspList.get(0) != null) {
                        rule.setOwasp(owaspList.get(0).toString());
                    }
                } else if (owasp != null) {
                    rule.setOwasp(owasp.toString());
                }
            }
            rule.setSeverity(CweSeverityUtil.classify(rule.getCwe()));

            rulesRepository.save(rule);
            log.debug("Rule imported in DB: {}/{}/{}", repositoryName, category, rule.getTitle());
        }
        return outcome;
    }

    private Object load(Path file, String filePath) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return yaml.load(reader);
        } catch (YAMLException | IOException e) {
            log.warn("Cannot parse rule file {}: {}", filePath, e.getMessage());
            throw new RuleParseException(filePath, e);
        }
    }

    List<Path> listRuleFiles(Path folder) {
        if (!Files.isDirectory(folder)) {
            return new ArrayList<>();
        }
        try (Stream<Path> paths = Files.walk(folder)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(p -> !isHidden(folder, p))
                    .filter(p -> ruleExtensions.stream().anyMatch(ext -> p.getFileName().toString().endsWith(ext)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list rule files of " + folder, e);
        }
    }

    // .git and other dot folders never hold rules
    private static boolean isHidden(Path folder, Path file) {
        for (Path segment : folder.relativize(file)) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    static String toLogicalPath(Path rulesRoot, Path file) {
        List<String> segments = new ArrayList<>();
        for (Path segment : rulesRoot.relativize(file)) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }
}
