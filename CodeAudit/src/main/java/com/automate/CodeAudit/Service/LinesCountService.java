package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.client.SccClient;
import com.automate.CodeAudit.dto.SccLanguageResult;
import com.automate.CodeAudit.entity.LanguageLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.SupportedLanguageEntity;
import com.automate.CodeAudit.exception.ProjectNotFoundException;
import com.automate.CodeAudit.repository.ProjectsRepository;
import com.automate.CodeAudit.repository.SupportedLanguagesRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
public class LinesCountService {

    private static final Comparator<LanguageLinesCountEntity> BY_CODE_COUNT_DESC =
            Comparator.comparingLong(LanguageLinesCountEntity::getCodeCount).reversed();

    private final ProjectsRepository projectsRepository;
    private final SupportedLanguagesRepository supportedLanguagesRepository;
    private final SccClient sccClient;
    private final TransactionTemplate transactionTemplate;
    private final CodeAuditProperties properties;

    public LinesCountService(ProjectsRepository projectsRepository,
                             SupportedLanguagesRepository supportedLanguagesRepository,
                             SccClient sccClient,
                             TransactionTemplate transactionTemplate,
                             CodeAuditProperties properties) {
        this.projectsRepository = projectsRepository;
        this.supportedLanguagesRepository = supportedLanguagesRepository;
        this.sccClient = sccClient;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /**
     * Counts the lines of the project's extracted archive and stores the
     * result, replacing any previous count. The line counter runs outside of
     * any transaction.
     *
     * @throws com.automate.CodeAudit.exception.LineCountException when scc fails
     */
    public ProjectLinesCountEntity countLines(UUID projectId) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        Path sourcePath = Paths.get(project.getSourcePath(), properties.getExtractFolderName());

        List<SccLanguageResult> results = sccClient.countLines(sourcePath);
        ProjectLinesCountEntity linesCount = aggregate(results);

        transactionTemplate.executeWithoutResult(status -> {
            ProjectsEntity managed = projectsRepository.findById(projectId)
                    .orElseThrow(() -> new ProjectNotFoundException(projectId));
            managed.setProjectLinesCount(linesCount);
            projectsRepository.save(managed);
        });
        log.info("Lines counted for project {}: {} languages, {} lines of code",
                projectId, linesCount.getLanguageLinesCounts().size(), linesCount.getTotalCodeCount());
        return linesCount;
    }

    /**
     * Builds a project lines count from scc results: one language entry per
     * result, in scc order, and totals summing every language.
     */
    public static ProjectLinesCountEntity aggregate(List<SccLanguageResult> results) {
        ProjectLinesCountEntity projectLc = new ProjectLinesCountEntity();
        int position = 0;
        for (SccLanguageResult r : results) {
            LanguageLinesCountEntity languageLc = new LanguageLinesCountEntity();
            languageLc.setProjectLinesCount(projectLc);
            languageLc.setPosition(position++);
            languageLc.setLanguage(r.name());
            languageLc.setFileCount(r.count());
            languageLc.setLineCount(r.lines());
            languageLc.setBlankCount(r.blank());
            languageLc.setCommentCount(r.comment());
            languageLc.setCodeCount(r.code());
            languageLc.setComplexityCount(r.complexity());
            projectLc.getLanguageLinesCounts().add(languageLc);

            projectLc.setTotalFileCount(projectLc.getTotalFileCount() + r.count());
            projectLc.setTotalLineCount(projectLc.getTotalLineCount() + r.lines());
            projectLc.setTotalBlankCount(projectLc.getTotalBlankCount() + r.blank());
            projectLc.setTotalCommentCount(projectLc.getTotalCommentCount() + r.comment());
            projectLc.setTotalCodeCount(projectLc.getTotalCodeCount() + r.code());
            projectLc.setTotalComplexityCount(projectLc.getTotalComplexityCount() + r.complexity());
        }
        return projectLc;
    }

    /** The {@code topNumber} languages with the most code lines, ties keep scc order. */
    public static List<LanguageLinesCountEntity> topLanguages(ProjectLinesCountEntity projectLc, int topNumber) {
        return projectLc.getLanguageLinesCounts().stream()
                .sorted(BY_CODE_COUNT_DESC)
                .limit(topNumber)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<SupportedLanguageEntity> topSupportedLanguages(ProjectLinesCountEntity projectLc) {
        return topSupportedLanguages(projectLc, supportedLanguagesRepository.findAll());
    }

    /**
     * Supported languages detected in the project, most present first. A
     * detected language matching several supported languages yields all of
     * them.
     */
    public static List<SupportedLanguageEntity> topSupportedLanguages(ProjectLinesCountEntity projectLc,
                                                                     List<SupportedLanguageEntity> supportedLanguages) {
        List<SupportedLanguageEntity> ret = new ArrayList<>();
        List<LanguageLinesCountEntity> languages = projectLc.getLanguageLinesCounts().stream()
                .sorted(BY_CODE_COUNT_DESC)
                .collect(Collectors.toList());
        for (LanguageLinesCountEntity lang : languages) {
            for (SupportedLanguageEntity sl : supportedLanguages) {
                if (sl.matches(lang.getLanguage())) {
                    ret.add(sl);
                }
            }
        }
        return ret;
    }
}
