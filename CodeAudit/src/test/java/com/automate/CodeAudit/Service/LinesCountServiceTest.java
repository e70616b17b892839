package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.client.SccClient;
import com.automate.CodeAudit.dto.SccLanguageResult;
import com.automate.CodeAudit.entity.LanguageLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.SupportedLanguageEntity;
import com.automate.CodeAudit.exception.LineCountException;
import com.automate.CodeAudit.repository.ProjectsRepository;
import com.automate.CodeAudit.repository.SupportedLanguagesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LinesCountServiceTest {

    @Mock
    private ProjectsRepository projectsRepository;
    @Mock
    private SupportedLanguagesRepository supportedLanguagesRepository;
    @Mock
    private SccClient sccClient;
    @Mock
    private PlatformTransactionManager transactionManager;

    private LinesCountService linesCountService;

    @BeforeEach
    void setUp() {
        linesCountService = new LinesCountService(projectsRepository, supportedLanguagesRepository,
                sccClient, new TransactionTemplate(transactionManager), new CodeAuditProperties());
    }

    private static SccLanguageResult result(String name, long code) {
        return new SccLanguageResult(name, 2, code + 10, 6, 4, code, 3);
    }

    private static SupportedLanguageEntity supported(long id, String name) {
        SupportedLanguageEntity sl = new SupportedLanguageEntity();
        sl.setLanguageId(id);
        sl.setName(name);
        return sl;
    }

    @Test
    void totalsAreTheSumOfLanguages() {
        List<SccLanguageResult> results = List.of(
                new SccLanguageResult("Python", 3, 120, 10, 20, 90, 7),
                new SccLanguageResult("YAML", 1, 15, 1, 2, 12, 0),
                new SccLanguageResult("Markdown", 2, 40, 8, 0, 32, 0));

        ProjectLinesCountEntity lc = LinesCountService.aggregate(results);

        assertThat(lc.getTotalFileCount()).isEqualTo(6);
        assertThat(lc.getTotalLineCount()).isEqualTo(175);
        assertThat(lc.getTotalBlankCount()).isEqualTo(19);
        assertThat(lc.getTotalCommentCount()).isEqualTo(22);
        assertThat(lc.getTotalCodeCount()).isEqualTo(134);
        assertThat(lc.getTotalComplexityCount()).isEqualTo(7);
        assertThat(lc.getLanguageLinesCounts())
                .extracting(LanguageLinesCountEntity::getLanguage)
                .containsExactly("Python", "YAML", "Markdown");
        assertThat(lc.getLanguageLinesCounts())
                .allSatisfy(l -> assertThat(l.getProjectLinesCount()).isSameAs(lc));
    }

    @Test
    void emptyResultGivesZeroTotals() {
        ProjectLinesCountEntity lc = LinesCountService.aggregate(List.of());

        assertThat(lc.getLanguageLinesCounts()).isEmpty();
        assertThat(lc.getTotalCodeCount()).isZero();
        assertThat(lc.getTotalLineCount()).isZero();
    }

    @Test
    void topLanguagesAreSortedByCodeAndStableOnTies() {
        ProjectLinesCountEntity lc = LinesCountService.aggregate(List.of(
                result("Go", 50),
                result("Java", 300),
                result("Shell", 50),
                result("Python", 120)));

        assertThat(LinesCountService.topLanguages(lc, 3))
                .extracting(LanguageLinesCountEntity::getLanguage)
                .containsExactly("Java", "Python", "Go");
        assertThat(LinesCountService.topLanguages(lc, 10)).hasSize(4);
        assertThat(LinesCountService.topLanguages(lc, 0)).isEmpty();
    }

    @Test
    void supportedLanguagesFollowCodeOrderAndMatchIgnoringCase() {
        ProjectLinesCountEntity lc = LinesCountService.aggregate(List.of(
                result("Markdown", 500),
                result("JavaScript", 80),
                result("Python", 200)));
        SupportedLanguageEntity python = supported(1, "python");
        SupportedLanguageEntity javascript = supported(2, "JavaScript");
        SupportedLanguageEntity java = supported(3, "Java");

        List<SupportedLanguageEntity> top =
                LinesCountService.topSupportedLanguages(lc, List.of(java, javascript, python));

        assertThat(top).containsExactly(python, javascript);
    }

    @Test
    void topSupportedLanguagesUsesStoredLanguages() {
        ProjectLinesCountEntity lc = LinesCountService.aggregate(List.of(result("Java", 10)));
        SupportedLanguageEntity java = supported(3, "Java");
        when(supportedLanguagesRepository.findAll()).thenReturn(List.of(java));

        assertThat(linesCountService.topSupportedLanguages(lc)).containsExactly(java);
    }

    @Test
    void countLinesReplacesStoredCount() {
        UUID id = UUID.randomUUID();
        ProjectsEntity project = new ProjectsEntity();
        project.setProjectId(id);
        project.setSourcePath("data/projects/" + id);
        project.setProjectLinesCount(LinesCountService.aggregate(List.of(result("Old", 1))));
        when(projectsRepository.findById(id)).thenReturn(Optional.of(project));
        when(sccClient.countLines(Paths.get("data/projects/" + id, "extract")))
                .thenReturn(List.of(result("Java", 40)));

        ProjectLinesCountEntity lc = linesCountService.countLines(id);

        assertThat(lc.getTotalCodeCount()).isEqualTo(40);
        assertThat(project.getProjectLinesCount()).isSameAs(lc);
        verify(projectsRepository).save(project);
    }

    @Test
    void lineCounterFailureKeepsPreviousCount() {
        UUID id = UUID.randomUUID();
        ProjectsEntity project = new ProjectsEntity();
        project.setProjectId(id);
        project.setSourcePath("data/projects/" + id);
        ProjectLinesCountEntity previous = LinesCountService.aggregate(List.of(result("Java", 40)));
        project.setProjectLinesCount(previous);
        when(projectsRepository.findById(id)).thenReturn(Optional.of(project));
        when(sccClient.countLines(any())).thenThrow(new LineCountException("Line counter exited with code 2", 2, ""));

        assertThatThrownBy(() -> linesCountService.countLines(id))
                .isInstanceOf(LineCountException.class);
        assertThat(project.getProjectLinesCount()).isSameAs(previous);
        verify(projectsRepository, never()).save(any());
    }
}
