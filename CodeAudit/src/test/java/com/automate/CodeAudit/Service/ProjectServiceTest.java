package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.dto.response.ProjectResponse;
import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.TeamEntity;
import com.automate.CodeAudit.entity.UserRole;
import com.automate.CodeAudit.entity.UsersEntity;
import com.automate.CodeAudit.exception.DuplicateFieldsException;
import com.automate.CodeAudit.exception.InvalidArchiveException;
import com.automate.CodeAudit.repository.ProjectsRepository;
import com.automate.CodeAudit.repository.TeamsRepository;
import com.automate.CodeAudit.utilities.ArchiveUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectServiceTest {

    @TempDir
    Path tmp;

    @Mock
    private ProjectsRepository projectsRepository;
    @Mock
    private TeamsRepository teamsRepository;
    @Mock
    private AccessService accessService;
    @Mock
    private RiskService riskService;
    @Mock
    private LinesCountService linesCountService;

    private ProjectService projectService;
    private UsersEntity owner;

    @BeforeEach
    void setUp() {
        CodeAuditProperties properties = new CodeAuditProperties();
        properties.setProjectsPath(tmp.resolve("projects").toString());
        projectService = new ProjectService(projectsRepository, teamsRepository, accessService,
                riskService, linesCountService, properties);

        owner = new UsersEntity();
        owner.setUserId(UUID.randomUUID());
        owner.setUsername("alice");
        owner.setRole(UserRole.USER);
    }

    private static byte[] zipBytes() throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bytes)) {
            zos.putNextEntry(new ZipEntry("app/main.py"));
            zos.write("print('hi')\n".getBytes(StandardCharsets.UTF_8));
            zos.closeEntry();
        }
        return bytes.toByteArray();
    }

    private long projectFolders() throws IOException {
        Path root = tmp.resolve("projects");
        if (!Files.exists(root)) {
            return 0;
        }
        try (Stream<Path> children = Files.list(root)) {
            return children.count();
        }
    }

    @Test
    void createProjectStoresExtractsAndSharesWithTeams() throws IOException {
        byte[] zip = zipBytes();
        TeamEntity team = new TeamEntity();
        team.setTeamId(UUID.randomUUID());
        team.setName("appsec");
        when(projectsRepository.existsByNameIgnoreCase("webapp")).thenReturn(false);
        when(projectsRepository.save(any(ProjectsEntity.class))).thenAnswer(inv -> inv.getArgument(0));
        when(teamsRepository.findByMembers_UserId(owner.getUserId())).thenReturn(List.of(team));

        ProjectResponse created = projectService.createProject("  webapp ",
                new MockMultipartFile("archive", "webapp.zip", "application/zip", zip), owner);

        Path projectDir = tmp.resolve("projects").resolve(created.projectId().toString());
        assertThat(created.name()).isEqualTo("webapp");
        assertThat(created.archiveFilename()).isEqualTo("webapp.zip");
        assertThat(created.archiveSha256()).isEqualTo(ArchiveUtil.sha256sum(projectDir.resolve("webapp.zip")));
        assertThat(projectDir.resolve("extract/app/main.py")).exists();
        assertThat(team.getProjects()).extracting(ProjectsEntity::getProjectId).containsExactly(created.projectId());
    }

    @Test
    void invalidArchiveIsRejectedAndNothingIsKept() throws IOException {
        when(projectsRepository.existsByNameIgnoreCase("notes")).thenReturn(false);

        assertThatThrownBy(() -> projectService.createProject("notes",
                new MockMultipartFile("archive", "notes.zip", "application/zip", "plain text".getBytes()), owner))
                .isInstanceOf(InvalidArchiveException.class)
                .hasMessageContaining(ArchiveUtil.INVALID_ZIP);

        assertThat(projectFolders()).isZero();
        verify(projectsRepository, never()).save(any());
    }

    @Test
    void duplicateNameIsRejected() throws IOException {
        when(projectsRepository.existsByNameIgnoreCase("webapp")).thenReturn(true);

        assertThatThrownBy(() -> projectService.createProject("webapp",
                new MockMultipartFile("archive", "webapp.zip", "application/zip", zipBytes()), owner))
                .isInstanceOf(DuplicateFieldsException.class);
        assertThat(projectFolders()).isZero();
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> projectService.createProject(" ",
                new MockMultipartFile("archive", "a.zip", "application/zip", new byte[]{1}), owner))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeProjectDeletesFolderAndRecord() throws IOException {
        UUID id = UUID.randomUUID();
        Path projectDir = Files.createDirectories(tmp.resolve("projects").resolve(id.toString()).resolve("extract"))
                .getParent();
        Files.writeString(projectDir.resolve("extract/main.py"), "pass\n");
        ProjectsEntity project = new ProjectsEntity();
        project.setProjectId(id);
        project.setName("old");
        project.setSourcePath(projectDir.toString());
        when(projectsRepository.findById(id)).thenReturn(Optional.of(project));

        projectService.removeProject(id);

        assertThat(projectDir).doesNotExist();
        verify(projectsRepository).delete(project);
    }

    @Test
    void usersOnlyListProjectsOfTheirTeams() {
        UUID visible = UUID.randomUUID();
        ProjectsEntity project = new ProjectsEntity();
        project.setProjectId(visible);
        project.setName("visible");
        when(accessService.listAccessibleProjectIds(owner)).thenReturn(Set.of(visible));
        when(projectsRepository.findByProjectIdInOrderByCreatedAtDesc(Set.of(visible))).thenReturn(List.of(project));

        assertThat(projectService.listProjects(owner))
                .extracting(ProjectResponse::projectId)
                .containsExactly(visible);
        verify(projectsRepository, never()).findAllByOrderByCreatedAtDesc();
    }

    @Test
    void adminsListEveryProject() {
        UsersEntity admin = new UsersEntity();
        admin.setUserId(UUID.randomUUID());
        admin.setRole(UserRole.ADMIN);
        when(projectsRepository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of());

        assertThat(projectService.listProjects(admin)).isEmpty();
        verify(accessService, never()).listAccessibleProjectIds(any());
    }
}
