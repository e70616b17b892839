package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.dto.response.LanguageLinesCountResponse;
import com.automate.CodeAudit.dto.response.ProjectDetailResponse;
import com.automate.CodeAudit.dto.response.ProjectResponse;
import com.automate.CodeAudit.entity.LanguageLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectLinesCountEntity;
import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.SupportedLanguageEntity;
import com.automate.CodeAudit.entity.TeamEntity;
import com.automate.CodeAudit.entity.UsersEntity;
import com.automate.CodeAudit.exception.DuplicateFieldsException;
import com.automate.CodeAudit.exception.InvalidArchiveException;
import com.automate.CodeAudit.exception.ProjectNotFoundException;
import com.automate.CodeAudit.repository.ProjectsRepository;
import com.automate.CodeAudit.repository.TeamsRepository;
import com.automate.CodeAudit.utilities.ArchiveUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class ProjectService {

    private static final int TOP_LANGUAGES = 5;
    private static final String DEFAULT_ARCHIVE_NAME = "archive.zip";

    private final ProjectsRepository projectsRepository;
    private final TeamsRepository teamsRepository;
    private final AccessService accessService;
    private final RiskService riskService;
    private final LinesCountService linesCountService;
    private final CodeAuditProperties properties;

    public ProjectService(ProjectsRepository projectsRepository,
                          TeamsRepository teamsRepository,
                          AccessService accessService,
                          RiskService riskService,
                          LinesCountService linesCountService,
                          CodeAuditProperties properties) {
        this.projectsRepository = projectsRepository;
        this.teamsRepository = teamsRepository;
        this.accessService = accessService;
        this.riskService = riskService;
        this.linesCountService = linesCountService;
        this.properties = properties;
    }

    /**
     * Stores an uploaded zip archive under {@code <projects-path>/<id>/},
     * extracts it and shares the new project with the uploader's teams.
     *
     * @throws InvalidArchiveException when the archive is not a zip or is encrypted
     */
    @Transactional
    public ProjectResponse createProject(String name, MultipartFile archive, UsersEntity owner) {
        String rawName = Optional.ofNullable(name).orElse("").trim();
        if (rawName.isEmpty()) {
            throw new IllegalArgumentException("Project name is required");
        }
        if (archive == null || archive.isEmpty()) {
            throw new InvalidArchiveException("archive is empty");
        }
        if (projectsRepository.existsByNameIgnoreCase(rawName)) {
            throw new DuplicateFieldsException("Project", List.of("name"));
        }

        UUID projectId = UUID.randomUUID();
        Path projectDir = Paths.get(properties.getProjectsPath(), projectId.toString());
        String filename = archiveFilename(archive.getOriginalFilename());
        Path zipPath = projectDir.resolve(filename);

        String sha256;
        try {
            Files.createDirectories(projectDir);
            archive.transferTo(zipPath);

            ArchiveUtil.ArchiveCheck check = ArchiveUtil.checkZipFile(zipPath);
            if (!check.valid()) {
                log.warn("Archive rejected for project '{}': {}", rawName, check.error());
                deleteQuietly(projectDir);
                throw new InvalidArchiveException(check.error());
            }
            sha256 = ArchiveUtil.sha256sum(zipPath);
            int files = ArchiveUtil.extract(zipPath, projectDir.resolve(properties.getExtractFolderName()));
            log.info("Archive {} extracted for project '{}': {} files", filename, rawName, files);
        } catch (IOException e) {
            log.error("Failed to store archive for project '{}'", rawName, e);
            deleteQuietly(projectDir);
            throw new UncheckedIOException("Could not store project archive", e);
        }

        ProjectsEntity project = new ProjectsEntity();
        project.setProjectId(projectId);
        project.setName(rawName);
        project.setArchiveFilename(filename);
        project.setArchiveSha256(sha256);
        project.setSourcePath(projectDir.toString());
        ProjectsEntity saved = projectsRepository.save(project);

        for (TeamEntity team : teamsRepository.findByMembers_UserId(owner.getUserId())) {
            team.getProjects().add(saved);
        }

        log.info("Project created: {} ({}) by {}", saved.getName(), saved.getProjectId(), owner.getUsername());
        return toResponse(saved);
    }

    /** Deletes the project folder, then the project with its analysis and line counts. */
    @Transactional
    public void removeProject(UUID projectId) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        if (project.getSourcePath() != null) {
            try {
                FileSystemUtils.deleteRecursively(Paths.get(project.getSourcePath()));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot delete project folder " + project.getSourcePath(), e);
            }
        }
        for (TeamEntity team : project.getTeams()) {
            team.getProjects().remove(project);
        }
        projectsRepository.delete(project);
        log.info("Project removed: {} ({})", project.getName(), projectId);
    }

    @Transactional(readOnly = true)
    public List<ProjectResponse> listProjects(UsersEntity user) {
        List<ProjectsEntity> projects = user.isAdmin()
                ? projectsRepository.findAllByOrderByCreatedAtDesc()
                : projectsRepository.findByProjectIdInOrderByCreatedAtDesc(accessService.listAccessibleProjectIds(user));
        return projects.stream().map(ProjectService::toResponse).toList();
    }

    /** Loads a project the user is allowed to see. */
    @Transactional(readOnly = true)
    public ProjectsEntity getAccessibleProject(UUID projectId, UsersEntity user) {
        ProjectsEntity project = projectsRepository.findById(projectId)
                .orElseThrow(() -> new ProjectNotFoundException(projectId));
        accessService.requireAccess(user, project);
        return project;
    }

    @Transactional(readOnly = true)
    public ProjectDetailResponse getProjectDetail(UUID projectId, UsersEntity user) {
        ProjectsEntity project = getAccessibleProject(projectId, user);
        ProjectLinesCountEntity linesCount = project.getProjectLinesCount();

        List<LanguageLinesCountResponse> topLanguages = List.of();
        List<String> supportedLanguages = List.of();
        long totalCodeCount = 0;
        if (linesCount != null) {
            totalCodeCount = linesCount.getTotalCodeCount();
            topLanguages = LinesCountService.topLanguages(linesCount, TOP_LANGUAGES).stream()
                    .map(ProjectService::toResponse)
                    .toList();
            supportedLanguages = linesCountService.topSupportedLanguages(linesCount).stream()
                    .map(SupportedLanguageEntity::getName)
                    .distinct()
                    .toList();
        }

        return new ProjectDetailResponse(
                toResponse(project),
                riskService.calculateRiskLevel(projectId),
                riskService.countOccurrences(projectId),
                totalCodeCount,
                topLanguages,
                supportedLanguages
        );
    }

    private static String archiveFilename(String originalFilename) {
        String cleaned = StringUtils.getFilename(StringUtils.cleanPath(Optional.ofNullable(originalFilename).orElse("")));
        if (cleaned == null || cleaned.isBlank() || cleaned.startsWith(".")) {
            return DEFAULT_ARCHIVE_NAME;
        }
        return cleaned;
    }

    private static void deleteQuietly(Path folder) {
        try {
            FileSystemUtils.deleteRecursively(folder);
        } catch (IOException e) {
            log.warn("Cannot clean up {}: {}", folder, e.getMessage());
        }
    }

    static ProjectResponse toResponse(ProjectsEntity p) {
        return new ProjectResponse(
                p.getProjectId(),
                p.getName(),
                p.getArchiveFilename(),
                p.getArchiveSha256(),
                p.getCreatedAt(),
                p.getAnalysis() != null ? p.getAnalysis().getStatus() : null
        );
    }

    static LanguageLinesCountResponse toResponse(LanguageLinesCountEntity l) {
        return new LanguageLinesCountResponse(
                l.getLanguage(),
                l.getFileCount(),
                l.getLineCount(),
                l.getBlankCount(),
                l.getCommentCount(),
                l.getCodeCount(),
                l.getComplexityCount()
        );
    }
}
