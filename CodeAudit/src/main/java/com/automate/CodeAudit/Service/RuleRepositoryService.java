package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.client.GitClient;
import com.automate.CodeAudit.dto.request.RuleRepositoryCreateRequest;
import com.automate.CodeAudit.dto.response.RuleRepositoryResponse;
import com.automate.CodeAudit.dto.response.RuleSyncReport;
import com.automate.CodeAudit.entity.RuleRepositoryEntity;
import com.automate.CodeAudit.exception.DuplicateFieldsException;
import com.automate.CodeAudit.exception.RuleRepositoryNotFoundException;
import com.automate.CodeAudit.repository.RuleRepositoriesRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

@Service
@Slf4j
public class RuleRepositoryService {

    private final RuleRepositoriesRepository ruleRepositoriesRepository;
    private final RuleSyncService ruleSyncService;
    private final GitClient gitClient;
    private final Path rulesPath;

    // clone, pull, sync and removal of one repository never overlap
    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public RuleRepositoryService(RuleRepositoriesRepository ruleRepositoriesRepository,
                                 RuleSyncService ruleSyncService,
                                 GitClient gitClient,
                                 CodeAuditProperties properties) {
        this.ruleRepositoriesRepository = ruleRepositoriesRepository;
        this.ruleSyncService = ruleSyncService;
        this.gitClient = gitClient;
        this.rulesPath = Paths.get(properties.getRulesPath());
    }

    // CREATE
    @Transactional
    public RuleRepositoryResponse create(RuleRepositoryCreateRequest req) {
        String name = req.getName().trim();
        if (ruleRepositoriesRepository.existsByNameIgnoreCase(name)) {
            throw new DuplicateFieldsException("Rule repository", List.of("name"));
        }
        RuleRepositoryEntity repository = new RuleRepositoryEntity();
        repository.setName(name);
        repository.setDescription(req.getDescription());
        repository.setUri(req.getUri().trim());
        RuleRepositoryEntity saved = ruleRepositoriesRepository.save(repository);
        log.info("Rule repository created: {} ({})", saved.getName(), saved.getRepositoryId());
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<RuleRepositoryResponse> list() {
        return ruleRepositoriesRepository.findAll().stream()
                .map(RuleRepositoryService::toResponse)
                .toList();
    }

    /** Clones the repository into the rules folder then imports its rules. */
    public RuleSyncReport cloneRepository(Long repositoryId) {
        return withLock(repositoryId, () -> {
            RuleRepositoryEntity repository = get(repositoryId);
            Path checkout = rulesPath.resolve(repository.getName());
            if (Files.exists(checkout)) {
                log.warn("Removing stale checkout before clone: {}", checkout);
                deleteFolder(checkout);
            }
            gitClient.cloneRepository(repository.getUri(), checkout);
            markUpdated(repository);
            return ruleSyncService.sync(rulesPath, repository.getName());
        });
    }

    /** Fast-forward pull of an existing checkout then re-import of its rules. */
    public RuleSyncReport pull(Long repositoryId) {
        return withLock(repositoryId, () -> {
            RuleRepositoryEntity repository = get(repositoryId);
            gitClient.pull(rulesPath.resolve(repository.getName()));
            markUpdated(repository);
            return ruleSyncService.sync(rulesPath, repository.getName());
        });
    }

    /** Deletes the checkout folder, then the repository and its rules. */
    public void remove(Long repositoryId) {
        withLock(repositoryId, () -> {
            RuleRepositoryEntity repository = get(repositoryId);
            deleteFolder(rulesPath.resolve(repository.getName()));
            ruleRepositoriesRepository.delete(repository);
            log.info("Rule repository removed: {}", repository.getName());
            return null;
        });
        locks.remove(repositoryId);
    }

    private RuleRepositoryEntity get(Long repositoryId) {
        return ruleRepositoriesRepository.findById(repositoryId)
                .orElseThrow(() -> new RuleRepositoryNotFoundException(repositoryId));
    }

    private void markUpdated(RuleRepositoryEntity repository) {
        repository.setLastUpdateOn(LocalDateTime.now());
        ruleRepositoriesRepository.save(repository);
    }

    private <T> T withLock(Long repositoryId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(repositoryId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static void deleteFolder(Path folder) {
        try {
            FileSystemUtils.deleteRecursively(folder);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + folder, e);
        }
    }

    static RuleRepositoryResponse toResponse(RuleRepositoryEntity e) {
        return new RuleRepositoryResponse(
                e.getRepositoryId(),
                e.getName(),
                e.getDescription(),
                e.getUri(),
                e.getLastUpdateOn()
        );
    }
}
