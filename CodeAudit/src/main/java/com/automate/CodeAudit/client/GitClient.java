package com.automate.CodeAudit.client;

import com.automate.CodeAudit.Config.CodeAuditProperties;
import com.automate.CodeAudit.exception.GitSyncException;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeCommand;
import org.eclipse.jgit.api.PullResult;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Clone and fast-forward pull of rule repositories through JGit.
 */
@Slf4j
@Component
public class GitClient {

    private final int timeoutSeconds;

    public GitClient(CodeAuditProperties properties) {
        this.timeoutSeconds = properties.getGit().getTimeoutSeconds();
    }

    public void cloneRepository(String uri, Path target) {
        log.info("git clone {} -> {}", uri.replaceAll("https://[^@]+@", "https://***@"), target);
        try (Git ignored = Git.cloneRepository()
                .setURI(uri)
                .setDirectory(target.toFile())
                .setTimeout(timeoutSeconds)
                .call()) {
            log.info("Clone finished: {}", target);
        } catch (GitAPIException | JGitInternalException e) {
            throw new GitSyncException("clone of " + target.getFileName() + " failed: " + e.getMessage(), e);
        }
    }

    public void pull(Path checkout) {
        log.info("git pull {}", checkout);
        try (Git git = Git.open(checkout.toFile())) {
            PullResult result = git.pull()
                    .setFastForward(MergeCommand.FastForwardMode.FF_ONLY)
                    .setTimeout(timeoutSeconds)
                    .call();
            if (!result.isSuccessful()) {
                throw new GitSyncException("pull of " + checkout.getFileName() + " was not a fast-forward", null);
            }
        } catch (IOException | GitAPIException | JGitInternalException e) {
            throw new GitSyncException("pull of " + checkout.getFileName() + " failed: " + e.getMessage(), e);
        }
    }
}
