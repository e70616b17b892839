package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.UsersEntity;
import com.automate.CodeAudit.exception.ProjectAccessDeniedException;
import com.automate.CodeAudit.repository.TeamsRepository;
import com.automate.CodeAudit.repository.UsersRepository;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Project visibility from team membership. Admins see everything, other users
 * see the projects of the teams they belong to.
 */
@Service
public class AccessService {

    private final TeamsRepository teamsRepository;
    private final UsersRepository usersRepository;

    public AccessService(TeamsRepository teamsRepository, UsersRepository usersRepository) {
        this.teamsRepository = teamsRepository;
        this.usersRepository = usersRepository;
    }

    @Transactional(readOnly = true)
    public UsersEntity currentUser(String username) {
        return usersRepository.findByUsername(username)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "User not found"));
    }

    /** Ids of every project shared with the user through one of their teams. */
    @Transactional(readOnly = true)
    public Set<UUID> listAccessibleProjectIds(UsersEntity user) {
        return new LinkedHashSet<>(teamsRepository.findProjectIdsByMember(user.getUserId()));
    }

    @Transactional(readOnly = true)
    public boolean hasAccess(UsersEntity user, ProjectsEntity project) {
        if (user.isAdmin()) {
            return true;
        }
        Set<UUID> userTeams = teamsRepository.findTeamIdsByMember(user.getUserId());
        Set<UUID> projectTeams = teamsRepository.findTeamIdsByProject(project.getProjectId());
        return !Collections.disjoint(userTeams, projectTeams);
    }

    public void requireAccess(UsersEntity user, ProjectsEntity project) {
        if (!hasAccess(user, project)) {
            throw new ProjectAccessDeniedException(project.getProjectId());
        }
    }
}
