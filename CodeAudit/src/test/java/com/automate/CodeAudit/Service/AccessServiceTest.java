package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.entity.ProjectsEntity;
import com.automate.CodeAudit.entity.UserRole;
import com.automate.CodeAudit.entity.UsersEntity;
import com.automate.CodeAudit.exception.ProjectAccessDeniedException;
import com.automate.CodeAudit.repository.TeamsRepository;
import com.automate.CodeAudit.repository.UsersRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessServiceTest {

    @Mock
    private TeamsRepository teamsRepository;
    @Mock
    private UsersRepository usersRepository;

    @InjectMocks
    private AccessService accessService;

    private static final UUID TEAM_A = UUID.randomUUID();
    private static final UUID TEAM_B = UUID.randomUUID();

    private static UsersEntity user(UserRole role) {
        UsersEntity u = new UsersEntity();
        u.setUserId(UUID.randomUUID());
        u.setUsername(role.name().toLowerCase());
        u.setRole(role);
        return u;
    }

    private static ProjectsEntity project() {
        ProjectsEntity p = new ProjectsEntity();
        p.setProjectId(UUID.randomUUID());
        p.setName("webgoat");
        return p;
    }

    @Test
    void memberOfAnotherTeamHasNoAccess() {
        UsersEntity user = user(UserRole.USER);
        ProjectsEntity project = project();
        when(teamsRepository.findTeamIdsByMember(user.getUserId())).thenReturn(Set.of(TEAM_A));
        when(teamsRepository.findTeamIdsByProject(project.getProjectId())).thenReturn(Set.of(TEAM_B));

        assertThat(accessService.hasAccess(user, project)).isFalse();
        assertThatThrownBy(() -> accessService.requireAccess(user, project))
                .isInstanceOf(ProjectAccessDeniedException.class);
    }

    @Test
    void sharedTeamGivesAccess() {
        UsersEntity user = user(UserRole.USER);
        ProjectsEntity project = project();
        when(teamsRepository.findTeamIdsByMember(user.getUserId())).thenReturn(Set.of(TEAM_A, TEAM_B));
        when(teamsRepository.findTeamIdsByProject(project.getProjectId())).thenReturn(Set.of(TEAM_B));

        assertThat(accessService.hasAccess(user, project)).isTrue();
        assertThatCode(() -> accessService.requireAccess(user, project)).doesNotThrowAnyException();
    }

    @Test
    void userWithoutTeamHasNoAccess() {
        UsersEntity user = user(UserRole.USER);
        ProjectsEntity project = project();
        when(teamsRepository.findTeamIdsByMember(user.getUserId())).thenReturn(Set.of());
        when(teamsRepository.findTeamIdsByProject(project.getProjectId())).thenReturn(Set.of(TEAM_A));

        assertThat(accessService.hasAccess(user, project)).isFalse();
    }

    @Test
    void adminAlwaysHasAccess() {
        UsersEntity admin = user(UserRole.ADMIN);

        assertThat(accessService.hasAccess(admin, project())).isTrue();
        verifyNoInteractions(teamsRepository);
    }

    @Test
    void accessibleProjectsAreDeduplicated() {
        UsersEntity user = user(UserRole.USER);
        UUID p1 = UUID.randomUUID();
        UUID p2 = UUID.randomUUID();
        // p1 is shared with both of the user's teams
        when(teamsRepository.findProjectIdsByMember(user.getUserId())).thenReturn(List.of(p1, p2, p1));

        assertThat(accessService.listAccessibleProjectIds(user)).containsExactly(p1, p2);
    }

    @Test
    void unknownUsernameIsUnauthorized() {
        when(usersRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> accessService.currentUser("ghost"))
                .isInstanceOf(ResponseStatusException.class)
                .hasMessageContaining("User not found");
    }
}
