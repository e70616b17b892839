package com.automate.CodeAudit.repository;

import com.automate.CodeAudit.entity.TeamEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@Repository
public interface TeamsRepository extends JpaRepository<TeamEntity, UUID> {

    List<TeamEntity> findByMembers_UserId(UUID userId);

    @Query("SELECT t.teamId FROM TeamEntity t JOIN t.members m WHERE m.userId = :userId")
    Set<UUID> findTeamIdsByMember(@Param("userId") UUID userId);

    @Query("SELECT t.teamId FROM TeamEntity t JOIN t.projects p WHERE p.projectId = :projectId")
    Set<UUID> findTeamIdsByProject(@Param("projectId") UUID projectId);

    @Query("SELECT p.projectId FROM TeamEntity t JOIN t.members m JOIN t.projects p WHERE m.userId = :userId")
    List<UUID> findProjectIdsByMember(@Param("userId") UUID userId);
}
