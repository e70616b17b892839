package com.automate.CodeAudit.repository;

import com.automate.CodeAudit.entity.ProjectsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProjectsRepository extends JpaRepository<ProjectsEntity, UUID> {

    boolean existsByNameIgnoreCase(String name);

    List<ProjectsEntity> findByProjectIdInOrderByCreatedAtDesc(Collection<UUID> projectIds);

    List<ProjectsEntity> findAllByOrderByCreatedAtDesc();
}
