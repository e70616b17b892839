package com.automate.CodeAudit.repository;

import com.automate.CodeAudit.entity.AnalysisEntity;
import com.automate.CodeAudit.entity.AnalysisStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AnalysisRepository extends JpaRepository<AnalysisEntity, UUID> {

    Optional<AnalysisEntity> findByProject_ProjectId(UUID projectId);

    List<AnalysisEntity> findByStatusIn(Collection<AnalysisStatus> statuses);

    @Query("SELECT COUNT(o) FROM OccurrenceEntity o WHERE o.vulnerability.analysis.project.projectId = :projectId")
    long countOccurrencesByProjectId(@Param("projectId") UUID projectId);
}
