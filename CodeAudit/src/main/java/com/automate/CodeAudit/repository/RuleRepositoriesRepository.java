package com.automate.CodeAudit.repository;

import com.automate.CodeAudit.entity.RuleRepositoryEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RuleRepositoriesRepository extends JpaRepository<RuleRepositoryEntity, Long> {

    Optional<RuleRepositoryEntity> findByName(String name);

    boolean existsByNameIgnoreCase(String name);
}
