package com.automate.CodeAudit.repository;

import com.automate.CodeAudit.entity.RuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RulesRepository extends JpaRepository<RuleEntity, Long> {

    Optional<RuleEntity> findByFilePath(String filePath);

    List<RuleEntity> findByRepository_RepositoryIdOrderByFilePath(Long repositoryId);

    @Query("SELECT DISTINCT r FROM RuleEntity r JOIN r.languages l WHERE LOWER(l.name) = LOWER(:language) ORDER BY r.filePath")
    List<RuleEntity> findByLanguageName(@Param("language") String language);
}
