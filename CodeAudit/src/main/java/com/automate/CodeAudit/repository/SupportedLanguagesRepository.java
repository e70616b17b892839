package com.automate.CodeAudit.repository;

import com.automate.CodeAudit.entity.SupportedLanguageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SupportedLanguagesRepository extends JpaRepository<SupportedLanguageEntity, Long> {
}
