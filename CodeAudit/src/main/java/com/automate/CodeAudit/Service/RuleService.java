package com.automate.CodeAudit.Service;

import com.automate.CodeAudit.dto.response.RuleResponse;
import com.automate.CodeAudit.entity.RuleEntity;
import com.automate.CodeAudit.entity.SupportedLanguageEntity;
import com.automate.CodeAudit.exception.RuleRepositoryNotFoundException;
import com.automate.CodeAudit.repository.RuleRepositoriesRepository;
import com.automate.CodeAudit.repository.RulesRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class RuleService {

    private final RulesRepository rulesRepository;
    private final RuleRepositoriesRepository ruleRepositoriesRepository;

    public RuleService(RulesRepository rulesRepository, RuleRepositoriesRepository ruleRepositoriesRepository) {
        this.rulesRepository = rulesRepository;
        this.ruleRepositoriesRepository = ruleRepositoriesRepository;
    }

    @Transactional(readOnly = true)
    public List<RuleResponse> listByRepository(Long repositoryId) {
        if (!ruleRepositoriesRepository.existsById(repositoryId)) {
            throw new RuleRepositoryNotFoundException(repositoryId);
        }
        return rulesRepository.findByRepository_RepositoryIdOrderByFilePath(repositoryId).stream()
                .map(RuleService::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RuleResponse> listByLanguage(String language) {
        return rulesRepository.findByLanguageName(language).stream()
                .map(RuleService::toResponse)
                .toList();
    }

    static RuleResponse toResponse(RuleEntity r) {
        return new RuleResponse(
                r.getRuleId(),
                r.getTitle(),
                r.getFilePath(),
                r.getRepository().getName(),
                r.getCategory(),
                r.getCwe(),
                r.getOwasp(),
                r.getSeverity(),
                r.getLanguages().stream().map(SupportedLanguageEntity::getName).sorted().toList()
        );
    }
}
