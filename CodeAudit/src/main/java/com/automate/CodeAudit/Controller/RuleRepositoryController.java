package com.automate.CodeAudit.Controller;

import com.automate.CodeAudit.Service.RuleRepositoryService;
import com.automate.CodeAudit.Service.RuleService;
import com.automate.CodeAudit.dto.request.RuleRepositoryCreateRequest;
import com.automate.CodeAudit.dto.response.RuleRepositoryResponse;
import com.automate.CodeAudit.dto.response.RuleResponse;
import com.automate.CodeAudit.dto.response.RuleSyncReport;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/rule-repositories")
public class RuleRepositoryController {

    private final RuleRepositoryService ruleRepositoryService;
    private final RuleService ruleService;

    public RuleRepositoryController(RuleRepositoryService ruleRepositoryService, RuleService ruleService) {
        this.ruleRepositoryService = ruleRepositoryService;
        this.ruleService = ruleService;
    }

    @PostMapping
    public ResponseEntity<RuleRepositoryResponse> create(@Valid @RequestBody RuleRepositoryCreateRequest req,
                                                         UriComponentsBuilder uriBuilder) {
        RuleRepositoryResponse created = ruleRepositoryService.create(req);

        URI location = uriBuilder
                .path("/api/rule-repositories/{id}")
                .buildAndExpand(created.repositoryId())
                .toUri();

        return ResponseEntity.created(location).body(created);
    }

    @GetMapping
    public List<RuleRepositoryResponse> list() {
        return ruleRepositoryService.list();
    }

    @GetMapping("/{repositoryId}/rules")
    public List<RuleResponse> listRules(@PathVariable Long repositoryId) {
        return ruleService.listByRepository(repositoryId);
    }

    @PostMapping("/{repositoryId}/clone")
    public RuleSyncReport cloneRepository(@PathVariable Long repositoryId) {
        return ruleRepositoryService.cloneRepository(repositoryId);
    }

    @PostMapping("/{repositoryId}/pull")
    public RuleSyncReport pull(@PathVariable Long repositoryId) {
        return ruleRepositoryService.pull(repositoryId);
    }

    @DeleteMapping("/{repositoryId}")
    public ResponseEntity<Void> delete(@PathVariable Long repositoryId) {
        ruleRepositoryService.remove(repositoryId);
        return ResponseEntity.noContent().build();
    }
}
