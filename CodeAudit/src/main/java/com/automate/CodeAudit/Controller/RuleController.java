package com.automate.CodeAudit.Controller;

import com.automate.CodeAudit.Service.RuleService;
import com.automate.CodeAudit.dto.response.RuleResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/rules")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @GetMapping
    public List<RuleResponse> listByLanguage(@RequestParam String language) {
        return ruleService.listByLanguage(language);
    }
}
