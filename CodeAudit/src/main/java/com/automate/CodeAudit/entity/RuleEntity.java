package com.automate.CodeAudit.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;

/**
 * A detection rule. The id is referenced by rule packs and must survive
 * re-synchronization, so rules are looked up by {@link #filePath}.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "rules")
public class RuleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long ruleId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "file_path", nullable = false, unique = true)
    private String filePath;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "repository_id", nullable = false)
    private RuleRepositoryEntity repository;

    @Column(name = "category")
    private String category;

    @Column(name = "cwe")
    private String cwe;

    @Column(name = "owasp")
    private String owasp;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private Severity severity;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(name = "rule_languages",
            joinColumns = @JoinColumn(name = "rule_id"),
            inverseJoinColumns = @JoinColumn(name = "language_id"))
    private Set<SupportedLanguageEntity> languages = new HashSet<>();
}
