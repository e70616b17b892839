package com.automate.CodeAudit.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** An SCA finding: a third-party dependency with a known advisory. */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "vulnerable_dependencies")
public class VulnerableDependencyEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID vulnerableDependencyId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "analysis_id", nullable = false)
    private AnalysisEntity analysis;

    @Column(name = "package_name", nullable = false)
    private String packageName;

    @Column(name = "version")
    private String version;

    @Column(name = "ecosystem")
    private String ecosystem;

    @Column(name = "advisory_id")
    private String advisoryId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private Severity severity;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "vulnerable_dependency_sources",
            joinColumns = @JoinColumn(name = "vulnerable_dependency_id"))
    @Column(name = "source_file")
    private List<String> sourceFiles = new ArrayList<>();
}
