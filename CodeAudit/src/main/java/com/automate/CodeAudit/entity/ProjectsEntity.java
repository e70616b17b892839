package com.automate.CodeAudit.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "projects")
public class ProjectsEntity {

    @Id
    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Column(name = "archive_filename", nullable = false)
    private String archiveFilename;

    @Column(name = "archive_sha256", length = 64)
    private String archiveSha256;

    // folder holding the archive and its extracted sources
    @Column(name = "source_path")
    private String sourcePath;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @OneToOne(mappedBy = "project", fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    private AnalysisEntity analysis;

    @OneToOne(fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    @JoinColumn(name = "project_lines_count_id")
    private ProjectLinesCountEntity projectLinesCount;

    @ManyToMany(mappedBy = "projects", fetch = FetchType.LAZY)
    private Set<TeamEntity> teams = new HashSet<>();
}
