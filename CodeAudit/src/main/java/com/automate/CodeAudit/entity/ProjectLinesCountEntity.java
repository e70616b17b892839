package com.automate.CodeAudit.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Project-wide line counters. Each total is the sum of the matching counter
 * over {@link #languageLinesCounts}.
 */
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "project_lines_counts")
public class ProjectLinesCountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID projectLinesCountId;

    @Column(name = "total_file_count", nullable = false)
    private long totalFileCount;

    @Column(name = "total_line_count", nullable = false)
    private long totalLineCount;

    @Column(name = "total_blank_count", nullable = false)
    private long totalBlankCount;

    @Column(name = "total_comment_count", nullable = false)
    private long totalCommentCount;

    @Column(name = "total_code_count", nullable = false)
    private long totalCodeCount;

    @Column(name = "total_complexity_count", nullable = false)
    private long totalComplexityCount;

    @OneToMany(mappedBy = "projectLinesCount", fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    private List<LanguageLinesCountEntity> languageLinesCounts = new ArrayList<>();
}
