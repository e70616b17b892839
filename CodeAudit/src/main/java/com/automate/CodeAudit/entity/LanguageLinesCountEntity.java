package com.automate.CodeAudit.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "language_lines_counts")
public class LanguageLinesCountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID languageLinesCountId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_lines_count_id", nullable = false)
    private ProjectLinesCountEntity projectLinesCount;

    // index in the line counter output
    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "language", nullable = false)
    private String language;

    @Column(name = "file_count", nullable = false)
    private long fileCount;

    @Column(name = "line_count", nullable = false)
    private long lineCount;

    @Column(name = "blank_count", nullable = false)
    private long blankCount;

    @Column(name = "comment_count", nullable = false)
    private long commentCount;

    @Column(name = "code_count", nullable = false)
    private long codeCount;

    @Column(name = "complexity_count", nullable = false)
    private long complexityCount;
}
