package com.automate.CodeAudit.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "supported_languages")
public class SupportedLanguageEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long languageId;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    // comma separated, e.g. ".java,.jsp"
    @Column(name = "extensions")
    private String extensions;

    public boolean matches(String languageName) {
        return languageName != null && name.equalsIgnoreCase(languageName);
    }
}
