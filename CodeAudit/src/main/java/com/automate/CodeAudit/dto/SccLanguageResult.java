package com.automate.CodeAudit.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One language entry of {@code scc -f json}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SccLanguageResult(
        @JsonProperty(value = "Name", required = true) String name,
        @JsonProperty(value = "Count", required = true) long count,
        @JsonProperty(value = "Lines", required = true) long lines,
        @JsonProperty(value = "Blank", required = true) long blank,
        @JsonProperty(value = "Comment", required = true) long comment,
        @JsonProperty(value = "Code", required = true) long code,
        @JsonProperty(value = "Complexity", required = true) long complexity
) {
}
