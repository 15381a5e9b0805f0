package de.recon.diagnosis.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record Rule(
        @JsonProperty("condition") String condition,
        @JsonProperty("label") String label,
        @JsonProperty("priority") int priority,
        @JsonProperty("category") String category
) {

    public Rule {
        Objects.requireNonNull(label, "label is missing");
        category = category == null ? "uncategorized" : category;
    }
}
