package de.recon.diagnosis.patterns;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Pattern(
        @JsonProperty("description") String description,
        @JsonProperty("category") String category,
        @JsonProperty("support") long support
) {
}
