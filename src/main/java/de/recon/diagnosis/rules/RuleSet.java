package de.recon.diagnosis.rules;

import de.recon.diagnosis.model.DiagnosisDimension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record RuleSet(DiagnosisDimension dimension, List<Rule> rules) {

    public RuleSet {
        Objects.requireNonNull(dimension, "dimension is missing");
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public Set<String> labels() {
        Set<String> labels = new LinkedHashSet<>();
        for (Rule rule : rules) {
            labels.add(rule.label());
        }
        return labels;
    }
}
