package de.recon.diagnosis.rules;

import de.recon.diagnosis.model.DiagnosisDimension;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class RuleSets {

    private final int formatVersion;
    private final Map<DiagnosisDimension, RuleSet> byDimension;

    public RuleSets(int formatVersion, Collection<RuleSet> ruleSets) {
        this.formatVersion = formatVersion;
        Map<DiagnosisDimension, RuleSet> map = new EnumMap<>(DiagnosisDimension.class);
        for (RuleSet ruleSet : ruleSets) {
            if (map.put(ruleSet.dimension(), ruleSet) != null) {
                throw new IllegalArgumentException("duplicate rule set for " + ruleSet.dimension());
            }
        }
        this.byDimension = map;
    }

    public int getFormatVersion() {
        return formatVersion;
    }

    public RuleSet forDimension(DiagnosisDimension dimension) {
        RuleSet ruleSet = byDimension.get(dimension);
        return ruleSet != null ? ruleSet : new RuleSet(dimension, List.of());
    }

    public List<RuleSet> all() {
        return new ArrayList<>(byDimension.values());
    }
}
