package de.recon.diagnosis.vocabulary;

import de.recon.diagnosis.patterns.Pattern;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

public record VocabularySnapshot(
        long version,
        Map<String, List<String>> staticTaxonomy,
        List<String> ruleLabels,
        Map<String, List<Pattern>> discoveredPatterns,
        Map<String, Long> labelFrequency,
        Instant lastUpdate
) {

    public VocabularySnapshot {
        staticTaxonomy = copyOfLists(staticTaxonomy);
        ruleLabels = ruleLabels == null ? List.of() : List.copyOf(ruleLabels);
        discoveredPatterns = copyOfLists(discoveredPatterns);
        labelFrequency = labelFrequency == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(labelFrequency));
    }

    public static VocabularySnapshot fresh(Map<String, List<String>> staticTaxonomy, Collection<String> ruleLabels) {
        return new VocabularySnapshot(0L, staticTaxonomy, new ArrayList<>(ruleLabels), Map.of(), Map.of(), null);
    }

    /**
     * Merges one analysis batch: frequencies are added, patterns merged by description with
     * their support summed. A positive {@code maxPatternsPerCategory} keeps only the strongest
     * patterns of each category.
     */
    public VocabularySnapshot merge(Map<String, Long> observedLabels,
                                    Map<String, List<Pattern>> patterns,
                                    int maxPatternsPerCategory,
                                    Instant now) {
        Map<String, Long> frequency = new LinkedHashMap<>(labelFrequency);
        observedLabels.forEach((label, count) -> frequency.merge(label, count, Long::sum));

        Map<String, List<Pattern>> merged = new LinkedHashMap<>();
        Collection<String> categories = new LinkedHashSet<>(discoveredPatterns.keySet());
        categories.addAll(patterns.keySet());
        for (String category : categories) {
            Map<String, Long> support = new LinkedHashMap<>();
            for (Pattern p : discoveredPatterns.getOrDefault(category, List.of())) {
                support.merge(p.description(), p.support(), Long::sum);
            }
            for (Pattern p : patterns.getOrDefault(category, List.of())) {
                support.merge(p.description(), p.support(), Long::sum);
            }
            List<Pattern> list = new ArrayList<>();
            support.forEach((description, s) -> list.add(new Pattern(description, category, s)));
            if (maxPatternsPerCategory > 0 && list.size() > maxPatternsPerCategory) {
                list.sort(Comparator.comparingLong(Pattern::support).reversed());
                list.subList(maxPatternsPerCategory, list.size()).clear();
            }
            merged.put(category, list);
        }
        return new VocabularySnapshot(version + 1, staticTaxonomy, ruleLabels, merged, frequency, now);
    }

    private static <T> Map<String, List<T>> copyOfLists(Map<String, List<T>> source) {
        if (source == null) {
            return Map.of();
        }
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
