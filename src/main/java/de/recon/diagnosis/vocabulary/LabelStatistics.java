package de.recon.diagnosis.vocabulary;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record LabelStatistics(
        int totalUniqueLabels,
        List<Map.Entry<String, Long>> mostFrequentLabels,
        Map<String, Long> labelFrequency,
        List<String> patternCategories,
        Instant lastUpdate,
        long version
) {
}
