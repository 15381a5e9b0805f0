package de.recon.diagnosis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "recon.vocabulary")
public class VocabularyConfig {

    private String snapshotPath = "data/label-vocabulary.json";
    private int maxPatternsPerCategory = 50;   // 0 = unbounded
    private int mostFrequentLimit = 10;

    /**
     * Overrides the built-in domain taxonomy when non-empty.
     */
    private Map<String, List<String>> taxonomy = new LinkedHashMap<>();

    public String getSnapshotPath() { return snapshotPath; }
    public void setSnapshotPath(String snapshotPath) { this.snapshotPath = snapshotPath; }

    public int getMaxPatternsPerCategory() { return maxPatternsPerCategory; }
    public void setMaxPatternsPerCategory(int maxPatternsPerCategory) { this.maxPatternsPerCategory = maxPatternsPerCategory; }

    public int getMostFrequentLimit() { return mostFrequentLimit; }
    public void setMostFrequentLimit(int mostFrequentLimit) { this.mostFrequentLimit = mostFrequentLimit; }

    public Map<String, List<String>> getTaxonomy() { return taxonomy; }
    public void setTaxonomy(Map<String, List<String>> taxonomy) { this.taxonomy = taxonomy; }
}
