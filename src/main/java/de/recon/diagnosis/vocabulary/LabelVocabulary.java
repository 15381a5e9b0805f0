package de.recon.diagnosis.vocabulary;

import de.recon.diagnosis.config.VocabularyConfig;
import de.recon.diagnosis.model.DiagnosisDimension;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.patterns.Pattern;
import de.recon.diagnosis.patterns.PatternDiscovery;
import de.recon.diagnosis.rules.RuleSet;
import de.recon.diagnosis.rules.RuleSets;
import de.recon.diagnosis.storage.ExclusiveFileLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public class LabelVocabulary {

    private static final Logger log = LoggerFactory.getLogger(LabelVocabulary.class);

    private final VocabularyStore store;
    private final PatternDiscovery patternDiscovery;
    private final RuleSets ruleSets;
    private final VocabularyConfig cfg;
    private final Clock clock;
    private final Map<String, List<String>> taxonomy;

    private volatile VocabularySnapshot current;

    public LabelVocabulary(VocabularyStore store,
                           PatternDiscovery patternDiscovery,
                           RuleSets ruleSets,
                           VocabularyConfig cfg,
                           Clock clock) {
        this.store = store;
        this.patternDiscovery = patternDiscovery;
        this.ruleSets = ruleSets;
        this.cfg = cfg;
        this.clock = clock;
        this.taxonomy = StaticTaxonomy.resolve(cfg.getTaxonomy());
        this.current = load();
    }

    public VocabularySnapshot snapshot() {
        return current;
    }

    public VocabularySnapshot reload() {
        current = load();
        return current;
    }

    public List<String> generateLabels(TradeDataset dataset, boolean includeDiscovered, boolean includeHistorical) {
        return generateLabels(current, dataset, includeDiscovered, includeHistorical);
    }

    /**
     * Sorted, deduplicated candidate labels: static taxonomy and rule labels always, patterns
     * discovered in {@code dataset} and historical patterns / observed labels on request.
     */
    public List<String> generateLabels(VocabularySnapshot snapshot, TradeDataset dataset,
                                       boolean includeDiscovered, boolean includeHistorical) {
        Set<String> labels = new TreeSet<>();
        snapshot.staticTaxonomy().values().forEach(labels::addAll);
        labels.addAll(snapshot.ruleLabels());

        if (includeDiscovered && dataset != null) {
            labels.addAll(PatternDiscovery.describe(patternDiscovery.discover(dataset)));
        }
        if (includeHistorical) {
            for (List<Pattern> patterns : snapshot.discoveredPatterns().values()) {
                for (Pattern p : patterns) {
                    labels.add(p.description());
                }
            }
            snapshot.labelFrequency().forEach((label, count) -> {
                if (count > 0) {
                    labels.add(label);
                }
            });
        }
        return List.copyOf(labels);
    }

    public VocabularySnapshot updateFromAnalysis(TradeDataset dataset,
                                                 Map<DiagnosisDimension, List<String>> ruleOutputs) {
        Map<String, Long> observed = new LinkedHashMap<>();
        for (List<String> labels : ruleOutputs.values()) {
            for (String label : labels) {
                if (label != null) {
                    observed.merge(label, 1L, Long::sum);
                }
            }
        }
        Map<String, List<Pattern>> patterns = patternDiscovery.discover(dataset);

        ExclusiveFileLock lock;
        try {
            lock = store.lock();
        } catch (VocabularyPersistenceException e) {
            log.warn("Vocabulary lock unavailable, updating in memory only path={}", store.getPath(), e);
            return publish(rebase(current).merge(observed, patterns, cfg.getMaxPatternsPerCategory(), clock.instant()));
        }
        try (ExclusiveFileLock ignored = lock) {
            VocabularySnapshot updated = rebase(latestPersisted()).merge(observed, patterns, cfg.getMaxPatternsPerCategory(), clock.instant());
            try {
                store.write(updated);
            } catch (VocabularyPersistenceException e) {
                log.warn("Vocabulary snapshot not persisted, keeping it in memory version={}", updated.version(), e);
            }
            return publish(updated);
        } catch (IOException e) {
            throw new VocabularyPersistenceException("Failed to release vocabulary lock " + store.getPath(), e);
        }
    }

    private VocabularySnapshot publish(VocabularySnapshot updated) {
        current = updated;
        log.info("Vocabulary updated version={} labels={} patternCategories={}",
                updated.version(), updated.labelFrequency().size(), updated.discoveredPatterns().keySet());
        return updated;
    }

    public LabelStatistics getStatistics() {
        VocabularySnapshot s = current;
        List<Map.Entry<String, Long>> top = new ArrayList<>(s.labelFrequency().entrySet());
        top.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        List<Map.Entry<String, Long>> mostFrequent = new ArrayList<>();
        for (Map.Entry<String, Long> e : top.subList(0, Math.min(cfg.getMostFrequentLimit(), top.size()))) {
            mostFrequent.add(Map.entry(e.getKey(), e.getValue()));
        }
        return new LabelStatistics(
                s.labelFrequency().size(),
                List.copyOf(mostFrequent),
                s.labelFrequency(),
                List.copyOf(s.discoveredPatterns().keySet()),
                s.lastUpdate(),
                s.version());
    }

    public Map<String, List<String>> getLabelCategories() {
        VocabularySnapshot s = current;
        Map<String, List<String>> categories = new LinkedHashMap<>();
        for (RuleSet ruleSet : ruleSets.all()) {
            categories.put(ruleSet.dimension().getKey(), List.copyOf(ruleSet.labels()));
        }
        categories.putAll(s.staticTaxonomy());
        List<String> discovered = new ArrayList<>();
        s.discoveredPatterns().values().forEach(list -> list.forEach(p -> discovered.add(p.description())));
        if (!discovered.isEmpty()) {
            categories.put("discovered_patterns", discovered);
        }
        return categories;
    }

    private VocabularySnapshot load() {
        VocabularySnapshot fresh = VocabularySnapshot.fresh(taxonomy, ruleLabels());
        try {
            return store.read().map(this::rebase).orElse(fresh);
        } catch (VocabularyPersistenceException e) {
            log.warn("Falling back to static taxonomy vocabulary path={}", store.getPath(), e);
            return fresh;
        }
    }

    private VocabularySnapshot latestPersisted() {
        try {
            return store.read().orElse(current);
        } catch (VocabularyPersistenceException e) {
            log.warn("Persisted vocabulary unreadable, merging into in-memory snapshot version={}",
                    current.version(), e);
            return current;
        }
    }

    private VocabularySnapshot rebase(VocabularySnapshot s) {
        return new VocabularySnapshot(s.version(), taxonomy, new ArrayList<>(ruleLabels()),
                s.discoveredPatterns(), s.labelFrequency(), s.lastUpdate());
    }

    private Collection<String> ruleLabels() {
        Set<String> labels = new LinkedHashSet<>();
        for (RuleSet ruleSet : ruleSets.all()) {
            labels.addAll(ruleSet.labels());
        }
        return labels;
    }
}
