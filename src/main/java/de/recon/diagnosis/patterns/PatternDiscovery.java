package de.recon.diagnosis.patterns;

import de.recon.diagnosis.config.PatternConfig;
import de.recon.diagnosis.model.Columns;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

@Component
public class PatternDiscovery {

    public static final String PV_PATTERNS = "pv_patterns";
    public static final String DELTA_PATTERNS = "delta_patterns";
    public static final String TEMPORAL_PATTERNS = "temporal_patterns";
    public static final String PRODUCT_PATTERNS = "product_patterns";

    private static final Logger log = LoggerFactory.getLogger(PatternDiscovery.class);

    private final PatternConfig cfg;

    public PatternDiscovery(PatternConfig cfg) {
        this.cfg = cfg;
    }

    public Map<String, List<Pattern>> discover(TradeDataset dataset) {
        Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
        if (dataset == null || dataset.isEmpty()) {
            return patterns;
        }
        try {
            if (requires(dataset, PV_PATTERNS, Columns.PV_MISMATCH)) {
                patterns.put(PV_PATTERNS, signalPatterns(dataset, "PV", Columns.PV_MISMATCH,
                        TradeRow::pvDiff, cfg.getPvDispersionThreshold(), PV_PATTERNS));
            }
            if (requires(dataset, DELTA_PATTERNS, Columns.DELTA_MISMATCH)) {
                patterns.put(DELTA_PATTERNS, signalPatterns(dataset, "Delta", Columns.DELTA_MISMATCH,
                        TradeRow::deltaDiff, cfg.getDeltaDispersionThreshold(), DELTA_PATTERNS));
            }
            if (requires(dataset, TEMPORAL_PATTERNS, Columns.TRADE_DATE)) {
                patterns.put(TEMPORAL_PATTERNS, temporalPatterns(dataset));
            }
            if (requires(dataset, PRODUCT_PATTERNS, Columns.PRODUCT_TYPE)) {
                patterns.put(PRODUCT_PATTERNS, productPatterns(dataset));
            }
        } catch (RuntimeException e) {
            log.warn("Pattern discovery failed, continuing without patterns rows={}", dataset.size(), e);
            return new LinkedHashMap<>();
        }
        return patterns;
    }

    public static List<String> describe(Map<String, List<Pattern>> patterns) {
        List<String> out = new ArrayList<>();
        for (List<Pattern> list : patterns.values()) {
            for (Pattern p : list) {
                out.add(p.description());
            }
        }
        return out;
    }

    private List<Pattern> signalPatterns(TradeDataset dataset, String signal, String flagColumn,
                                         Function<TradeRow, Double> diff, double dispersionThreshold,
                                         String category) {
        List<Pattern> out = new ArrayList<>();
        for (String dimension : Columns.CATEGORICAL_INPUTS) {
            if (!dataset.hasColumn(dimension)) {
                continue;
            }
            for (Map.Entry<String, List<TradeRow>> group : groupBy(dataset, dimension).entrySet()) {
                List<TradeRow> rows = group.getValue();
                if (rows.size() < cfg.getMinSupport()) {
                    continue;
                }
                long mismatched = rows.stream().filter(r -> r.isFlagSet(flagColumn)).count();
                double rate = (double) mismatched / rows.size();
                if (rate > cfg.getMismatchRateThreshold()) {
                    out.add(new Pattern(String.format("High %s mismatch rate for %s=%s", signal, dimension, group.getKey()),
                            category, mismatched));
                }

                List<Double> diffs = new ArrayList<>();
                for (TradeRow r : rows) {
                    Double d = diff.apply(r);
                    if (d != null && r.isFlagSet(flagColumn)) {
                        diffs.add(Math.abs(d));
                    }
                }
                if (diffs.size() >= 2 && stdDev(diffs) > dispersionThreshold) {
                    out.add(new Pattern(String.format("High %s difference dispersion for %s=%s", signal, dimension, group.getKey()),
                            category, diffs.size()));
                }
            }
        }
        return out;
    }

    private List<Pattern> temporalPatterns(TradeDataset dataset) {
        Map<LocalDate, Long> perDay = new TreeMap<>();
        for (TradeRow row : dataset.getRows()) {
            LocalDate day = toDate(row.get(Columns.TRADE_DATE));
            if (day == null) {
                continue;
            }
            perDay.merge(day, row.anyMismatch() ? 1L : 0L, Long::sum);
        }
        List<Pattern> out = new ArrayList<>();
        if (perDay.size() < 2) {
            return out;
        }
        List<Double> counts = new ArrayList<>();
        long total = 0;
        for (long c : perDay.values()) {
            counts.add((double) c);
            total += c;
        }
        if (total >= cfg.getMinSupport() && stdDev(counts) > cfg.getTemporalStdThreshold()) {
            out.add(new Pattern("Temporal clustering of mismatches detected", TEMPORAL_PATTERNS, total));
        }
        return out;
    }

    private List<Pattern> productPatterns(TradeDataset dataset) {
        List<Pattern> out = new ArrayList<>();
        for (Map.Entry<String, List<TradeRow>> group : groupBy(dataset, Columns.PRODUCT_TYPE).entrySet()) {
            List<TradeRow> rows = group.getValue();
            if (rows.size() < cfg.getMinSupport()) {
                continue;
            }
            long mismatched = rows.stream().filter(TradeRow::anyMismatch).count();
            if ((double) mismatched / rows.size() > cfg.getProductOutlierRate()) {
                out.add(new Pattern("High mismatch rate for " + group.getKey() + " products",
                        PRODUCT_PATTERNS, mismatched));
            }
        }
        return out;
    }

    private boolean requires(TradeDataset dataset, String analysis, String column) {
        if (dataset.hasColumn(column)) {
            return true;
        }
        log.warn("Skipping {} analysis, column {} is missing", analysis, column);
        return false;
    }

    private static Map<String, List<TradeRow>> groupBy(TradeDataset dataset, String column) {
        Map<String, List<TradeRow>> groups = new TreeMap<>();
        for (TradeRow row : dataset.getRows()) {
            String key = row.getString(column);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }
        return groups;
    }

    static double stdDev(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double mean = 0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.size();
        double ss = 0;
        for (double v : values) {
            ss += (v - mean) * (v - mean);
        }
        return Math.sqrt(ss / (values.size() - 1));
    }

    private static LocalDate toDate(Object value) {
        if (value instanceof LocalDate d) {
            return d;
        }
        if (value instanceof String s && s.length() >= 10) {
            try {
                return LocalDate.parse(s.substring(0, 10));
            } catch (DateTimeParseException e) {
                log.debug("Unparseable trade date value={}", s);
            }
        }
        return null;
    }
}
