package de.recon.diagnosis.rules;

import de.recon.diagnosis.DiagnosisException;
import de.recon.diagnosis.config.DiagnosisConfig;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;
import de.recon.diagnosis.rules.condition.Condition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Evaluates a rule set against trade rows.
 * <p>
 * A row whose mismatch flag is explicitly {@code false} is diagnosed with the within-tolerance label.
 * Otherwise every matching rule is collected and the highest priority wins, ties going to the rule
 * declared first. When nothing matches the unclassified label is returned.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final DiagnosisConfig cfg;
    private final Map<RuleSet, List<CompiledRule>> compiled = new ConcurrentHashMap<>();

    public RuleEngine(DiagnosisConfig cfg) {
        this.cfg = cfg;
    }

    public String getWithinToleranceLabel() {
        return cfg.getWithinToleranceLabel();
    }

    public String getUnclassifiedLabel() {
        return cfg.getUnclassifiedLabel();
    }

    public String evaluate(TradeRow row, RuleSet ruleSet) {
        String flagColumn = ruleSet.dimension().getMismatchColumn();
        if (Boolean.FALSE.equals(row.get(flagColumn))) {
            return cfg.getWithinToleranceLabel();
        }

        CompiledRule best = null;
        for (CompiledRule rule : compile(ruleSet)) {
            if (best != null && rule.priority() <= best.priority()) {
                continue;
            }
            if (matches(rule, row)) {
                best = rule;
            }
        }
        return best != null ? best.label() : cfg.getUnclassifiedLabel();
    }

    public List<String> diagnose(TradeDataset dataset, RuleSet ruleSet) {
        compile(ruleSet);
        List<String> labels;
        if (cfg.isParallel() && cfg.getParallelism() > 1 && dataset.size() > 1) {
            labels = diagnoseParallel(dataset, ruleSet);
        } else {
            labels = new ArrayList<>(dataset.size());
            for (TradeRow row : dataset.getRows()) {
                labels.add(evaluate(row, ruleSet));
            }
        }
        log.info("Diagnosed rows={} dimension={}", labels.size(), ruleSet.dimension());
        return labels;
    }

    public List<CompiledRule> compile(RuleSet ruleSet) {
        return compiled.computeIfAbsent(ruleSet, rs -> {
            List<CompiledRule> out = new ArrayList<>();
            List<Rule> rules = rs.rules();
            for (int i = 0; i < rules.size(); i++) {
                Rule rule = rules.get(i);
                try {
                    out.add(new CompiledRule(rule, Condition.parse(rule.condition()), i));
                } catch (RuleConditionException e) {
                    log.warn("Skipping rule dimension={} label={} reason={}",
                            rs.dimension(), rule.label(), e.getMessage());
                }
            }
            return List.copyOf(out);
        });
    }

    private boolean matches(CompiledRule rule, TradeRow row) {
        try {
            return rule.condition().test(row);
        } catch (RuntimeException ex) {
            RuleConditionException e = new RuleConditionException(rule.rule().condition(), "evaluation failed", ex);
            log.warn("Skipping rule label={} tradeId={} reason={}", rule.label(), row.getTradeId(), e.getMessage());
            return false;
        }
    }

    private List<String> diagnoseParallel(TradeDataset dataset, RuleSet ruleSet) {
        int workers = Math.min(cfg.getParallelism(), dataset.size());
        int chunk = (dataset.size() + workers - 1) / workers;
        List<Callable<List<String>>> tasks = new ArrayList<>();
        for (int start = 0; start < dataset.size(); start += chunk) {
            List<TradeRow> slice = dataset.getRows().subList(start, Math.min(start + chunk, dataset.size()));
            tasks.add(() -> {
                List<String> part = new ArrayList<>(slice.size());
                for (TradeRow row : slice) {
                    part.add(evaluate(row, ruleSet));
                }
                return part;
            });
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<String> labels = new ArrayList<>(dataset.size());
            for (Future<List<String>> f : pool.invokeAll(tasks)) {
                labels.addAll(f.get());
            }
            return labels;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiagnosisException("Interrupted while diagnosing " + ruleSet.dimension(), e);
        } catch (ExecutionException e) {
            throw new DiagnosisException("Rule evaluation failed for " + ruleSet.dimension(), e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    public record CompiledRule(Rule rule, Condition condition, int declarationIndex) {

        public String label() {
            return rule.label();
        }

        public int priority() {
            return rule.priority();
        }
    }
}
