package de.recon.diagnosis.vocabulary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class StaticTaxonomy {

    private static final Map<String, List<String>> DEFAULTS;

    static {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("trade_lifecycle", List.of(
                "New trade – no prior valuation",
                "Trade dropped from new model",
                "Trade amended with new terms",
                "Trade matured or expired"));
        m.put("curve_model", List.of(
                "Legacy LIBOR curve with outdated model – PV likely shifted",
                "SOFR transition impact – curve basis changed",
                "Model version update – methodology changed",
                "Curve interpolation changed – end points affected"));
        m.put("funding_csa", List.of(
                "CSA changed post-clearing – funding basis moved",
                "Collateral threshold changed – funding cost shifted",
                "New clearing house – margin requirements different",
                "Bilateral to cleared transition – funding curve changed"));
        m.put("volatility", List.of(
                "Vol sensitivity likely – delta impact due to model curve shift",
                "Vol surface updated – smile/skew changed",
                "Market stress – vol regime shifted",
                "Option-specific model change – vol dynamics affected"));
        m.put("tolerance", List.of(
                "Within tolerance",
                "Minor deviation – no action required",
                "Acceptable range – monitor for trends"));
        m.put("data_quality", List.of(
                "Missing data – incomplete valuation",
                "Data corruption – invalid inputs",
                "Timing mismatch – stale data",
                "System error – calculation failed"));
        m.put("market_events", List.of(
                "Market volatility – broad repricing",
                "Credit event – counterparty risk changed",
                "Regulatory change – capital requirements updated",
                "Liquidity crisis – funding costs spiked"));
        DEFAULTS = Collections.unmodifiableMap(m);
    }

    private StaticTaxonomy() {
    }

    public static Map<String, List<String>> defaults() {
        return DEFAULTS;
    }

    public static Map<String, List<String>> resolve(Map<String, List<String>> configured) {
        if (configured == null || configured.isEmpty()) {
            return DEFAULTS;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        configured.forEach((category, labels) -> copy.put(category, List.copyOf(labels)));
        return Collections.unmodifiableMap(copy);
    }
}
