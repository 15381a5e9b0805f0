package de.recon.diagnosis.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.recon.diagnosis.model.Columns;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Feature layout fixed at training time: numeric features first, then categorical features
 * with their known domains. A categorical value is encoded as its index in the domain; null
 * and values outside the domain share the unseen code {@code domain.size()}.
 */
public final class FeatureSchema {

    public static final List<String> NUMERIC_FEATURES = List.of(
            Columns.PV_OLD, Columns.PV_NEW, Columns.DELTA_OLD, Columns.DELTA_NEW,
            Columns.PV_DIFF, Columns.DELTA_DIFF);

    private final List<String> numericFeatures;
    private final List<CategoricalFeature> categoricalFeatures;

    @JsonCreator
    public FeatureSchema(@JsonProperty("numericFeatures") List<String> numericFeatures,
                         @JsonProperty("categoricalFeatures") List<CategoricalFeature> categoricalFeatures) {
        this.numericFeatures = List.copyOf(numericFeatures);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
    }

    public static FeatureSchema fit(TradeDataset dataset) {
        requireColumns(dataset);
        List<CategoricalFeature> categorical = new ArrayList<>();
        for (String column : Columns.CATEGORICAL_INPUTS) {
            TreeSet<String> domain = new TreeSet<>();
            for (TradeRow row : dataset.getRows()) {
                String v = row.getString(column);
                if (v != null) {
                    domain.add(v);
                }
            }
            categorical.add(new CategoricalFeature(column, new ArrayList<>(domain)));
        }
        return new FeatureSchema(NUMERIC_FEATURES, categorical);
    }

    public double[][] encode(TradeDataset dataset, boolean rejectUnseen) {
        requireColumns(dataset);
        List<Map<String, Integer>> codes = new ArrayList<>();
        for (CategoricalFeature feature : categoricalFeatures) {
            Map<String, Integer> m = new HashMap<>();
            for (int i = 0; i < feature.domain().size(); i++) {
                m.put(feature.domain().get(i), i);
            }
            codes.add(m);
        }

        double[][] x = new double[dataset.size()][width()];
        for (int r = 0; r < dataset.size(); r++) {
            TradeRow row = dataset.get(r);
            int col = 0;
            for (String name : numericFeatures) {
                Double v = numeric(row, name);
                x[r][col++] = v == null ? Double.NaN : v;
            }
            for (int c = 0; c < categoricalFeatures.size(); c++) {
                CategoricalFeature feature = categoricalFeatures.get(c);
                String value = row.getString(feature.name());
                Integer code = value == null ? null : codes.get(c).get(value);
                if (code == null && value != null && rejectUnseen) {
                    throw new ClassifierInputException(ClassifierInputException.Reason.UNSEEN_CATEGORY, feature.name(),
                            "Value '" + value + "' of " + feature.name() + " was not seen during training");
                }
                x[r][col++] = code == null ? feature.unseenCode() : code;
            }
        }
        return x;
    }

    @JsonIgnore
    public int width() {
        return numericFeatures.size() + categoricalFeatures.size();
    }

    @JsonIgnore
    public List<String> featureNames() {
        List<String> names = new ArrayList<>(numericFeatures);
        categoricalFeatures.forEach(f -> names.add(f.name()));
        return names;
    }

    public boolean[] categoricalMask() {
        boolean[] mask = new boolean[width()];
        for (int i = numericFeatures.size(); i < mask.length; i++) {
            mask[i] = true;
        }
        return mask;
    }

    /**
     * Number of codes per feature including the unseen code; 0 for numeric features.
     */
    public int[] cardinalities() {
        int[] card = new int[width()];
        for (int c = 0; c < categoricalFeatures.size(); c++) {
            card[numericFeatures.size() + c] = categoricalFeatures.get(c).unseenCode() + 1;
        }
        return card;
    }

    @JsonProperty("numericFeatures")
    public List<String> getNumericFeatures() { return numericFeatures; }

    @JsonProperty("categoricalFeatures")
    public List<CategoricalFeature> getCategoricalFeatures() { return categoricalFeatures; }

    private static Double numeric(TradeRow row, String name) {
        if (Columns.PV_DIFF.equals(name)) {
            return row.pvDiff();
        }
        if (Columns.DELTA_DIFF.equals(name)) {
            return row.deltaDiff();
        }
        return row.getDouble(name);
    }

    private static void requireColumns(TradeDataset dataset) {
        for (String column : Columns.NUMERIC_INPUTS) {
            if (!dataset.hasColumn(column)) {
                throw ClassifierInputException.missingColumn(column);
            }
        }
        for (String column : Columns.CATEGORICAL_INPUTS) {
            if (!dataset.hasColumn(column)) {
                throw ClassifierInputException.missingColumn(column);
            }
        }
    }

    public record CategoricalFeature(
            @JsonProperty("name") String name,
            @JsonProperty("domain") List<String> domain
    ) {
        public CategoricalFeature {
            domain = List.copyOf(domain);
        }

        public int unseenCode() {
            return domain.size();
        }
    }
}
