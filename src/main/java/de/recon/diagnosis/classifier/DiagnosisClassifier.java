package de.recon.diagnosis.classifier;

import de.recon.diagnosis.config.ClassifierConfig;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;
import de.recon.diagnosis.vocabulary.LabelVocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Supervised diagnosis model per label column, trained on rule-engine output.
 * <p>
 * Each label column moves from {@link State#UNINITIALIZED} to {@link State#TRAINED} through
 * {@link #train} or {@link #load}; a later {@code train} replaces the model. Predictions are
 * closed-world: only labels of the training-time encoder are returned.
 */
public class DiagnosisClassifier {

    public enum State {
        UNINITIALIZED,
        TRAINED
    }

    private static final Logger log = LoggerFactory.getLogger(DiagnosisClassifier.class);

    private final ModelTrainer trainer;
    private final LabelVocabulary vocabulary;
    private final ModelBundleStore store;
    private final ClassifierConfig cfg;
    private final Clock clock;

    private final Map<String, ModelBundle> bundles = new ConcurrentHashMap<>();

    public DiagnosisClassifier(ModelTrainer trainer,
                               LabelVocabulary vocabulary,
                               ModelBundleStore store,
                               ClassifierConfig cfg,
                               Clock clock) {
        this.trainer = trainer;
        this.vocabulary = vocabulary;
        this.store = store;
        this.cfg = cfg;
        this.clock = clock;
    }

    public ModelBundle train(TradeDataset dataset, String labelColumn) {
        return train(dataset, labelColumn, vocabulary.generateLabels(dataset, true, true));
    }

    public ModelBundle train(TradeDataset dataset, String labelColumn, Collection<String> vocabularyLabels) {
        if (!dataset.hasColumn(labelColumn)) {
            throw ClassifierInputException.missingColumn(labelColumn);
        }
        List<TradeRow> labeled = new ArrayList<>();
        Set<String> labels = new TreeSet<>(vocabularyLabels);
        for (TradeRow row : dataset.getRows()) {
            String label = row.getString(labelColumn);
            if (label != null) {
                labeled.add(row);
                labels.add(label);
            }
        }
        if (labeled.isEmpty()) {
            throw new ClassifierInputException(ClassifierInputException.Reason.NO_LABELED_ROWS, labelColumn,
                    "No labeled rows in column " + labelColumn);
        }

        TradeDataset training = new TradeDataset(labeled);
        LabelEncoder encoder = LabelEncoder.fit(labels);
        FeatureSchema schema = FeatureSchema.fit(training);
        double[][] x = schema.encode(training, false);
        int[] y = new int[labeled.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = encoder.encode(labeled.get(i).getString(labelColumn));
        }

        DiagnosisModel model = trainer.fit(x, y, encoder.size(), schema);
        Instant now = clock.instant();
        ModelBundle bundle = new ModelBundle(
                ModelBundle.FORMAT_VERSION,
                trainer.name() + "-" + labelColumn + "-" + now.toEpochMilli(),
                labelColumn,
                trainer.name(),
                now.toString(),
                encoder.size(),
                schema.width(),
                encoder.labels(),
                schema,
                model).verify();

        store.save(bundle);
        bundles.put(labelColumn, bundle);
        log.info("Trained classifier labelColumn={} rows={} labels={} observedLabels={}",
                labelColumn, labeled.size(), encoder.size(), distinctCount(labeled, labelColumn));
        return bundle;
    }

    /**
     * One prediction per row, in row order.
     *
     * @throws ModelNotTrainedException when no model is trained or loaded for {@code labelColumn}
     * @throws ClassifierInputException when a feature column is missing, or an unseen category is
     *                                  met with {@code recon.classifier.reject-unseen-categories}
     * @throws ModelStateException      when a predicted class cannot be decoded
     */
    public List<ClassificationResult> predict(TradeDataset dataset, String labelColumn) {
        ModelBundle bundle = bundles.get(labelColumn);
        if (bundle == null) {
            throw new ModelNotTrainedException(labelColumn);
        }
        LabelEncoder encoder = bundle.labelEncoder();
        double[][] x = bundle.featureSchema().encode(dataset, cfg.isRejectUnseenCategories());

        List<ClassificationResult> results = new ArrayList<>(x.length);
        for (int r = 0; r < x.length; r++) {
            double[] proba = bundle.model().predictProba(x[r]);
            if (proba.length != encoder.size()) {
                throw new ModelStateException("Model of " + labelColumn + " returned " + proba.length
                        + " class scores, encoder has " + encoder.size());
            }
            int best = argMax(proba);
            results.add(new ClassificationResult(dataset.get(r).getTradeId(), encoder.decode(best),
                    proba[best], runnerUp(proba, best), bundle.modelVersion()));
        }
        log.info("Predicted labelColumn={} rows={} modelVersion={}", labelColumn, results.size(), bundle.modelVersion());
        return results;
    }

    public List<String> predictLabels(TradeDataset dataset, String labelColumn) {
        List<String> labels = new ArrayList<>();
        for (ClassificationResult r : predict(dataset, labelColumn)) {
            labels.add(r.getLabel());
        }
        return labels;
    }

    public ModelBundle load(String labelColumn) {
        Optional<ModelBundle> loaded = store.load(labelColumn);
        ModelBundle bundle = loaded.orElseThrow(() -> new ModelNotTrainedException(labelColumn));
        bundles.put(labelColumn, bundle);
        log.info("Loaded classifier labelColumn={} modelVersion={} labels={}",
                labelColumn, bundle.modelVersion(), bundle.labelCount());
        return bundle;
    }

    public void save(String labelColumn) {
        ModelBundle bundle = bundles.get(labelColumn);
        if (bundle == null) {
            throw new ModelNotTrainedException(labelColumn);
        }
        store.save(bundle);
    }

    public State state(String labelColumn) {
        return bundles.containsKey(labelColumn) ? State.TRAINED : State.UNINITIALIZED;
    }

    public Optional<ModelBundle> bundle(String labelColumn) {
        return Optional.ofNullable(bundles.get(labelColumn));
    }

    private static int argMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }

    private static double runnerUp(double[] values, int best) {
        double second = 0.0;
        for (int i = 0; i < values.length; i++) {
            if (i != best && values[i] > second) {
                second = values[i];
            }
        }
        return second;
    }

    private static long distinctCount(List<TradeRow> rows, String column) {
        return rows.stream().map(r -> r.getString(column)).distinct().count();
    }
}
