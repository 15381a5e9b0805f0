package de.recon.diagnosis.classifier;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.recon.diagnosis.TradeRows;
import de.recon.diagnosis.classifier.boosting.GradientBoostingTrainer;
import de.recon.diagnosis.config.ClassifierConfig;
import de.recon.diagnosis.config.PatternConfig;
import de.recon.diagnosis.config.VocabularyConfig;
import de.recon.diagnosis.model.Columns;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;
import de.recon.diagnosis.patterns.PatternDiscovery;
import de.recon.diagnosis.rules.RuleSets;
import de.recon.diagnosis.vocabulary.LabelVocabulary;
import de.recon.diagnosis.vocabulary.VocabularyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosisClassifierTest {

    private static final String VOL = "Vol sensitivity likely – delta impact due to model curve shift";
    private static final String TOLERANCE = "Within tolerance";
    private static final String CURVE = "Model version update – methodology changed";

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ClassifierConfig cfg;
    private ModelBundleStore store;

    @BeforeEach
    void setUp() {
        cfg = new ClassifierConfig();
        cfg.setRounds(10);
        store = new ModelBundleStore(objectMapper, dir.resolve("models"));
    }

    private DiagnosisClassifier classifier() {
        return classifier(new GradientBoostingTrainer(cfg));
    }

    private DiagnosisClassifier classifier(ModelTrainer trainer) {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        LabelVocabulary vocabulary = new LabelVocabulary(
                new VocabularyStore(objectMapper, dir.resolve("vocabulary.json")),
                new PatternDiscovery(new PatternConfig()),
                new RuleSets(1, List.of()),
                new VocabularyConfig(),
                clock);
        return new DiagnosisClassifier(trainer, vocabulary, store, cfg, clock);
    }

    @Test
    void train_shouldEncodeExactlyTheObservedLabelsWithoutVocabulary() {
        ModelBundle bundle = classifier().train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());

        assertThat(bundle.labelCount()).isEqualTo(3);
        assertThat(bundle.labels()).containsExactly(CURVE, VOL, TOLERANCE);
        assertThat(bundle.model().numClasses()).isEqualTo(3);
        assertThat(bundle.modelVersion()).startsWith("gradient-boosted-trees-PV_Diagnosis-");
    }

    @Test
    void predict_shouldReproduceTrainingLabelsForSeparableData() {
        DiagnosisClassifier classifier = classifier();
        TradeDataset dataset = threeProducts();
        classifier.train(dataset, Columns.PV_DIAGNOSIS, List.of());

        List<String> predicted = classifier.predictLabels(dataset, Columns.PV_DIAGNOSIS);

        assertThat(predicted).containsExactlyElementsOf(labelsOf(dataset));
    }

    @Test
    void predict_shouldOnlyReturnTrainingLabelsWithScores() {
        DiagnosisClassifier classifier = classifier();
        ModelBundle bundle = classifier.train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());

        List<ClassificationResult> results = classifier.predict(threeProducts(), Columns.PV_DIAGNOSIS);

        assertThat(results).extracting(ClassificationResult::getTradeId).startsWith("O0", "S0", "F0");
        assertThat(results).allSatisfy(r -> {
            assertThat(bundle.labels()).contains(r.getLabel());
            assertThat(r.getScore()).isBetween(0.0, 1.0);
            assertThat(r.getMargin()).isGreaterThan(0.0);
            assertThat(r.getModelVersion()).isEqualTo(bundle.modelVersion());
        });
    }

    @Test
    void predict_shouldMapUnseenCategoriesToATrainingLabel() {
        DiagnosisClassifier classifier = classifier();
        ModelBundle bundle = classifier.train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());
        TradeDataset unseen = new TradeDataset(List.of(TradeRows.swap("N1")
                .set(Columns.PRODUCT_TYPE, "Bond")
                .set(Columns.FUNDING_CURVE, "JPY-TONA")
                .set(Columns.CSA_TYPE, "None")
                .set(Columns.MODEL_VERSION, "v2030.1")
                .build()));

        List<String> predicted = classifier.predictLabels(unseen, Columns.PV_DIAGNOSIS);

        assertThat(predicted).hasSize(1);
        assertThat(bundle.labels()).contains(predicted.get(0));
    }

    @Test
    void predict_shouldRejectUnseenCategoriesInStrictMode() {
        cfg.setRejectUnseenCategories(true);
        DiagnosisClassifier classifier = classifier();
        classifier.train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());
        TradeDataset unseen = new TradeDataset(List.of(TradeRows.swap("N1").set(Columns.PRODUCT_TYPE, "Bond").build()));

        assertThatThrownBy(() -> classifier.predict(unseen, Columns.PV_DIAGNOSIS))
                .isInstanceOfSatisfying(ClassifierInputException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(ClassifierInputException.Reason.UNSEEN_CATEGORY);
                    assertThat(e.getColumn()).isEqualTo(Columns.PRODUCT_TYPE);
                });
    }

    @Test
    void predict_shouldFailBeforeTraining() {
        DiagnosisClassifier classifier = classifier();

        assertThat(classifier.state(Columns.PV_DIAGNOSIS)).isEqualTo(DiagnosisClassifier.State.UNINITIALIZED);
        assertThatThrownBy(() -> classifier.predict(threeProducts(), Columns.PV_DIAGNOSIS))
                .isInstanceOf(ModelNotTrainedException.class);
    }

    @Test
    void train_shouldReportMissingFeatureColumn() {
        TradeDataset withoutCsa = new TradeDataset(List.of(
                option("O1").remove(Columns.CSA_TYPE).build(),
                TradeRows.swap("S1").remove(Columns.CSA_TYPE).set(Columns.PV_DIAGNOSIS, TOLERANCE).build()));

        assertThatThrownBy(() -> classifier().train(withoutCsa, Columns.PV_DIAGNOSIS, List.of()))
                .isInstanceOfSatisfying(ClassifierInputException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(ClassifierInputException.Reason.MISSING_COLUMN);
                    assertThat(e.getColumn()).isEqualTo(Columns.CSA_TYPE);
                });
    }

    @Test
    void train_shouldRejectDatasetWithoutLabels() {
        TradeDataset unlabeled = new TradeDataset(List.of(
                TradeRows.swap("T1").set(Columns.PV_DIAGNOSIS, null).build()));

        assertThatThrownBy(() -> classifier().train(unlabeled, Columns.PV_DIAGNOSIS, List.of()))
                .isInstanceOfSatisfying(ClassifierInputException.class, e ->
                        assertThat(e.getReason()).isEqualTo(ClassifierInputException.Reason.NO_LABELED_ROWS));
    }

    @Test
    void load_shouldRestoreAModelThatPredictsLikeTheTrainedOne() {
        DiagnosisClassifier trained = classifier();
        TradeDataset dataset = threeProducts();
        ModelBundle bundle = trained.train(dataset, Columns.PV_DIAGNOSIS, List.of());

        DiagnosisClassifier restored = classifier();
        ModelBundle loaded = restored.load(Columns.PV_DIAGNOSIS);

        assertThat(restored.state(Columns.PV_DIAGNOSIS)).isEqualTo(DiagnosisClassifier.State.TRAINED);
        assertThat(loaded.modelVersion()).isEqualTo(bundle.modelVersion());
        assertThat(loaded.labels()).isEqualTo(bundle.labels());
        assertThat(restored.predictLabels(dataset, Columns.PV_DIAGNOSIS))
                .isEqualTo(trained.predictLabels(dataset, Columns.PV_DIAGNOSIS));
    }

    @Test
    void load_shouldFailWhenNothingWasSaved() {
        assertThatThrownBy(() -> classifier().load(Columns.DELTA_DIAGNOSIS))
                .isInstanceOf(ModelNotTrainedException.class);
    }

    @Test
    void load_shouldRejectBundleWhoseLabelCountDisagrees() throws Exception {
        classifier().train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());
        Path file = store.pathFor(Columns.PV_DIAGNOSIS);
        ObjectNode doc = (ObjectNode) objectMapper.readTree(file.toFile());
        doc.put("labelCount", 4);
        objectMapper.writeValue(file.toFile(), doc);

        assertThatThrownBy(() -> classifier().load(Columns.PV_DIAGNOSIS))
                .isInstanceOf(ModelStateException.class);
    }

    @Test
    void load_shouldRejectCorruptDocument() throws Exception {
        classifier().train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());
        Files.writeString(store.pathFor(Columns.PV_DIAGNOSIS), "{\"formatVersion\":");

        assertThatThrownBy(() -> classifier().load(Columns.PV_DIAGNOSIS))
                .isInstanceOf(ModelStateException.class);
    }

    @Test
    void load_shouldRejectModelWhoseClassIndexPointsPastTheEncoder() throws Exception {
        classifier().train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());
        Path file = store.pathFor(Columns.PV_DIAGNOSIS);
        ObjectNode doc = (ObjectNode) objectMapper.readTree(file.toFile());
        ((ObjectNode) doc.get("model")).putArray("classIndex").add(0).add(1).add(99);
        objectMapper.writeValue(file.toFile(), doc);

        assertThatThrownBy(() -> classifier().load(Columns.PV_DIAGNOSIS))
                .isInstanceOf(ModelStateException.class);
    }

    @Test
    void load_shouldRejectModelWithDamagedTrees() throws Exception {
        classifier().train(threeProducts(), Columns.PV_DIAGNOSIS, List.of());
        Path file = store.pathFor(Columns.PV_DIAGNOSIS);
        ObjectNode doc = (ObjectNode) objectMapper.readTree(file.toFile());
        String trees = doc.get("model").get("serializedModel").asText();
        ((ObjectNode) doc.get("model")).put("serializedModel", trees.substring(0, trees.length() / 2));
        objectMapper.writeValue(file.toFile(), doc);

        assertThatThrownBy(() -> classifier().load(Columns.PV_DIAGNOSIS))
                .isInstanceOf(ModelStateException.class);
    }

    @Test
    void train_shouldHandleTwoClasses() {
        List<TradeRow> rows = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            rows.add(option("O" + i).build());
            rows.add(TradeRows.swap("S" + i).set(Columns.PV_DIAGNOSIS, TOLERANCE).build());
        }
        TradeDataset dataset = new TradeDataset(rows);
        DiagnosisClassifier classifier = classifier();

        ModelBundle bundle = classifier.train(dataset, Columns.PV_DIAGNOSIS, List.of());

        assertThat(bundle.labelCount()).isEqualTo(2);
        assertThat(classifier.predictLabels(dataset, Columns.PV_DIAGNOSIS)).containsExactlyElementsOf(labelsOf(dataset));
    }

    @Test
    void train_shouldHandleASingleClass() {
        TradeDataset dataset = new TradeDataset(List.of(
                TradeRows.swap("S1").set(Columns.PV_DIAGNOSIS, TOLERANCE).build(),
                TradeRows.swap("S2").set(Columns.PV_DIAGNOSIS, TOLERANCE).build()));
        DiagnosisClassifier classifier = classifier();

        classifier.train(dataset, Columns.PV_DIAGNOSIS, List.of());

        assertThat(classifier.predict(dataset, Columns.PV_DIAGNOSIS))
                .allSatisfy(r -> {
                    assertThat(r.getLabel()).isEqualTo(TOLERANCE);
                    assertThat(r.getScore()).isEqualTo(1.0);
                });
    }

    @Test
    void train_shouldAddVocabularyLabelsToTheEncoder() {
        ModelBundle bundle = classifier().train(threeProducts(), Columns.PV_DIAGNOSIS);

        assertThat(bundle.labels())
                .contains(VOL, TOLERANCE, CURVE, "Credit event – counterparty risk changed")
                .doesNotHaveDuplicates();
        assertThat(bundle.labelCount()).isGreaterThan(3);
    }

    @Test
    void train_shouldUseTheConfiguredTrainer() {
        DiagnosisClassifier classifier = classifier(new MajorityClassTrainer());
        TradeDataset dataset = new TradeDataset(List.of(
                option("O1").build(),
                TradeRows.swap("S1").set(Columns.PV_DIAGNOSIS, TOLERANCE).build(),
                TradeRows.swap("S2").set(Columns.PV_DIAGNOSIS, TOLERANCE).build()));

        ModelBundle bundle = classifier.train(dataset, Columns.PV_DIAGNOSIS, List.of());

        assertThat(bundle.trainer()).isEqualTo("majority-class");
        assertThat(bundle.model()).isInstanceOf(MajorityClassModel.class);
        assertThat(classifier.predictLabels(dataset, Columns.PV_DIAGNOSIS)).containsOnly(TOLERANCE);
        assertThat(classifier().load(Columns.PV_DIAGNOSIS).model()).isInstanceOf(MajorityClassModel.class);
    }

    /**
     * Twelve rows whose label is fully determined by the product type.
     */
    private static TradeDataset threeProducts() {
        List<TradeRow> rows = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            rows.add(option("O" + i).build());
            rows.add(TradeRows.swap("S" + i).set(Columns.PV_DIAGNOSIS, TOLERANCE).build());
            rows.add(TradeRows.swap("F" + i).set(Columns.PRODUCT_TYPE, "FRA")
                    .set(Columns.PV_DIAGNOSIS, CURVE).build());
        }
        return new TradeDataset(rows);
    }

    private static TradeRows option(String tradeId) {
        return TradeRows.swap(tradeId).set(Columns.PRODUCT_TYPE, "Option").set(Columns.PV_DIAGNOSIS, VOL);
    }

    private static List<String> labelsOf(TradeDataset dataset) {
        List<String> labels = new ArrayList<>();
        for (TradeRow row : dataset.getRows()) {
            labels.add(row.getString(Columns.PV_DIAGNOSIS));
        }
        return labels;
    }
}
