package de.recon.diagnosis.pipeline;

import de.recon.diagnosis.classifier.DiagnosisClassifier;
import de.recon.diagnosis.model.DiagnosisDimension;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.rules.RuleEngine;
import de.recon.diagnosis.rules.RuleSets;
import de.recon.diagnosis.validation.TradeDatasetValidator;
import de.recon.diagnosis.vocabulary.LabelVocabulary;
import de.recon.diagnosis.vocabulary.VocabularySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class DiagnosisPipeline {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisPipeline.class);

    private final TradeDatasetValidator validator;
    private final RuleEngine ruleEngine;
    private final RuleSets ruleSets;
    private final LabelVocabulary vocabulary;
    private final DiagnosisClassifier classifier;

    public DiagnosisPipeline(TradeDatasetValidator validator,
                             RuleEngine ruleEngine,
                             RuleSets ruleSets,
                             LabelVocabulary vocabulary,
                             DiagnosisClassifier classifier) {
        this.validator = validator;
        this.ruleEngine = ruleEngine;
        this.ruleSets = ruleSets;
        this.vocabulary = vocabulary;
        this.classifier = classifier;
    }

    public DiagnosisReport run(TradeDataset input, ClassifierStage stage) {
        validator.validate(input);

        TradeDataset dataset = input;
        Map<DiagnosisDimension, List<String>> ruleOutputs = new EnumMap<>(DiagnosisDimension.class);
        for (DiagnosisDimension dimension : DiagnosisDimension.values()) {
            List<String> labels = ruleEngine.diagnose(dataset, ruleSets.forDimension(dimension));
            ruleOutputs.put(dimension, labels);
            dataset = dataset.withColumn(dimension.getDiagnosisColumn(), labels);
        }

        VocabularySnapshot snapshot = vocabulary.updateFromAnalysis(dataset, ruleOutputs);

        List<String> columns = new ArrayList<>();
        for (DiagnosisDimension dimension : DiagnosisDimension.values()) {
            columns.add(dimension.getDiagnosisColumn());
        }
        if (stage != ClassifierStage.SKIP) {
            for (DiagnosisDimension dimension : DiagnosisDimension.values()) {
                String labelColumn = dimension.getDiagnosisColumn();
                if (stage == ClassifierStage.TRAIN_AND_PREDICT) {
                    classifier.train(dataset, labelColumn,
                            vocabulary.generateLabels(snapshot, dataset, true, true));
                } else if (classifier.state(labelColumn) == DiagnosisClassifier.State.UNINITIALIZED) {
                    classifier.load(labelColumn);
                }
                dataset = dataset.withColumn(dimension.getMlDiagnosisColumn(),
                        classifier.predictLabels(dataset, labelColumn));
                columns.add(dimension.getMlDiagnosisColumn());
            }
        }

        DiagnosisSummary summary = DiagnosisSummary.of(dataset, columns);
        log.info("Diagnosis pass done trades={} anyMismatches={} classifierStage={} vocabularyVersion={}",
                summary.totalTrades(), summary.anyMismatches(), stage, snapshot.version());
        return new DiagnosisReport(dataset, summary, snapshot);
    }
}
