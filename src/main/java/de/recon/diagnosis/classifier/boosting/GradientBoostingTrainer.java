package de.recon.diagnosis.classifier.boosting;

import de.recon.diagnosis.classifier.DiagnosisModel;
import de.recon.diagnosis.classifier.FeatureSchema;
import de.recon.diagnosis.classifier.MajorityClassModel;
import de.recon.diagnosis.classifier.ModelTrainer;
import de.recon.diagnosis.config.ClassifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import smile.classification.GradientTreeBoost;
import smile.data.DataFrame;
import smile.data.formula.Formula;

import java.util.Arrays;

@Component
@ConditionalOnProperty(name = "recon.classifier.mode", havingValue = "boosted", matchIfMissing = true)
public class GradientBoostingTrainer implements ModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(GradientBoostingTrainer.class);

    private static final int MIN_NODE_SIZE = 2;

    private final ClassifierConfig cfg;

    public GradientBoostingTrainer(ClassifierConfig cfg) {
        this.cfg = cfg;
    }

    @Override
    public String name() {
        return "gradient-boosted-trees";
    }

    @Override
    public DiagnosisModel fit(double[][] features, int[] classes, int numClasses, FeatureSchema schema) {
        if (features.length != classes.length) {
            throw new IllegalArgumentException("features and classes differ in length");
        }
        if (numClasses < 1) {
            throw new IllegalArgumentException("numClasses must be positive");
        }
        int[] observed = Arrays.stream(classes).distinct().sorted().toArray();
        if (observed.length < 2) {
            double[] priors = new double[numClasses];
            priors[observed.length == 0 ? 0 : observed[0]] = 1.0;
            return new MajorityClassModel(priors);
        }
        int[] compact = new int[numClasses];
        for (int k = 0; k < observed.length; k++) {
            compact[observed[k]] = k;
        }
        int[] y = new int[classes.length];
        for (int i = 0; i < classes.length; i++) {
            y[i] = compact[classes[i]];
        }

        int[] cardinalities = schema.cardinalities();
        DataFrame frame = SmileFrames.frame(schema.featureNames(), cardinalities, features, y);
        int maxDepth = Math.max(1, cfg.getMaxDepth());
        GradientTreeBoost booster = GradientTreeBoost.fit(Formula.lhs(SmileFrames.RESPONSE), frame,
                cfg.getRounds(), maxDepth, Math.max(2, 1 << maxDepth),
                Math.max(MIN_NODE_SIZE, cfg.getMinLeafSize()), cfg.getLearningRate(), 1.0);
        log.info("Fitted boosted trees rows={} classes={} observed={} rounds={} maxDepth={}",
                features.length, numClasses, observed.length, cfg.getRounds(), maxDepth);
        return BoostedTreesModel.of(booster, numClasses, observed, schema.featureNames(), cardinalities);
    }
}
