package de.recon.diagnosis.classifier;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "recon.classifier.mode", havingValue = "stub")
public class MajorityClassTrainer implements ModelTrainer {

    @Override
    public DiagnosisModel fit(double[][] features, int[] classes, int numClasses, FeatureSchema schema) {
        double[] priors = new double[numClasses];
        for (int c : classes) {
            priors[c] += 1.0;
        }
        for (int k = 0; k < numClasses; k++) {
            priors[k] /= Math.max(1, classes.length);
        }
        return new MajorityClassModel(priors);
    }

    @Override
    public String name() {
        return "majority-class";
    }
}
