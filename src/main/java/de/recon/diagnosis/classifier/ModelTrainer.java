package de.recon.diagnosis.classifier;

public interface ModelTrainer {

    DiagnosisModel fit(double[][] features, int[] classes, int numClasses, FeatureSchema schema);

    String name();
}
