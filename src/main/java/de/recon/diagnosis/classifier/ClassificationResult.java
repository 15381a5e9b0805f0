package de.recon.diagnosis.classifier;

public class ClassificationResult {

    private final String tradeId;
    private final String label;          // member of the training-time label set
    private final double score;          // probability of label, 0..1
    private final double runnerUpScore;  // probability of the second most likely label
    private final String modelVersion;

    public ClassificationResult(String tradeId, String label, double score, double runnerUpScore, String modelVersion) {
        this.tradeId = tradeId;
        this.label = label;
        this.score = score;
        this.runnerUpScore = runnerUpScore;
        this.modelVersion = modelVersion;
    }

    public String getTradeId() {
        return tradeId;
    }

    public String getLabel() {
        return label;
    }

    public double getScore() {
        return score;
    }

    public double getRunnerUpScore() {
        return runnerUpScore;
    }

    public double getMargin() {
        return score - runnerUpScore;
    }

    public String getModelVersion() {
        return modelVersion;
    }
}
