package de.recon.diagnosis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recon.classifier")
public class ClassifierConfig {

    private String mode = "boosted";
    private String modelDirectory = "models";
    private int rounds = 60;
    private int maxDepth = 4;
    private double learningRate = 0.2;
    private int minLeafSize = 2;
    private boolean rejectUnseenCategories = false;

    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }

    public String getModelDirectory() { return modelDirectory; }
    public void setModelDirectory(String modelDirectory) { this.modelDirectory = modelDirectory; }

    public int getRounds() { return rounds; }
    public void setRounds(int rounds) { this.rounds = rounds; }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public double getLearningRate() { return learningRate; }
    public void setLearningRate(double learningRate) { this.learningRate = learningRate; }

    public int getMinLeafSize() { return minLeafSize; }
    public void setMinLeafSize(int minLeafSize) { this.minLeafSize = minLeafSize; }

    public boolean isRejectUnseenCategories() { return rejectUnseenCategories; }
    public void setRejectUnseenCategories(boolean rejectUnseenCategories) { this.rejectUnseenCategories = rejectUnseenCategories; }
}
