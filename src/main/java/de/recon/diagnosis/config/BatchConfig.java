package de.recon.diagnosis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recon.batch")
public class BatchConfig {

    private String input;
    private String output = "diagnosis-report.json";
    private boolean trainClassifier = true;

    public String getInput() { return input; }
    public void setInput(String input) { this.input = input; }

    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public boolean isTrainClassifier() { return trainClassifier; }
    public void setTrainClassifier(boolean trainClassifier) { this.trainClassifier = trainClassifier; }
}
