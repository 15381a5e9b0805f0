package de.recon.diagnosis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recon.diagnosis")
public class DiagnosisConfig {

    private String rulesLocation = "classpath:rules.yml";
    private String withinToleranceLabel = "Within tolerance";
    private String unclassifiedLabel = "Unclassified";
    private boolean parallel = false;
    private int parallelism = Runtime.getRuntime().availableProcessors();

    public String getRulesLocation() { return rulesLocation; }
    public void setRulesLocation(String rulesLocation) { this.rulesLocation = rulesLocation; }

    public String getWithinToleranceLabel() { return withinToleranceLabel; }
    public void setWithinToleranceLabel(String withinToleranceLabel) { this.withinToleranceLabel = withinToleranceLabel; }

    public String getUnclassifiedLabel() { return unclassifiedLabel; }
    public void setUnclassifiedLabel(String unclassifiedLabel) { this.unclassifiedLabel = unclassifiedLabel; }

    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }

    public int getParallelism() { return parallelism; }
    public void setParallelism(int parallelism) { this.parallelism = parallelism; }
}
