package de.recon.diagnosis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "recon.patterns")
public class PatternConfig {

    private double mismatchRateThreshold = 0.5;
    private double pvDispersionThreshold = 10000.0;
    private double deltaDispersionThreshold = 0.1;
    private double temporalStdThreshold = 2.0;
    private double productOutlierRate = 0.5;
    private int minSupport = 3;

    public double getMismatchRateThreshold() { return mismatchRateThreshold; }
    public void setMismatchRateThreshold(double mismatchRateThreshold) { this.mismatchRateThreshold = mismatchRateThreshold; }

    public double getPvDispersionThreshold() { return pvDispersionThreshold; }
    public void setPvDispersionThreshold(double pvDispersionThreshold) { this.pvDispersionThreshold = pvDispersionThreshold; }

    public double getDeltaDispersionThreshold() { return deltaDispersionThreshold; }
    public void setDeltaDispersionThreshold(double deltaDispersionThreshold) { this.deltaDispersionThreshold = deltaDispersionThreshold; }

    public double getTemporalStdThreshold() { return temporalStdThreshold; }
    public void setTemporalStdThreshold(double temporalStdThreshold) { this.temporalStdThreshold = temporalStdThreshold; }

    public double getProductOutlierRate() { return productOutlierRate; }
    public void setProductOutlierRate(double productOutlierRate) { this.productOutlierRate = productOutlierRate; }

    public int getMinSupport() { return minSupport; }
    public void setMinSupport(int minSupport) { this.minSupport = minSupport; }
}
