package de.recon.diagnosis.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("majority-class")
public final class MajorityClassModel implements DiagnosisModel {

    private final double[] priors;

    @JsonCreator
    public MajorityClassModel(@JsonProperty("priors") double[] priors) {
        if (priors == null) {
            throw new ModelStateException("Majority class model has no priors");
        }
        this.priors = priors.clone();
    }

    @JsonProperty("priors")
    public double[] getPriors() {
        return priors.clone();
    }

    @Override
    public int numClasses() {
        return priors.length;
    }

    @Override
    public double[] predictProba(double[] features) {
        return priors.clone();
    }

    @Override
    public void verify(int featureCount) {
        double total = 0.0;
        for (double p : priors) {
            if (!(p >= 0.0 && p <= 1.0)) {
                throw new ModelStateException("Majority class model has invalid prior " + p);
            }
            total += p;
        }
        if (priors.length == 0 || Math.abs(total - 1.0) > 1e-6) {
            throw new ModelStateException("Majority class priors sum to " + total);
        }
    }
}
