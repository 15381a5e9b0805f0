package de.recon.diagnosis.classifier.boosting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import de.recon.diagnosis.classifier.DiagnosisModel;
import de.recon.diagnosis.classifier.ModelStateException;
import smile.classification.GradientTreeBoost;
import smile.data.DataFrame;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Smile gradient tree boosting model over the classes seen in training. {@code classIndex[k]}
 * is the encoder index of the booster's class {@code k}; encoder classes without training rows
 * score zero.
 */
@JsonTypeName("gradient-boosted-trees")
public final class BoostedTreesModel implements DiagnosisModel {

    private final int numClasses;
    private final int[] classIndex;
    private final List<String> featureNames;
    private final int[] cardinalities;
    private final String serializedModel;

    @JsonIgnore
    private final GradientTreeBoost booster;

    @JsonCreator
    public BoostedTreesModel(@JsonProperty("numClasses") int numClasses,
                             @JsonProperty("classIndex") int[] classIndex,
                             @JsonProperty("featureNames") List<String> featureNames,
                             @JsonProperty("cardinalities") int[] cardinalities,
                             @JsonProperty("serializedModel") String serializedModel) {
        if (classIndex == null || featureNames == null || cardinalities == null || serializedModel == null) {
            throw new ModelStateException("Boosted trees model is incomplete");
        }
        this.numClasses = numClasses;
        this.classIndex = classIndex.clone();
        this.featureNames = List.copyOf(featureNames);
        this.cardinalities = cardinalities.clone();
        this.serializedModel = serializedModel;
        this.booster = deserialize(serializedModel);
    }

    static BoostedTreesModel of(GradientTreeBoost booster, int numClasses, int[] classIndex,
                                List<String> featureNames, int[] cardinalities) {
        return new BoostedTreesModel(numClasses, classIndex, featureNames, cardinalities, serialize(booster));
    }

    @Override
    public int numClasses() {
        return numClasses;
    }

    @Override
    public double[] predictProba(double[] features) {
        if (features.length != featureNames.size()) {
            throw new ModelStateException("Expected " + featureNames.size() + " features, got " + features.length);
        }
        DataFrame row = SmileFrames.frame(featureNames, cardinalities, new double[][]{features}, new int[]{0});
        double[] posteriori = new double[classIndex.length];
        try {
            booster.predict(row.get(0), posteriori);
        } catch (RuntimeException e) {
            throw new ModelStateException("Boosted trees prediction failed", e);
        }
        double[] proba = new double[numClasses];
        for (int k = 0; k < classIndex.length; k++) {
            proba[classIndex[k]] = posteriori[k];
        }
        return proba;
    }

    @Override
    public void verify(int featureCount) {
        if (featureNames.size() != featureCount || cardinalities.length != featureCount) {
            throw new ModelStateException("Boosted trees model expects " + featureNames.size()
                    + " features, bundle records " + featureCount);
        }
        if (classIndex.length < 2 || classIndex.length > numClasses) {
            throw new ModelStateException("Boosted trees model maps " + classIndex.length
                    + " classes onto " + numClasses);
        }
        Set<Integer> seen = new HashSet<>();
        for (int c : classIndex) {
            if (c < 0 || c >= numClasses || !seen.add(c)) {
                throw new ModelStateException("Boosted trees model has invalid class index " + c);
            }
        }
        for (int c : cardinalities) {
            if (c < 0) {
                throw new ModelStateException("Boosted trees model has negative cardinality " + c);
            }
        }
    }

    @JsonProperty("numClasses")
    public int getNumClasses() { return numClasses; }

    @JsonProperty("classIndex")
    public int[] getClassIndex() { return classIndex.clone(); }

    @JsonProperty("featureNames")
    public List<String> getFeatureNames() { return featureNames; }

    @JsonProperty("cardinalities")
    public int[] getCardinalities() { return cardinalities.clone(); }

    @JsonProperty("serializedModel")
    public String getSerializedModel() { return serializedModel; }

    private static String serialize(GradientTreeBoost booster) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(booster);
        } catch (IOException e) {
            throw new ModelStateException("Failed to serialize boosted trees model", e);
        }
        return Base64.getEncoder().encodeToString(bytes.toByteArray());
    }

    private static GradientTreeBoost deserialize(String encoded) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(Base64.getDecoder().decode(encoded)))) {
            return (GradientTreeBoost) in.readObject();
        } catch (IOException | ClassNotFoundException | ClassCastException | IllegalArgumentException e) {
            throw new ModelStateException("Corrupt boosted trees model", e);
        }
    }
}
