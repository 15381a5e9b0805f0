package de.recon.diagnosis.classifier;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import de.recon.diagnosis.classifier.boosting.BoostedTreesModel;

/**
 * A fitted multi-class model over encoded feature rows. Class {@code i} is the label the bundle's
 * {@link LabelEncoder} maps to {@code i}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BoostedTreesModel.class, name = "gradient-boosted-trees"),
        @JsonSubTypes.Type(value = MajorityClassModel.class, name = "majority-class")
})
public interface DiagnosisModel {

    int numClasses();

    double[] predictProba(double[] features);

    /**
     * @throws ModelStateException when the model cannot score rows of {@code featureCount} features
     */
    void verify(int featureCount);
}
