package de.recon.diagnosis.classifier;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashSet;
import java.util.List;

public record ModelBundle(
        @JsonProperty("formatVersion") int formatVersion,
        @JsonProperty("modelVersion") String modelVersion,
        @JsonProperty("labelColumn") String labelColumn,
        @JsonProperty("trainer") String trainer,
        @JsonProperty("trainedAt") String trainedAt,
        @JsonProperty("labelCount") int labelCount,
        @JsonProperty("featureCount") int featureCount,
        @JsonProperty("labels") List<String> labels,
        @JsonProperty("featureSchema") FeatureSchema featureSchema,
        @JsonProperty("model") DiagnosisModel model
) {

    public static final int FORMAT_VERSION = 1;

    @JsonIgnore
    public LabelEncoder labelEncoder() {
        return LabelEncoder.restore(labels);
    }

    public ModelBundle verify() {
        if (formatVersion != FORMAT_VERSION) {
            throw new ModelStateException("Unsupported model bundle format version " + formatVersion);
        }
        if (labels == null || featureSchema == null || model == null) {
            throw new ModelStateException("Model bundle for " + labelColumn + " is incomplete");
        }
        if (labels.size() != labelCount || new HashSet<>(labels).size() != labels.size()) {
            throw new ModelStateException("Model bundle for " + labelColumn + " records " + labelCount
                    + " labels but holds " + labels.size() + " (distinct " + new HashSet<>(labels).size() + ")");
        }
        if (model.numClasses() != labelCount) {
            throw new ModelStateException("Model of " + labelColumn + " has " + model.numClasses()
                    + " classes, encoder has " + labelCount);
        }
        if (featureSchema.width() != featureCount) {
            throw new ModelStateException("Model bundle for " + labelColumn + " records " + featureCount
                    + " features but its schema has " + featureSchema.width());
        }
        model.verify(featureCount);
        return this;
    }
}
