package de.recon.diagnosis.classifier;

import de.recon.diagnosis.DiagnosisException;

public class ModelNotTrainedException extends DiagnosisException {

    public ModelNotTrainedException(String labelColumn) {
        super("No trained model for label column " + labelColumn + ", call train or load first");
    }
}
