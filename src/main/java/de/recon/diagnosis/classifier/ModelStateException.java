package de.recon.diagnosis.classifier;

import de.recon.diagnosis.DiagnosisException;

public class ModelStateException extends DiagnosisException {

    public ModelStateException(String message) {
        super(message);
    }

    public ModelStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
