package de.recon.diagnosis.vocabulary;

import de.recon.diagnosis.DiagnosisException;

public class VocabularyPersistenceException extends DiagnosisException {

    public VocabularyPersistenceException(String message) {
        super(message);
    }

    public VocabularyPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
