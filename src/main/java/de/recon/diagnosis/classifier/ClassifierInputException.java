package de.recon.diagnosis.classifier;

import de.recon.diagnosis.DiagnosisException;

public class ClassifierInputException extends DiagnosisException {

    public enum Reason {
        MISSING_COLUMN,
        UNSEEN_CATEGORY,
        NO_LABELED_ROWS
    }

    private final Reason reason;
    private final String column;

    public ClassifierInputException(Reason reason, String column, String message) {
        super(message);
        this.reason = reason;
        this.column = column;
    }

    public static ClassifierInputException missingColumn(String column) {
        return new ClassifierInputException(Reason.MISSING_COLUMN, column, "Required column " + column + " is missing");
    }

    public Reason getReason() {
        return reason;
    }

    public String getColumn() {
        return column;
    }
}
