package de.recon.diagnosis.model;

public enum DiagnosisDimension {

    PV("pv", Columns.PV_MISMATCH, Columns.PV_DIAGNOSIS, Columns.ML_PV_DIAGNOSIS),
    DELTA("delta", Columns.DELTA_MISMATCH, Columns.DELTA_DIAGNOSIS, Columns.ML_DELTA_DIAGNOSIS);

    private final String key;
    private final String mismatchColumn;
    private final String diagnosisColumn;
    private final String mlDiagnosisColumn;

    DiagnosisDimension(String key, String mismatchColumn, String diagnosisColumn, String mlDiagnosisColumn) {
        this.key = key;
        this.mismatchColumn = mismatchColumn;
        this.diagnosisColumn = diagnosisColumn;
        this.mlDiagnosisColumn = mlDiagnosisColumn;
    }

    public String getKey() { return key; }

    public String getMismatchColumn() { return mismatchColumn; }

    public String getDiagnosisColumn() { return diagnosisColumn; }

    public String getMlDiagnosisColumn() { return mlDiagnosisColumn; }

    public static DiagnosisDimension fromKey(String key) {
        for (DiagnosisDimension d : values()) {
            if (d.key.equalsIgnoreCase(key)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unknown diagnosis dimension: " + key);
    }
}
