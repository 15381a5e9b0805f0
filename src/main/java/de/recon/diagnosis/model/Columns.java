package de.recon.diagnosis.model;

import java.util.List;

public final class Columns {

    public static final String TRADE_ID = "TradeID";

    public static final String PV_OLD = "PV_old";
    public static final String PV_NEW = "PV_new";
    public static final String DELTA_OLD = "Delta_old";
    public static final String DELTA_NEW = "Delta_new";

    // derived, not expected on input
    public static final String PV_DIFF = "PV_Diff";
    public static final String DELTA_DIFF = "Delta_Diff";

    public static final String PRODUCT_TYPE = "ProductType";
    public static final String FUNDING_CURVE = "FundingCurve";
    public static final String CSA_TYPE = "CSA_Type";
    public static final String MODEL_VERSION = "ModelVersion";

    public static final String PV_MISMATCH = "PV_Mismatch";
    public static final String DELTA_MISMATCH = "Delta_Mismatch";
    public static final String ANY_MISMATCH = "Any_Mismatch";

    public static final String TRADE_DATE = "TradeDate";

    public static final String PV_DIAGNOSIS = "PV_Diagnosis";
    public static final String DELTA_DIAGNOSIS = "Delta_Diagnosis";
    public static final String ML_PV_DIAGNOSIS = "ML_PV_Diagnosis";
    public static final String ML_DELTA_DIAGNOSIS = "ML_Delta_Diagnosis";

    public static final List<String> NUMERIC_INPUTS = List.of(PV_OLD, PV_NEW, DELTA_OLD, DELTA_NEW);

    public static final List<String> CATEGORICAL_INPUTS =
            List.of(PRODUCT_TYPE, FUNDING_CURVE, CSA_TYPE, MODEL_VERSION);

    public static final List<String> MISMATCH_FLAGS = List.of(PV_MISMATCH, DELTA_MISMATCH);

    private Columns() {
    }
}
