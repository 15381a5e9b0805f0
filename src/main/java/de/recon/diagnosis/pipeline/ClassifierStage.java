package de.recon.diagnosis.pipeline;

public enum ClassifierStage {
    /** rule diagnosis only */
    SKIP,
    /** retrain on this batch's rule output, then predict */
    TRAIN_AND_PREDICT,
    /** predict with the trained or persisted model */
    PREDICT
}
