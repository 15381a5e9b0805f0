package de.recon.diagnosis.pipeline;

import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.vocabulary.VocabularySnapshot;

public record DiagnosisReport(TradeDataset dataset, DiagnosisSummary summary, VocabularySnapshot vocabulary) {
}
