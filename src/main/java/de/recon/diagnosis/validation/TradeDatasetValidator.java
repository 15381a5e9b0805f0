package de.recon.diagnosis.validation;

import de.recon.diagnosis.model.Columns;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
public class TradeDatasetValidator {

    private static final List<String> REQUIRED = List.of(
            Columns.TRADE_ID,
            Columns.PV_OLD, Columns.PV_NEW, Columns.DELTA_OLD, Columns.DELTA_NEW,
            Columns.PRODUCT_TYPE, Columns.FUNDING_CURVE, Columns.CSA_TYPE, Columns.MODEL_VERSION,
            Columns.PV_MISMATCH, Columns.DELTA_MISMATCH
    );

    public void validate(TradeDataset dataset) {
        if (dataset == null) {
            throw new IllegalArgumentException("dataset is null");
        }
        if (dataset.isEmpty()) {
            throw new IllegalArgumentException("dataset is empty");
        }
        for (String column : REQUIRED) {
            if (!dataset.hasColumn(column)) {
                throw new IllegalArgumentException("required column " + column + " is missing");
            }
        }

        Set<String> ids = new HashSet<>();
        for (TradeRow row : dataset.getRows()) {
            String id = row.getTradeId();
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("row without " + Columns.TRADE_ID + ": " + row);
            }
            if (!ids.add(id)) {
                throw new IllegalArgumentException("duplicate " + Columns.TRADE_ID + " " + id);
            }
        }
    }
}
