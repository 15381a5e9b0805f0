package de.recon.diagnosis.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.recon.diagnosis.model.Columns;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.model.TradeRow;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record DiagnosisSummary(
        @JsonProperty("total_trades") int totalTrades,
        @JsonProperty("pv_mismatches") long pvMismatches,
        @JsonProperty("delta_mismatches") long deltaMismatches,
        @JsonProperty("any_mismatches") long anyMismatches,
        @JsonProperty("mismatch_rate") double mismatchRate,
        @JsonProperty("diagnosis_distribution") Map<String, Map<String, Long>> diagnosisDistribution
) {

    public static DiagnosisSummary of(TradeDataset dataset, List<String> diagnosisColumns) {
        long pv = 0;
        long delta = 0;
        long any = 0;
        for (TradeRow row : dataset.getRows()) {
            if (row.isFlagSet(Columns.PV_MISMATCH)) pv++;
            if (row.isFlagSet(Columns.DELTA_MISMATCH)) delta++;
            if (row.anyMismatch()) any++;
        }

        Map<String, Map<String, Long>> distribution = new LinkedHashMap<>();
        for (String column : diagnosisColumns) {
            if (!dataset.hasColumn(column)) {
                continue;
            }
            Map<String, Long> counts = new TreeMap<>();
            for (Object label : dataset.column(column)) {
                if (label != null) {
                    counts.merge(label.toString(), 1L, Long::sum);
                }
            }
            distribution.put(column, counts);
        }
        double rate = dataset.isEmpty() ? 0.0 : any * 100.0 / dataset.size();
        return new DiagnosisSummary(dataset.size(), pv, delta, any, rate, distribution);
    }
}
