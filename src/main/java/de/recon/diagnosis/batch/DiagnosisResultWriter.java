package de.recon.diagnosis.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.recon.diagnosis.model.TradeRow;
import de.recon.diagnosis.pipeline.DiagnosisReport;
import de.recon.diagnosis.pipeline.DiagnosisSummary;
import de.recon.diagnosis.storage.AtomicFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class DiagnosisResultWriter {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisResultWriter.class);

    private final ObjectMapper objectMapper;

    public DiagnosisResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(DiagnosisReport report, Path target) throws IOException {
        List<Map<String, Object>> records = new ArrayList<>();
        for (TradeRow row : report.dataset().getRows()) {
            records.add(row.asMap());
        }
        byte[] payload = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(new ResultDocument(report.summary(), records));
        AtomicFiles.write(target, payload);
        log.info("Wrote diagnosis report path={} trades={} anyMismatches={}",
                target, report.summary().totalTrades(), report.summary().anyMismatches());
    }

    record ResultDocument(
            @JsonProperty("summary") DiagnosisSummary summary,
            @JsonProperty("records") List<Map<String, Object>> records
    ) {
    }
}
