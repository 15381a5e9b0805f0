package de.recon.diagnosis.batch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.recon.diagnosis.model.TradeDataset;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
public class TradeDatasetReader {

    private static final TypeReference<List<Map<String, Object>>> RECORDS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public TradeDatasetReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TradeDataset read(Path file) throws IOException {
        List<Map<String, Object>> records = objectMapper.readValue(file.toFile(), RECORDS);
        return TradeDataset.ofMaps(records);
    }
}
