package de.recon.diagnosis.vocabulary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.recon.diagnosis.patterns.Pattern;
import de.recon.diagnosis.storage.AtomicFiles;
import de.recon.diagnosis.storage.ExclusiveFileLock;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class VocabularyStore {

    public static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final Path path;

    public VocabularyStore(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public Optional<VocabularySnapshot> read() {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        SnapshotDocument doc;
        try {
            doc = objectMapper.readValue(path.toFile(), SnapshotDocument.class);
        } catch (IOException e) {
            throw new VocabularyPersistenceException("Failed to read vocabulary snapshot " + path, e);
        }
        if (doc == null) {
            throw new VocabularyPersistenceException("Empty vocabulary snapshot " + path);
        }
        if (doc.formatVersion != FORMAT_VERSION) {
            throw new VocabularyPersistenceException("Unsupported vocabulary format version "
                    + doc.formatVersion + " in " + path);
        }
        try {
            return Optional.of(doc.toSnapshot());
        } catch (DateTimeParseException | NullPointerException e) {
            throw new VocabularyPersistenceException("Corrupt vocabulary snapshot " + path, e);
        }
    }

    public void write(VocabularySnapshot snapshot) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(SnapshotDocument.from(snapshot));
            AtomicFiles.write(path, json);
        } catch (JsonProcessingException e) {
            throw new VocabularyPersistenceException("Failed to serialize vocabulary snapshot", e);
        } catch (IOException e) {
            throw new VocabularyPersistenceException("Failed to write vocabulary snapshot " + path, e);
        }
    }

    public ExclusiveFileLock lock() {
        try {
            return ExclusiveFileLock.acquire(path);
        } catch (IOException e) {
            throw new VocabularyPersistenceException("Failed to lock vocabulary snapshot " + path, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SnapshotDocument {

        @JsonProperty("formatVersion")
        public int formatVersion = FORMAT_VERSION;

        @JsonProperty("version")
        public long version;

        @JsonProperty("static_taxonomy")
        public Map<String, List<String>> staticTaxonomy = new LinkedHashMap<>();

        @JsonProperty("rule_labels")
        public List<String> ruleLabels = new ArrayList<>();

        @JsonProperty("discovered_patterns")
        public Map<String, List<Pattern>> discoveredPatterns = new LinkedHashMap<>();

        @JsonProperty("label_frequency")
        public Map<String, Long> labelFrequency = new LinkedHashMap<>();

        @JsonProperty("last_update")
        public String lastUpdate;

        static SnapshotDocument from(VocabularySnapshot s) {
            SnapshotDocument doc = new SnapshotDocument();
            doc.version = s.version();
            doc.staticTaxonomy = s.staticTaxonomy();
            doc.ruleLabels = s.ruleLabels();
            doc.discoveredPatterns = s.discoveredPatterns();
            doc.labelFrequency = s.labelFrequency();
            doc.lastUpdate = s.lastUpdate() == null ? null : s.lastUpdate().toString();
            return doc;
        }

        VocabularySnapshot toSnapshot() {
            return new VocabularySnapshot(version, staticTaxonomy, ruleLabels, discoveredPatterns,
                    labelFrequency, lastUpdate == null ? null : Instant.parse(lastUpdate));
        }
    }
}
