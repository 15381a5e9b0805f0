package de.recon.diagnosis.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.recon.diagnosis.model.DiagnosisDimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the versioned YAML rule document:
 *
 * <pre>
 * formatVersion: 1
 * ruleSets:
 *   pv:
 *     - condition: "PV_old is None"
 *       label: "New trade – no prior valuation"
 *       priority: 1
 *       category: trade_lifecycle
 * </pre>
 */
public class RuleSetLoader {

    public static final int FORMAT_VERSION = 1;

    private static final Logger log = LoggerFactory.getLogger(RuleSetLoader.class);

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final ResourceLoader resourceLoader;

    public RuleSetLoader() {
        this(new DefaultResourceLoader());
    }

    public RuleSetLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public RuleSets load(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return read(in, location);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rule document " + location, e);
        }
    }

    public RuleSets read(InputStream in, String origin) throws IOException {
        RuleDocument doc = yaml.readValue(in, RuleDocument.class);
        if (doc.formatVersion != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported rule document version " + doc.formatVersion
                    + " in " + origin + " (expected " + FORMAT_VERSION + ")");
        }
        List<RuleSet> ruleSets = new ArrayList<>();
        for (Map.Entry<String, List<Rule>> e : doc.ruleSets.entrySet()) {
            ruleSets.add(new RuleSet(DiagnosisDimension.fromKey(e.getKey()), e.getValue()));
        }
        log.info("Loaded rule document origin={} ruleSets={}", origin, doc.ruleSets.keySet());
        return new RuleSets(doc.formatVersion, ruleSets);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RuleDocument {
        @JsonProperty("formatVersion")
        int formatVersion;

        @JsonProperty("ruleSets")
        Map<String, List<Rule>> ruleSets = new LinkedHashMap<>();
    }
}
