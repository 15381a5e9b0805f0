package de.recon.diagnosis.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.recon.diagnosis.DiagnosisException;
import de.recon.diagnosis.storage.AtomicFiles;
import de.recon.diagnosis.storage.ExclusiveFileLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public class ModelBundleStore {

    private static final Logger log = LoggerFactory.getLogger(ModelBundleStore.class);

    private final ObjectMapper objectMapper;
    private final Path directory;

    public ModelBundleStore(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
    }

    public Path pathFor(String labelColumn) {
        return directory.resolve(labelColumn + ".model.json");
    }

    public void save(ModelBundle bundle) {
        Path path = pathFor(bundle.labelColumn());
        try (ExclusiveFileLock ignored = ExclusiveFileLock.acquire(path)) {
            AtomicFiles.write(path, objectMapper.writeValueAsBytes(bundle));
            log.info("Saved model bundle path={} modelVersion={} labels={}",
                    path, bundle.modelVersion(), bundle.labelCount());
        } catch (JsonProcessingException e) {
            throw new DiagnosisException("Failed to serialize model bundle for " + bundle.labelColumn(), e);
        } catch (IOException e) {
            throw new DiagnosisException("Failed to write model bundle " + path, e);
        }
    }

    public Optional<ModelBundle> load(String labelColumn) {
        Path path = pathFor(labelColumn);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        ModelBundle bundle;
        try {
            bundle = objectMapper.readValue(path.toFile(), ModelBundle.class);
        } catch (IOException e) {
            throw new ModelStateException("Failed to read model bundle " + path, e);
        }
        if (bundle == null) {
            throw new ModelStateException("Empty model bundle " + path);
        }
        if (!labelColumn.equals(bundle.labelColumn())) {
            throw new ModelStateException("Model bundle " + path + " belongs to " + bundle.labelColumn());
        }
        return Optional.of(bundle.verify());
    }
}
