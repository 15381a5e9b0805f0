package de.recon.diagnosis.batch;

import de.recon.diagnosis.config.BatchConfig;
import de.recon.diagnosis.model.TradeDataset;
import de.recon.diagnosis.pipeline.ClassifierStage;
import de.recon.diagnosis.pipeline.DiagnosisPipeline;
import de.recon.diagnosis.pipeline.DiagnosisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConditionalOnProperty(name = "recon.batch.input")
public class DiagnosisBatchRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DiagnosisBatchRunner.class);

    private final BatchConfig cfg;
    private final TradeDatasetReader reader;
    private final DiagnosisPipeline pipeline;
    private final DiagnosisResultWriter writer;

    public DiagnosisBatchRunner(BatchConfig cfg,
                                TradeDatasetReader reader,
                                DiagnosisPipeline pipeline,
                                DiagnosisResultWriter writer) {
        this.cfg = cfg;
        this.reader = reader;
        this.pipeline = pipeline;
        this.writer = writer;
    }

    @Override
    public void run(String... args) {
        try {
            TradeDataset dataset = reader.read(Path.of(cfg.getInput()));

            ClassifierStage stage = cfg.isTrainClassifier() ? ClassifierStage.TRAIN_AND_PREDICT : ClassifierStage.PREDICT;
            DiagnosisReport report = pipeline.run(dataset, stage);

            writer.write(report, Path.of(cfg.getOutput()));

        } catch (Exception ex) {

            log.warn("Failed to process diagnosis batch. input={}", cfg.getInput(), ex);
        }
    }
}
