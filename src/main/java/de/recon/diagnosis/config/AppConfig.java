package de.recon.diagnosis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.recon.diagnosis.classifier.DiagnosisClassifier;
import de.recon.diagnosis.classifier.ModelBundleStore;
import de.recon.diagnosis.classifier.ModelTrainer;
import de.recon.diagnosis.patterns.PatternDiscovery;
import de.recon.diagnosis.rules.RuleSetLoader;
import de.recon.diagnosis.rules.RuleSets;
import de.recon.diagnosis.vocabulary.LabelVocabulary;
import de.recon.diagnosis.vocabulary.VocabularyStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties({
        DiagnosisConfig.class,
        PatternConfig.class,
        VocabularyConfig.class,
        ClassifierConfig.class,
        BatchConfig.class
})
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RuleSets ruleSets(ResourceLoader resourceLoader, DiagnosisConfig cfg) {
        return new RuleSetLoader(resourceLoader).load(cfg.getRulesLocation());
    }

    @Bean
    public VocabularyStore vocabularyStore(ObjectMapper objectMapper, VocabularyConfig cfg) {
        return new VocabularyStore(objectMapper, Path.of(cfg.getSnapshotPath()));
    }

    @Bean
    public LabelVocabulary labelVocabulary(VocabularyStore store, PatternDiscovery patternDiscovery,
                                           RuleSets ruleSets, VocabularyConfig cfg, Clock clock) {
        return new LabelVocabulary(store, patternDiscovery, ruleSets, cfg, clock);
    }

    @Bean
    public ModelBundleStore modelBundleStore(ObjectMapper objectMapper, ClassifierConfig cfg) {
        return new ModelBundleStore(objectMapper, Path.of(cfg.getModelDirectory()));
    }

    @Bean
    public DiagnosisClassifier diagnosisClassifier(ModelTrainer trainer, LabelVocabulary vocabulary,
                                                   ModelBundleStore store, ClassifierConfig cfg, Clock clock) {
        return new DiagnosisClassifier(trainer, vocabulary, store, cfg, clock);
    }
}
