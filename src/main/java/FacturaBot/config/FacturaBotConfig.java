package FacturaBot.config;

import FacturaBot.nlp.EntityRecognitionClient;
import FacturaBot.nlp.EntityRecognizer;
import FacturaBot.training.JsonFileTrainingRecorder;
import FacturaBot.training.TrainingRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Optional collaborators: the entity service and the training sink. Both are off
 * unless configured.
 */
@Configuration
public class FacturaBotConfig {

    private static final Logger log = LoggerFactory.getLogger(FacturaBotConfig.class);

    @Bean
    public EntityRecognizer entityRecognizer(@Value("${facturabot.nlp.base-url:}") String baseUrl,
                                             @Value("${facturabot.nlp.model:es_core_news_sm}") String model,
                                             @Value("${facturabot.nlp.timeout-seconds:10}") long timeoutSeconds,
                                             @Value("${facturabot.nlp.recheck-seconds:60}") long recheckSeconds) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("No entity service configured, heuristic extraction uses line windows only");
            return EntityRecognizer.unavailable();
        }
        return new EntityRecognitionClient(baseUrl.trim(), model, timeoutSeconds,
                Duration.ofSeconds(recheckSeconds), Clock.systemUTC());
    }

    @Bean
    public TrainingRecorder trainingRecorder(@Value("${facturabot.training.enabled:false}") boolean enabled,
                                             @Value("${facturabot.training.directory:training_data}") String directory) {
        if (!enabled) {
            return TrainingRecorder.disabled();
        }
        log.info("Recording training examples to {}", directory);
        return new JsonFileTrainingRecorder(Path.of(directory));
    }
}
