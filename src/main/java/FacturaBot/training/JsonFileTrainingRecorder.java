package FacturaBot.training;

import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/*
Guarda cada documento procesado como un archivo JSON para reentrenar el clasificador.

Writes one JSON file per processed document:

  training_<yyyyMMdd_HHmmss>_<n>.json
  {
    "timestamp": "...", "invoice_type": "toll", "text_sample": "...",
    "extracted_data": {...}, "text_length": 312, "fields_found": 5
  }
*/
public class JsonFileTrainingRecorder implements TrainingRecorder {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTrainingRecorder.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    static final int SAMPLE_LENGTH = 1000;

    private final Path directory;
    private final AtomicLong sequence = new AtomicLong();

    public JsonFileTrainingRecorder(Path directory) {
        this.directory = directory;
    }

    @Override
    public void record(TrainingExample example) {
        LocalDateTime now = LocalDateTime.now();
        JSONObject json = new JSONObject();
        json.put("timestamp", now.toString());
        json.put("invoice_type", example.category().key());
        json.put("text_sample", sample(example.text()));

        JSONObject data = new JSONObject();
        example.fields().forEach((key, value) ->
                data.put(key, value instanceof BigDecimal amount ? amount.toPlainString() : value));
        json.put("extracted_data", data);
        json.put("text_length", example.text().length());
        json.put("fields_found", example.fields().size());

        Path file = directory.resolve("training_" + now.format(FILE_STAMP) + "_" + sequence.incrementAndGet() + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, json.toString(2), StandardCharsets.UTF_8);
            log.debug("Training example saved to {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write training example " + file, e);
        }
    }

    static String sample(String text) {
        return text.length() > SAMPLE_LENGTH ? text.substring(0, SAMPLE_LENGTH) + "..." : text;
    }
}
