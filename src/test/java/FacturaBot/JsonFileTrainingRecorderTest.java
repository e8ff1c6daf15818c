package FacturaBot;

import FacturaBot.model.DocumentCategory;
import FacturaBot.training.JsonFileTrainingRecorder;
import FacturaBot.training.TrainingExample;
import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileTrainingRecorderTest {

    @TempDir
    Path tempDir;

    private List<Path> files(Path dir) throws IOException {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.sorted().toList();
        }
    }

    @Test
    @DisplayName("SINK: Un archivo JSON por documento con los campos esperados")
    void testWritesOneFilePerExample() throws IOException {
        // Arrange
        Path dir = tempDir.resolve("training_data");
        JsonFileTrainingRecorder recorder = new JsonFileTrainingRecorder(dir);
        TrainingExample example = new TrainingExample("Ticket de peaje\nImporte: 200.00",
                DocumentCategory.TOLL, Map.of("total", new BigDecimal("200.00"), "rnc", "131092659"));

        // Act
        recorder.record(example);
        recorder.record(example);

        // Assert
        List<Path> written = files(dir);
        assertEquals(2, written.size());
        assertTrue(written.get(0).getFileName().toString().matches("training_\\d{8}_\\d{6}_\\d+\\.json"));

        JSONObject json = new JSONObject(Files.readString(written.get(0)));
        assertEquals("toll", json.getString("invoice_type"));
        assertEquals("200.00", json.getJSONObject("extracted_data").getString("total"));
        assertEquals(2, json.getInt("fields_found"));
        assertEquals(example.text().length(), json.getInt("text_length"));
    }

    @Test
    @DisplayName("SINK: Texto largo se recorta a 1000 caracteres + '...'")
    void testTextSampleTruncated() throws IOException {
        JsonFileTrainingRecorder recorder = new JsonFileTrainingRecorder(tempDir);

        recorder.record(new TrainingExample("a".repeat(1500), DocumentCategory.GENERIC, Map.of()));

        JSONObject json = new JSONObject(Files.readString(files(tempDir).get(0)));
        assertEquals(1003, json.getString("text_sample").length());
        assertTrue(json.getString("text_sample").endsWith("..."));
        assertEquals(1500, json.getInt("text_length"));
    }

    @Test
    @DisplayName("SINK: Directorio no escribible → UncheckedIOException")
    void testUnwritableDirectory() throws IOException {
        Path blocker = tempDir.resolve("not-a-dir");
        Files.writeString(blocker, "x");
        JsonFileTrainingRecorder recorder = new JsonFileTrainingRecorder(blocker);

        assertThrows(UncheckedIOException.class, () -> recorder.record(
                new TrainingExample("x", DocumentCategory.GENERIC, Map.of())));
    }
}
