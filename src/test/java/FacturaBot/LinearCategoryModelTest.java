package FacturaBot;

import FacturaBot.classify.CategoryFeatures;
import FacturaBot.classify.CategoryModel;
import FacturaBot.classify.CategoryModelRegistry;
import FacturaBot.classify.CategoryPrediction;
import FacturaBot.classify.LinearCategoryModel;
import FacturaBot.classify.ModelLoadException;
import FacturaBot.model.DocumentCategory;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LinearCategoryModelTest {

    @TempDir
    Path tempDir;

    /** Two-class model that only looks at pattern_toll. */
    private static JSONObject tollVsFiscalModel(List<String> features) {
        int n = CategoryFeatures.FEATURE_NAMES.size();
        double[] toll = new double[n];
        double[] fiscal = new double[n];
        toll[CategoryFeatures.FEATURE_NAMES.indexOf("pattern_toll")] = 2.0;
        fiscal[CategoryFeatures.FEATURE_NAMES.indexOf("pattern_domestic_fiscal")] = 2.0;

        return new JSONObject()
                .put("features", new JSONArray(features))
                .put("classes", new JSONArray(List.of("peaje", "domestic_fiscal")))
                .put("weights", new JSONArray().put(new JSONArray(toll)).put(new JSONArray(fiscal)))
                .put("bias", new JSONArray(new double[]{0.0, 0.0}));
    }

    private Path write(JSONObject model) throws IOException {
        Path file = tempDir.resolve("model.json");
        Files.writeString(file, model.toString());
        return file;
    }

    @Test
    @DisplayName("LOAD: Modelo válido predice la clase con más peso")
    void testLoadAndPredict() throws IOException {
        // Arrange
        Path file = write(tollVsFiscalModel(CategoryFeatures.FEATURE_NAMES));
        LinearCategoryModel model = LinearCategoryModel.load(file);

        // Act
        CategoryPrediction prediction = model.predict(
                CategoryFeatures.of("Ticket de peaje, vehiculo liviano, estacion Duarte").toVector());

        // Assert
        assertEquals(DocumentCategory.TOLL, prediction.category(), "legacy label 'peaje' maps to toll");
        assertTrue(prediction.probability() > 0.99);
    }

    @Test
    @DisplayName("LOAD: Lista de features distinta → ModelLoadException")
    void testLoad_FeatureMismatch() throws IOException {
        Path file = write(tollVsFiscalModel(List.of("line_count", "word_count")));

        ModelLoadException e = assertThrows(ModelLoadException.class, () -> LinearCategoryModel.load(file));
        assertTrue(e.getMessage().contains("do not match"));
    }

    @Test
    @DisplayName("LOAD: JSON roto → ModelLoadException")
    void testLoad_MalformedJson() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ not json");

        assertThrows(ModelLoadException.class, () -> LinearCategoryModel.load(file));
    }

    @Test
    @DisplayName("REGISTRY: Sin ruta configurada no hay modelo")
    void testRegistry_NoPath() {
        CategoryModelRegistry registry = new CategoryModelRegistry("");

        assertTrue(registry.current().isEmpty());
    }

    @Test
    @DisplayName("REGISTRY: Modelo inválido se ignora sin excepción")
    void testRegistry_InvalidModelIgnored() throws IOException {
        Path file = write(tollVsFiscalModel(List.of("only_one")));
        CategoryModelRegistry registry = new CategoryModelRegistry(file.toString());

        assertTrue(registry.current().isEmpty());
    }

    @Test
    @DisplayName("REGISTRY: Carga perezosa y reload reemplaza el modelo completo")
    void testRegistry_LazyLoadAndReload() throws IOException {
        // Arrange
        Path file = tempDir.resolve("model.json");
        CategoryModelRegistry registry = new CategoryModelRegistry(file.toString());

        // Act: file does not exist yet
        Optional<CategoryModel> before = registry.current();
        write(tollVsFiscalModel(CategoryFeatures.FEATURE_NAMES));
        Optional<CategoryModel> cached = registry.current();
        Optional<CategoryModel> reloaded = registry.reload();

        // Assert
        assertTrue(before.isEmpty());
        assertTrue(cached.isEmpty(), "first load result is cached until reload");
        assertTrue(reloaded.isPresent());
        assertSame(reloaded.get(), registry.current().orElseThrow());
    }
}
