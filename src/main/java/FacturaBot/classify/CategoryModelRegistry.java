package FacturaBot.classify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the optional pretrained model. Loaded on first use; {@link #reload()} swaps it
 * as a whole. A missing or broken file leaves the classifier on its keyword rules.
 */
@Component
public class CategoryModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(CategoryModelRegistry.class);

    private final String modelPath;
    private final AtomicReference<Optional<CategoryModel>> model = new AtomicReference<>();

    public CategoryModelRegistry(@Value("${facturabot.classifier.model-path:}") String modelPath) {
        this.modelPath = modelPath == null ? "" : modelPath.trim();
    }

    public Optional<CategoryModel> current() {
        Optional<CategoryModel> loaded = model.get();
        if (loaded == null) {
            model.compareAndSet(null, load());
            loaded = model.get();
        }
        return loaded;
    }

    public Optional<CategoryModel> reload() {
        Optional<CategoryModel> fresh = load();
        model.set(fresh);
        return fresh;
    }

    private Optional<CategoryModel> load() {
        if (modelPath.isEmpty()) {
            log.info("No category model configured, using keyword rules");
            return Optional.empty();
        }
        Path path = Path.of(modelPath);
        if (!Files.isRegularFile(path)) {
            log.warn("Category model not found at {}, using keyword rules", path);
            return Optional.empty();
        }
        try {
            LinearCategoryModel loaded = LinearCategoryModel.load(path);
            log.info("Category model loaded from {} ({} classes)", path, loaded.classes().size());
            return Optional.of(loaded);
        } catch (ModelLoadException e) {
            log.warn("Category model rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
