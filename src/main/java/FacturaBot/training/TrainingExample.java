package FacturaBot.training;

import FacturaBot.model.DocumentCategory;

import java.util.Map;

/**
 * One processed document as handed to the training sink.
 *
 * @param fields canonical key to normalized value (BigDecimal or String)
 */
public record TrainingExample(String text, DocumentCategory category, Map<String, Object> fields) {

    public TrainingExample {
        text = text == null ? "" : text;
        fields = Map.copyOf(fields);
    }
}
