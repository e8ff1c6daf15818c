package FacturaBot.classify;

import FacturaBot.model.DocumentCategory;

/**
 * Most probable category and its probability (0..1).
 */
public record CategoryPrediction(DocumentCategory category, double probability) {
}
