package FacturaBot.model;

/**
 * Outcome of document classification.
 *
 * @param category   detected category
 * @param confidence 0..1; a fixed constant when the keyword rules decided
 * @param source     which rung of the classification ladder produced it
 */
public record Classification(DocumentCategory category, double confidence, Source source) {

    public enum Source {
        MODEL,
        RULES,
        FAILSAFE
    }
}
