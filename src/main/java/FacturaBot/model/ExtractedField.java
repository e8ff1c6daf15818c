package FacturaBot.model;

/**
 * Validated field with its confidence (0-100).
 */
public record ExtractedField(CanonicalField field, FieldValue value, int confidence, Provenance provenance) {

    /**
     * Level shown next to the value: high, medium, low or very_low.
     */
    public String confidenceLevel() {
        if (confidence >= 80) {
            return "high";
        } else if (confidence >= 60) {
            return "medium";
        } else if (confidence >= 40) {
            return "low";
        }
        return "very_low";
    }
}
