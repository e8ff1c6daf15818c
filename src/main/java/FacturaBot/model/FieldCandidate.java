package FacturaBot.model;

/**
 * Candidate value for a field, produced by one extraction strategy and discarded after
 * merging. {@code field} is a canonical key or one of its synonyms; {@code offset} is the
 * character position in the source text, or -1 when unknown.
 */
public record FieldCandidate(String field, String rawValue, Provenance provenance, int offset) {

    public static FieldCandidate pattern(CanonicalField field, String rawValue, int offset) {
        return new FieldCandidate(field.key(), rawValue, Provenance.PATTERN, offset);
    }

    public static FieldCandidate heuristic(String field, String rawValue, int offset) {
        return new FieldCandidate(field, rawValue, Provenance.HEURISTIC, offset);
    }

    public boolean isBlank() {
        return rawValue == null || rawValue.isBlank();
    }
}
