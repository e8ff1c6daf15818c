package FacturaBot.model;

import java.util.Optional;

/**
 * OCR text of one document plus an optional reference to where it came from.
 */
public record RawDocument(String text, String sourceRef) {

    public RawDocument {
        text = text == null ? "" : text;
    }

    public static RawDocument of(String text) {
        return new RawDocument(text, null);
    }

    public Optional<String> source() {
        return Optional.ofNullable(sourceRef);
    }
}
