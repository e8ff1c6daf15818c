package FacturaBot.nlp;

import java.util.List;

/**
 * Source of named entities for the heuristic extractor.
 */
public interface EntityRecognizer {

    boolean isAvailable();

    /**
     * @throws EntityRecognitionException when the service fails or answers garbage
     */
    List<RecognizedEntity> recognize(String text);

    /** Recognizer used when no service is configured. */
    static EntityRecognizer unavailable() {
        return new EntityRecognizer() {
            @Override
            public boolean isAvailable() {
                return false;
            }

            @Override
            public List<RecognizedEntity> recognize(String text) {
                return List.of();
            }
        };
    }
}
