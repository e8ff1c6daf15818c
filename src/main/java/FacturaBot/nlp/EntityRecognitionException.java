package FacturaBot.nlp;

public class EntityRecognitionException extends RuntimeException {

    public EntityRecognitionException(String message) {
        super(message);
    }

    public EntityRecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
