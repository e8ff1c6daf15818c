package FacturaBot.classify;

/**
 * Model file missing, unreadable or incompatible with the current feature list.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
