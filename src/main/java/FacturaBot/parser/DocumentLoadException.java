package FacturaBot.parser;

/**
 * Input file could not be turned into text.
 */
public class DocumentLoadException extends Exception {

    public DocumentLoadException(String message) {
        super(message);
    }

    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
