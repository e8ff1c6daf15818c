package FacturaBot.model;

/**
 * Which path produced a result: the full hybrid pipeline or the failsafe patterns used
 * after a pipeline crash.
 */
public enum ExtractionMethod {
    HYBRID("hybrid"),
    FAILSAFE("failsafe");

    private final String key;

    ExtractionMethod(String key) {
        this.key = key;
    }

    public String key() { return key; }
}
