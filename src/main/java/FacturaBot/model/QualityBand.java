package FacturaBot.model;

public enum QualityBand {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String key;

    QualityBand(String key) {
        this.key = key;
    }

    public String key() { return key; }

    /**
     * ≥7 high, [4,7) medium, below 4 low.
     */
    public static QualityBand of(double score) {
        if (score >= 7.0) {
            return HIGH;
        } else if (score >= 4.0) {
            return MEDIUM;
        }
        return LOW;
    }
}
