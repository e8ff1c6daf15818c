package FacturaBot.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resultado inmutable de procesar un documento.
 *
 * Immutable result of processing one document: category, validated fields, quality
 * score and the diagnostics collected on the way.
 */
public final class ExtractionResult {

    // =====================
    // Fields
    // =====================

    private final Classification classification;
    private final Map<CanonicalField, ExtractedField> fields;
    private final double overallQualityScore;
    private final QualityBand qualityBand;
    private final ExtractionMethod method;
    private final List<String> diagnostics;

    public ExtractionResult(Classification classification,
                            Map<CanonicalField, ExtractedField> fields,
                            double overallQualityScore,
                            ExtractionMethod method,
                            List<String> diagnostics) {
        this.classification = classification;
        EnumMap<CanonicalField, ExtractedField> copy = new EnumMap<>(CanonicalField.class);
        copy.putAll(fields);
        this.fields = Collections.unmodifiableMap(copy);
        this.overallQualityScore = overallQualityScore;
        this.qualityBand = QualityBand.of(overallQualityScore);
        this.method = method;
        this.diagnostics = List.copyOf(diagnostics);
    }

    // =====================
    // Getters
    // =====================

    public DocumentCategory getCategory() { return classification.category(); }
    public double getClassificationConfidence() { return classification.confidence(); }
    public Classification getClassification() { return classification; }
    public Map<CanonicalField, ExtractedField> getFields() { return fields; }
    public double getOverallQualityScore() { return overallQualityScore; }
    public QualityBand getQualityBand() { return qualityBand; }
    public ExtractionMethod getMethod() { return method; }
    public List<String> getDiagnostics() { return diagnostics; }

    // =====================
    // Utility Methods
    // =====================

    public Optional<ExtractedField> field(CanonicalField field) {
        return Optional.ofNullable(fields.get(field));
    }

    public boolean has(CanonicalField field) {
        return fields.containsKey(field);
    }

    /**
     * Field map keyed by canonical name: {@link java.math.BigDecimal} for amounts,
     * {@code String} for everything else (dates as dd/MM/yyyy).
     */
    public Map<String, Object> fieldMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        fields.forEach((field, extracted) -> map.put(field.key(), extracted.value().output()));
        return Collections.unmodifiableMap(map);
    }

    public boolean isDegraded() {
        return method == ExtractionMethod.FAILSAFE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionResult other)) return false;
        return Double.compare(overallQualityScore, other.overallQualityScore) == 0
                && classification.equals(other.classification)
                && fields.equals(other.fields)
                && method == other.method
                && diagnostics.equals(other.diagnostics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classification, fields, overallQualityScore, method, diagnostics);
    }

    @Override
    public String toString() {
        return "ExtractionResult{" +
                "category=" + getCategory().key() +
                ", classificationConfidence=" + getClassificationConfidence() +
                ", fields=" + fieldMap() +
                ", overallQualityScore=" + overallQualityScore +
                ", qualityBand=" + qualityBand.key() +
                ", method=" + method.key() +
                '}';
    }
}
