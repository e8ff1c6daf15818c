package FacturaBot.parser;

import FacturaBot.classify.InvoiceClassifier;
import FacturaBot.extract.FailsafeExtractor;
import FacturaBot.extract.HeuristicExtractor;
import FacturaBot.extract.RegexExtractor;
import FacturaBot.extract.ResultMerger;
import FacturaBot.model.CanonicalField;
import FacturaBot.model.Classification;
import FacturaBot.model.DocumentCategory;
import FacturaBot.model.ExtractedField;
import FacturaBot.model.ExtractionMethod;
import FacturaBot.model.ExtractionResult;
import FacturaBot.model.FieldCandidate;
import FacturaBot.model.FieldValue;
import FacturaBot.model.Provenance;
import FacturaBot.model.RawDocument;
import FacturaBot.support.FallbackLadder;
import FacturaBot.training.TrainingExample;
import FacturaBot.training.TrainingRecorder;
import FacturaBot.validation.ConfidenceScorer;
import FacturaBot.validation.FieldValidator;
import FacturaBot.validation.ValidatedFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/*

Pipeline de extracción de datos de facturas.
 * Clasificación → regex + heurística → fusión → validación → confianza.
 * Si algo falla de forma inesperada se usan los patrones mínimos (failsafe).


Invoice extraction pipeline.
 * Classification → regex + heuristics → merge → validation → scoring.
 * Any unexpected failure falls back to the minimal failsafe patterns; parse never throws.

*/
@Service
public class InvoiceParser {

    private static final Logger log = LoggerFactory.getLogger(InvoiceParser.class);

    static final double FAILSAFE_CLASSIFICATION_CONFIDENCE = 0.1;
    static final int FAILSAFE_FIELD_CONFIDENCE = 10;
    static final double FAILSAFE_QUALITY = 1.0;

    private final InvoiceClassifier classifier;
    private final RegexExtractor regexExtractor;
    private final HeuristicExtractor heuristicExtractor;
    private final ResultMerger merger;
    private final FieldValidator validator;
    private final ConfidenceScorer scorer;
    private final FailsafeExtractor failsafeExtractor;
    private final TrainingRecorder trainingRecorder;
    private final FallbackLadder<RawDocument, ExtractionResult> pipeline;

    public InvoiceParser(InvoiceClassifier classifier,
                         RegexExtractor regexExtractor,
                         HeuristicExtractor heuristicExtractor,
                         ResultMerger merger,
                         FieldValidator validator,
                         ConfidenceScorer scorer,
                         FailsafeExtractor failsafeExtractor,
                         TrainingRecorder trainingRecorder) {
        this.classifier = classifier;
        this.regexExtractor = regexExtractor;
        this.heuristicExtractor = heuristicExtractor;
        this.merger = merger;
        this.validator = validator;
        this.scorer = scorer;
        this.failsafeExtractor = failsafeExtractor;
        this.trainingRecorder = trainingRecorder;
        this.pipeline = FallbackLadder.<RawDocument, ExtractionResult>forStage("pipeline")
                .attempt("hybrid", document -> Optional.of(hybrid(document)))
                .orElse(this::failsafe);
    }

    public ExtractionResult parse(String text) {
        return parse(RawDocument.of(text));
    }

    public ExtractionResult parse(RawDocument document) {
        log.info("Processing {} ({} chars)", document.source().orElse("<text>"), document.text().length());
        ExtractionResult result = pipeline.run(document);
        if (result.getMethod() == ExtractionMethod.HYBRID) {
            record(document, result);
        }
        log.info("Result: {} fields, quality {} ({}), method {}", result.getFields().size(),
                result.getOverallQualityScore(), result.getQualityBand().key(), result.getMethod().key());
        return result;
    }

    // =====================
    // Hybrid path
    // =====================

    private ExtractionResult hybrid(RawDocument document) {
        String text = document.text();
        List<String> diagnostics = new ArrayList<>();

        Classification classification = classifier.classify(text);
        Map<CanonicalField, FieldCandidate> patterns = regexExtractor.extract(text);
        List<FieldCandidate> heuristics = heuristicExtractor.extract(text);
        Map<CanonicalField, FieldCandidate> merged = merger.merge(patterns, heuristics);

        ValidatedFields validated = validator.validateAll(merged, classification.category(), diagnostics);

        Map<CanonicalField, ExtractedField> fields = new EnumMap<>(CanonicalField.class);
        validated.values().forEach((field, value) -> {
            FieldCandidate source = merged.get(field);
            fields.put(field, new ExtractedField(field, value,
                    scorer.fieldConfidence(field, source, text), source.provenance()));
        });

        double quality = scorer.overallQuality(validated, merged.size(), text);
        diagnostics.forEach(d -> log.debug("Diagnostic: {}", d));
        return new ExtractionResult(classification, fields, quality, ExtractionMethod.HYBRID, diagnostics);
    }

    // =====================
    // Failsafe path
    // =====================

    private ExtractionResult failsafe(RawDocument document) {
        log.warn("Hybrid extraction failed, using failsafe patterns");
        List<String> diagnostics = new ArrayList<>();
        diagnostics.add("hybrid extraction failed, failsafe patterns used");

        Map<CanonicalField, ExtractedField> fields = new EnumMap<>(CanonicalField.class);
        failsafeExtractor.extract(document.text()).forEach((field, candidate) -> {
            try {
                Optional<FieldValue> value = validator.validate(field, candidate.rawValue());
                value.ifPresent(v -> fields.put(field,
                        new ExtractedField(field, v, FAILSAFE_FIELD_CONFIDENCE, Provenance.FAILSAFE)));
            } catch (RuntimeException e) {
                diagnostics.add("failsafe dropped " + field.key() + ": " + e.getMessage());
            }
        });

        Classification classification = new Classification(
                DocumentCategory.GENERIC, FAILSAFE_CLASSIFICATION_CONFIDENCE, Classification.Source.FAILSAFE);
        return new ExtractionResult(classification, fields, FAILSAFE_QUALITY, ExtractionMethod.FAILSAFE, diagnostics);
    }

    private void record(RawDocument document, ExtractionResult result) {
        try {
            trainingRecorder.record(new TrainingExample(document.text(), result.getCategory(), result.fieldMap()));
        } catch (RuntimeException e) {
            log.warn("Training example not recorded: {}", e.getMessage());
        }
    }
}
