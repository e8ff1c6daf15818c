package FacturaBot.classify;

import FacturaBot.model.Classification;
import FacturaBot.model.DocumentCategory;
import FacturaBot.support.FallbackLadder;
import FacturaBot.support.TextFolding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/*
Clasificador de tipo de factura.
 * Usa el modelo estadístico si está cargado y es suficientemente seguro,
 * si no, reglas de palabras clave.

Invoice category classifier.
 * Uses the statistical model when one is loaded and confident enough,
 * otherwise keyword rules. Never throws.
*/
@Service
public class InvoiceClassifier {

    private static final Logger log = LoggerFactory.getLogger(InvoiceClassifier.class);

    static final double MODEL_THRESHOLD = 0.6;
    static final double RULES_CONFIDENCE = 0.8;

    private final CategoryModelRegistry registry;
    private final FallbackLadder<CategoryFeatures, Classification> ladder;

    public InvoiceClassifier(CategoryModelRegistry registry) {
        this.registry = registry;
        this.ladder = FallbackLadder.<CategoryFeatures, Classification>forStage("classification")
                .attempt("statistical-model", this::classifyWithModel)
                .orElse(this::classifyWithRules);
    }

    public Classification classify(String text) {
        CategoryFeatures features = CategoryFeatures.of(text);
        Classification result = ladder.run(features);
        log.info("Classified as {} ({}, confidence {})",
                result.category().key(), result.source(), result.confidence());
        return result;
    }

    private Optional<Classification> classifyWithModel(CategoryFeatures features) {
        Optional<CategoryModel> model = registry.current();
        if (model.isEmpty()) {
            return Optional.empty();
        }
        CategoryPrediction prediction = model.get().predict(features.toVector());
        if (prediction.probability() <= MODEL_THRESHOLD) {
            log.debug("Model unsure: {} at {}", prediction.category().key(), prediction.probability());
            return Optional.empty();
        }
        return Optional.of(new Classification(
                prediction.category(), prediction.probability(), Classification.Source.MODEL));
    }

    Classification classifyWithRules(CategoryFeatures features) {
        Map<DocumentCategory, Integer> scores = ruleScores(features);

        // declaration order is the priority; only a strictly higher score displaces
        DocumentCategory best = DocumentCategory.GENERIC;
        int bestScore = 0;
        for (DocumentCategory category : DocumentCategory.values()) {
            int score = scores.getOrDefault(category, 0);
            if (score > bestScore) {
                best = category;
                bestScore = score;
            }
        }
        log.debug("Rule scores: {}", scores);
        return new Classification(best, RULES_CONFIDENCE, Classification.Source.RULES);
    }

    Map<DocumentCategory, Integer> ruleScores(CategoryFeatures features) {
        String text = features.foldedText();
        Map<DocumentCategory, Integer> scores = new EnumMap<>(DocumentCategory.class);
        for (DocumentCategory category : CategoryFeatures.KEYWORDS.keySet()) {
            scores.put(category, features.keywordHits(category));
        }

        if (has(text, "rnc")) {
            scores.merge(DocumentCategory.DOMESTIC_FISCAL, 2, Integer::sum);
        }

        int toll = 0;
        if (has(text, "ticket") && has(text, "peaje")) toll += 3;
        if (has(text, "vehiculo") && has(text, "importe")) toll += 2;
        if (has(text, "estacion")) toll += 1;
        if (has(text, "fideicomiso") && has(text, "vial")) toll += 2;
        if (has(text, "operador") && has(text, "peaje")) toll += 1;
        scores.merge(DocumentCategory.TOLL, toll, Integer::sum);

        return scores;
    }

    private static boolean has(String foldedText, String keyword) {
        return TextFolding.containsWord(foldedText, keyword);
    }
}
