package FacturaBot;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldCandidate;
import FacturaBot.model.FieldValue;
import FacturaBot.model.QualityBand;
import FacturaBot.validation.ConfidenceScorer;
import FacturaBot.validation.TextQualityAnalyzer;
import FacturaBot.validation.ValidatedFields;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private final TextQualityAnalyzer textQuality = new TextQualityAnalyzer();
    private final ConfidenceScorer scorer = new ConfidenceScorer(textQuality);

    @Test
    @DisplayName("CAMPO: Must-have con contexto y posición esperada llega a 100")
    void testFieldConfidence_AllBonuses() {
        // RNC near the top, keyword right before it
        String text = "RNC: 131092659\n" + "x".repeat(200);
        FieldCandidate candidate = FieldCandidate.pattern(CanonicalField.RNC, "131092659", 5);

        assertEquals(100, scorer.fieldConfidence(CanonicalField.RNC, candidate, text));
    }

    @Test
    @DisplayName("CAMPO: Total al principio del documento pierde el bono de posición")
    void testFieldConfidence_TotalOutOfPosition() {
        String text = "Total 50.00\n" + "x".repeat(200);
        FieldCandidate candidate = FieldCandidate.pattern(CanonicalField.TOTAL, "50.00", 6);

        // 20 base + 30 must-have + 30 context
        assertEquals(80, scorer.fieldConfidence(CanonicalField.TOTAL, candidate, text));
    }

    @Test
    @DisplayName("CAMPO: Sin offset solo cuentan base y must-have")
    void testFieldConfidence_UnknownOffset() {
        FieldCandidate optional = FieldCandidate.heuristic("vehiculo", "LIVIANO", -1);
        FieldCandidate mustHave = FieldCandidate.heuristic("fecha", "01/01/2024", -1);

        assertEquals(20, scorer.fieldConfidence(CanonicalField.VEHICULO, optional, "Vehiculo: LIVIANO"));
        assertEquals(50, scorer.fieldConfidence(CanonicalField.FECHA, mustHave, "01/01/2024"));
    }

    @Test
    @DisplayName("GLOBAL: Texto vacío y sin campos → 0, banda baja")
    void testOverall_Empty() {
        double score = scorer.overallQuality(new ValidatedFields(Map.of(), Set.of()), 0, "");

        assertEquals(0.0, score);
        assertEquals(QualityBand.LOW, QualityBand.of(score));
    }

    @Test
    @DisplayName("GLOBAL: Todos los must-have validados en buen texto → banda alta")
    void testOverall_Complete() {
        String text = InvoiceClassifierTest.FISCAL_INVOICE;
        ValidatedFields validated = new ValidatedFields(Map.of(
                CanonicalField.RNC, new FieldValue.Identifier("101123456"),
                CanonicalField.FECHA_EMISION, new FieldValue.CalendarDate(LocalDate.of(2024, 3, 15)),
                CanonicalField.TOTAL, new FieldValue.Money(new BigDecimal("1180.00"))), Set.of());

        double score = scorer.overallQuality(validated, 3, text);

        double expected = 10.0 * (0.4 + 0.3 + 0.3 * textQuality.score(text) / 10.0);
        assertEquals(expected, score, 0.006);
        assertEquals(QualityBand.HIGH, QualityBand.of(score));
    }

    @Test
    @DisplayName("GLOBAL: Campos conservados en crudo no cuentan como validados")
    void testOverall_KeptRawLowersScore() {
        Map<CanonicalField, FieldValue> values = Map.of(
                CanonicalField.TOTAL, new FieldValue.FreeText("200.00"));

        double clean = scorer.overallQuality(new ValidatedFields(values, Set.of()), 1, "");
        double raw = scorer.overallQuality(new ValidatedFields(values, Set.of(CanonicalField.TOTAL)), 1, "");

        assertEquals(4.33, clean);
        assertEquals(1.33, raw);
    }

    @Test
    @DisplayName("OCR: Puntaje de calidad de texto entre 0 y 10")
    void testTextQuality() {
        assertEquals(0.0, textQuality.score(""));
        assertEquals(0.0, textQuality.score("hola mundo"));

        double score = textQuality.score(InvoiceClassifierTest.FISCAL_INVOICE);
        assertTrue(score > 5.0 && score <= 10.0, "score was " + score);
    }
}
