package FacturaBot.validation;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldCandidate;
import FacturaBot.support.TextFolding;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Confianza por campo y calidad global.
 *
 * Per-field confidence (0-100) and overall quality (0-10).
 */
@Component
public class ConfidenceScorer {

    static final int BASE = 20;
    static final int MUST_HAVE_BONUS = 30;
    static final int CONTEXT_BONUS = 30;
    static final int POSITION_BONUS = 20;
    static final int CONTEXT_RADIUS = 100;

    private static final Map<CanonicalField, List<String>> CONTEXT = new EnumMap<>(CanonicalField.class);
    private static final Map<CanonicalField, int[]> POSITION = new EnumMap<>(CanonicalField.class);

    static {
        List<String> dates = List.of("fecha", "date", "emision", "vencim");
        List<String> money = List.of("total", "pagar", "importe", "monto");

        CONTEXT.put(CanonicalField.RNC, List.of("rnc", "cedula", "identificacion", "nit", "contribuyente"));
        CONTEXT.put(CanonicalField.NCF, List.of("ncf", "comprobante", "fiscal"));
        CONTEXT.put(CanonicalField.NUMERO_FACTURA, List.of("factura", "ticket", "invoice", "nro", "no."));
        CONTEXT.put(CanonicalField.RAZON_SOCIAL,
                List.of("razon social", "emisor", "proveedor", "empresa", "company", "compania", "nombre"));
        CONTEXT.put(CanonicalField.FECHA, dates);
        CONTEXT.put(CanonicalField.FECHA_EMISION, dates);
        CONTEXT.put(CanonicalField.FECHA_VENCIMIENTO, dates);
        CONTEXT.put(CanonicalField.TOTAL, money);
        CONTEXT.put(CanonicalField.SUBTOTAL, List.of("subtotal", "sub-total", "sub total"));
        CONTEXT.put(CanonicalField.ITBIS, List.of("itbis", "impuesto", "iva", "tax"));
        CONTEXT.put(CanonicalField.DESCUENTO, List.of("descuento", "desc", "rebaja"));
        CONTEXT.put(CanonicalField.VEHICULO, List.of("vehiculo"));
        CONTEXT.put(CanonicalField.ESTACION, List.of("estacion", "peaje"));

        POSITION.put(CanonicalField.RNC, new int[]{0, 40});
        POSITION.put(CanonicalField.NCF, new int[]{0, 40});
        POSITION.put(CanonicalField.NUMERO_FACTURA, new int[]{0, 40});
        POSITION.put(CanonicalField.RAZON_SOCIAL, new int[]{0, 30});
        POSITION.put(CanonicalField.FECHA, new int[]{0, 50});
        POSITION.put(CanonicalField.FECHA_EMISION, new int[]{0, 50});
        POSITION.put(CanonicalField.FECHA_VENCIMIENTO, new int[]{0, 50});
        POSITION.put(CanonicalField.TOTAL, new int[]{60, 100});
        POSITION.put(CanonicalField.SUBTOTAL, new int[]{40, 100});
        POSITION.put(CanonicalField.ITBIS, new int[]{40, 100});
        POSITION.put(CanonicalField.DESCUENTO, new int[]{40, 100});
    }

    private final TextQualityAnalyzer textQuality;

    public ConfidenceScorer(TextQualityAnalyzer textQuality) {
        this.textQuality = textQuality;
    }

    public int fieldConfidence(CanonicalField field, FieldCandidate candidate, String text) {
        int score = BASE;
        if (field.isMustHave()) {
            score += MUST_HAVE_BONUS;
        }
        int offset = candidate.offset();
        if (offset >= 0 && text != null && !text.isEmpty()) {
            if (TextFolding.anyFragmentNear(text, offset, CONTEXT_RADIUS, CONTEXT.getOrDefault(field, List.of()))) {
                score += CONTEXT_BONUS;
            }
            if (inExpectedPosition(field, offset, text.length())) {
                score += POSITION_BONUS;
            }
        }
        return Math.min(score, 100);
    }

    /**
     * 10 x (0.4 must-have coverage + 0.3 validated share + 0.3 text quality / 10),
     * rounded half-up to two decimals.
     */
    public double overallQuality(ValidatedFields validated, int mergedCount, String text) {
        Map<CanonicalField, ?> values = validated.values();
        int mustHave = 0;
        if (values.containsKey(CanonicalField.RNC)) mustHave++;
        if (values.containsKey(CanonicalField.FECHA) || values.containsKey(CanonicalField.FECHA_EMISION)) mustHave++;
        if (values.containsKey(CanonicalField.TOTAL)) mustHave++;

        double mustHaveShare = mustHave / 3.0;
        double validatedShare = mergedCount == 0 ? 0.0 : (double) validated.passedCount() / mergedCount;
        double quality = textQuality.score(text) / 10.0;

        double overall = 10.0 * (0.4 * mustHaveShare + 0.3 * validatedShare + 0.3 * quality);
        return BigDecimal.valueOf(overall).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static boolean inExpectedPosition(CanonicalField field, int offset, int length) {
        int[] window = POSITION.getOrDefault(field, new int[]{0, 100});
        double percent = offset * 100.0 / length;
        return percent >= window[0] && percent <= window[1];
    }
}
