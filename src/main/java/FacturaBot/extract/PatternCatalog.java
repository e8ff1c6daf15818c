package FacturaBot.extract;

import FacturaBot.model.CanonicalField;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/*
Catálogo de patrones por campo, en orden de prioridad.

Pattern catalog per canonical field, in priority order. All regexes are written
against folded text (see TextFolding), so literals are lower-case and unaccented.
Immutable once built.
*/
@Component
public class PatternCatalog {

    // =====================
    // Building blocks
    // =====================

    private static final String SP = "[ \\t]*";
    private static final String COLON = SP + "[:#]?" + SP;
    private static final String CURRENCY = "(?:rd\\$|us\\$|\\$|usd|dop|eur|€)?";
    // grouped thousands (either separator) or a plain number
    private static final String AMOUNT = COLON + CURRENCY + SP + ":?" + SP
            + "(\\d{1,3}(?:[.,]\\d{3})+(?:[.,]\\d{1,2})?(?!\\d|[.,]\\d)"
            + "|\\d+(?:[.,]\\d+)?)";
    private static final String DATE = "(\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}|\\d{4}-\\d{1,2}-\\d{1,2})";
    private static final String NUMBER_WORD = "(?:nro|no|num|numero|number|#)?\\.?";
    // token that carries at least one digit
    private static final String DOC_TOKEN = "((?=[a-z0-9/-]*\\d)[a-z0-9][a-z0-9/-]*)";
    private static final String PERCENT = "(?:" + SP + "\\(?\\d{1,2}(?:\\.\\d+)?" + SP + "%\\)?)?";

    // =====================
    // Failsafe set
    // =====================

    /** Two-decimal amount, optionally with comma thousands separators. */
    public static final Pattern FAILSAFE_AMOUNT =
            Pattern.compile("(?<![\\d,.])(?:\\d{1,3}(?:,\\d{3})+|\\d+)\\.\\d{2}(?!\\d)");
    public static final Pattern FAILSAFE_DATE = Pattern.compile("(?<!\\d)" + DATE + "(?!\\d)");
    public static final Pattern FAILSAFE_IDENTIFIER = Pattern.compile("(?<![\\d-])(\\d{11}|\\d{9})(?![\\d-])");

    private final Map<CanonicalField, List<PatternRule>> rules;

    public PatternCatalog() {
        Map<CanonicalField, List<PatternRule>> r = new EnumMap<>(CanonicalField.class);

        // =====================
        // Identification
        // =====================

        r.put(CanonicalField.RNC, List.of(
                rule(CanonicalField.RNC,
                        "\\br\\.?n\\.?c\\.?" + SP + "(?:emisor|del emisor)?" + COLON
                                + "(\\d(?:-?\\d){8}(?:(?:-?\\d){2})?)(?!\\d)",
                        "rnc", "r.n.c"),
                rule(CanonicalField.RNC,
                        "\\b(?:cedula|identificacion)" + SP + NUMBER_WORD + COLON + "(\\d{3}-?\\d{7}-?\\d)(?!\\d)",
                        "cedula", "identificacion"),
                rule(CanonicalField.RNC, "\\bnit" + COLON + "(\\d[\\d-]{6,14}\\d)", "nit"),
                rule(CanonicalField.RNC, "(?<![\\d-])(\\d{3}-\\d{7}-\\d)(?![\\d-])",
                        "rnc", "cedula", "contribuyente"),
                rule(CanonicalField.RNC, "(?<![\\d-])(\\d{9})(?![\\d-])",
                        "rnc", "contribuyente")));

        r.put(CanonicalField.NCF, List.of(
                rule(CanonicalField.NCF, "\\be-?ncf" + COLON + "(e\\d{12})\\b", "ncf"),
                rule(CanonicalField.NCF, "\\bncf" + SP + NUMBER_WORD + COLON + "([a-z]\\d{10,18})\\b", "ncf"),
                rule(CanonicalField.NCF,
                        "\\bcomprobante(?:" + SP + "fiscal)?" + SP + NUMBER_WORD + COLON + "([a-z]\\d{10,18})\\b",
                        "comprobante"),
                rule(CanonicalField.NCF, "\\b([be]\\d{10,12})\\b", "ncf", "comprobante", "fiscal")));

        r.put(CanonicalField.NUMERO_FACTURA, List.of(
                rule(CanonicalField.NUMERO_FACTURA, "\\bticket" + SP + NUMBER_WORD + COLON + DOC_TOKEN, "ticket"),
                rule(CanonicalField.NUMERO_FACTURA,
                        "\\bfactura" + SP + "(?:nro|no|num|numero|#)\\.?" + COLON + DOC_TOKEN, "factura"),
                rule(CanonicalField.NUMERO_FACTURA,
                        "\\binvoice" + SP + "(?:no|number|#)\\.?" + COLON + DOC_TOKEN, "invoice"),
                rule(CanonicalField.NUMERO_FACTURA, "\\bfactura" + SP + ":" + SP + DOC_TOKEN, "factura")));

        r.put(CanonicalField.RAZON_SOCIAL, List.of(
                rule(CanonicalField.RAZON_SOCIAL,
                        "\\b(?:razon social|nombre del emisor|nombre emisor|emisor|proveedor|compania|company|empresa)"
                                + SP + ":" + SP + "(?!(?:rnc|ncf|fecha)\\b)(\\p{L}[^\\n]{1,79})",
                        "razon social", "emisor", "proveedor", "compania", "company", "empresa")));

        // =====================
        // Dates
        // =====================

        r.put(CanonicalField.FECHA_EMISION, List.of(
                rule(CanonicalField.FECHA_EMISION,
                        "\\bfecha" + SP + "(?:de" + SP + ")?emision" + COLON + DATE, "emision")));

        r.put(CanonicalField.FECHA_VENCIMIENTO, List.of(
                rule(CanonicalField.FECHA_VENCIMIENTO,
                        "\\b(?:fecha" + SP + "(?:de" + SP + ")?)?vencimiento" + COLON + DATE, "vencimiento")));

        r.put(CanonicalField.FECHA, List.of(
                rule(CanonicalField.FECHA, "\\bfecha(?:/hora)?" + COLON + DATE, "fecha"),
                rule(CanonicalField.FECHA, "\\bdate" + COLON + DATE, "date"),
                rule(CanonicalField.FECHA, "(?<!\\d)" + DATE + "(?!\\d)", "fecha", "date", "emision")));

        // =====================
        // Amounts
        // =====================

        r.put(CanonicalField.TOTAL, List.of(
                rule(CanonicalField.TOTAL, "\\btotal" + SP + "a" + SP + "pagar" + AMOUNT, "total", "pagar"),
                rule(CanonicalField.TOTAL, "\\bmonto" + SP + "total" + AMOUNT, "monto"),
                rule(CanonicalField.TOTAL, "\\bimporte" + AMOUNT, "importe"),
                rule(CanonicalField.TOTAL,
                        "(?<!sub[- ])\\btotal(?!" + SP + "(?:itbis|impuesto|iva|descuento))"
                                + "(?:" + SP + "(?:general|factura))?" + AMOUNT,
                        "total")));

        r.put(CanonicalField.SUBTOTAL, List.of(
                rule(CanonicalField.SUBTOTAL, "\\bsub-?" + SP + "total" + AMOUNT, "sub")));

        r.put(CanonicalField.ITBIS, List.of(
                rule(CanonicalField.ITBIS, "\\b(?:total" + SP + ")?itbis" + PERCENT + AMOUNT, "itbis"),
                rule(CanonicalField.ITBIS, "\\b(?:impuestos?|iva)" + PERCENT + AMOUNT, "impuesto", "iva")));

        r.put(CanonicalField.DESCUENTO, List.of(
                rule(CanonicalField.DESCUENTO, "\\b(?:descuento|desc\\.|rebaja)" + AMOUNT,
                        "descuento", "desc", "rebaja")));

        // =====================
        // Toll tickets
        // =====================

        r.put(CanonicalField.VEHICULO, List.of(
                rule(CanonicalField.VEHICULO, "\\bvehiculo" + SP + ":" + SP + "([^\\n]{2,40})", "vehiculo")));

        r.put(CanonicalField.ESTACION, List.of(
                rule(CanonicalField.ESTACION,
                        "\\bestacion(?:" + SP + "de" + SP + "peaje)?" + SP + ":?" + SP + "([^\\n:]{2,40})",
                        "estacion")));

        this.rules = Collections.unmodifiableMap(r);
    }

    /** Rules for the field in priority order; empty when the field has none. */
    public List<PatternRule> rulesFor(CanonicalField field) {
        return rules.getOrDefault(field, List.of());
    }

    private static PatternRule rule(CanonicalField field, String regex, String... context) {
        return new PatternRule(field, Pattern.compile(regex, Pattern.CASE_INSENSITIVE),
                List.of(context), 1);
    }
}
