package FacturaBot.classify;

import FacturaBot.model.DocumentCategory;
import FacturaBot.support.TextFolding;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Características del texto para la clasificación.
 *
 * Feature vector used by both the statistical model and the keyword rules. The order of
 * {@link #FEATURE_NAMES} is the order a model file must declare.
 */
public final class CategoryFeatures {

    /** Category-defining keywords. Generic has none. */
    public static final Map<DocumentCategory, List<String>> KEYWORDS;

    static {
        Map<DocumentCategory, List<String>> keywords = new EnumMap<>(DocumentCategory.class);
        keywords.put(DocumentCategory.DOMESTIC_FISCAL, List.of("RNC", "NCF", "ITBIS", "RD$", "COMPROBANTE FISCAL", "DGII"));
        keywords.put(DocumentCategory.INTERNATIONAL, List.of("NIT", "IVA", "USD", "TAX", "INVOICE", "VAT"));
        keywords.put(DocumentCategory.TOLL, List.of("ticket", "peaje", "vehiculo", "importe", "estacion", "vial"));
        keywords.put(DocumentCategory.SIMPLE, List.of("factura", "total", "fecha", "cliente", "producto"));
        keywords.put(DocumentCategory.DETAILED, List.of("subtotal", "descuento", "impuesto", "items", "cantidad", "precio"));
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    public static final List<String> FEATURE_NAMES = List.of(
            "pattern_domestic_fiscal",
            "pattern_international",
            "pattern_toll",
            "pattern_simple",
            "pattern_detailed",
            "line_count",
            "word_count",
            "has_dates",
            "has_amounts",
            "has_numbers",
            "has_currency_rd",
            "has_currency_usd",
            "has_tax_terms",
            "has_invoice_terms",
            "has_toll_terms");

    private static final List<DocumentCategory> PATTERN_ORDER = List.of(
            DocumentCategory.DOMESTIC_FISCAL,
            DocumentCategory.INTERNATIONAL,
            DocumentCategory.TOLL,
            DocumentCategory.SIMPLE,
            DocumentCategory.DETAILED);

    private static final Pattern DATE = Pattern.compile("\\d{1,2}[-/]\\d{1,2}[-/]\\d{2,4}");
    private static final Pattern AMOUNT = Pattern.compile("\\$?\\d+[.,]\\d{2}");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    private static final List<String> TAX_TERMS = List.of("itbis", "iva", "impuesto", "tax");
    private static final List<String> INVOICE_TERMS = List.of("factura", "invoice", "comprobante");
    private static final List<String> TOLL_TERMS = List.of("ticket", "peaje", "vehiculo", "estacion", "vial");

    private final Map<String, Double> values;
    private final String folded;

    private CategoryFeatures(Map<String, Double> values, String folded) {
        this.values = values;
        this.folded = folded;
    }

    public static CategoryFeatures of(String text) {
        String raw = text == null ? "" : text;
        String folded = TextFolding.fold(raw);
        Map<String, Double> values = new LinkedHashMap<>();

        for (DocumentCategory category : PATTERN_ORDER) {
            values.put("pattern_" + category.key(), (double) TextFolding.countWords(folded, KEYWORDS.get(category)));
        }

        values.put("line_count", raw.isEmpty() ? 0.0 : (double) raw.split("\n", -1).length);
        values.put("word_count", raw.isBlank() ? 0.0 : (double) raw.trim().split("\\s+").length);
        values.put("has_dates", (double) count(DATE, raw));
        values.put("has_amounts", (double) count(AMOUNT, raw));
        values.put("has_numbers", (double) count(NUMBER, raw));
        values.put("has_currency_rd", flag(folded.contains("rd$")));
        values.put("has_currency_usd", flag(TextFolding.containsWord(folded, "usd") || raw.contains("$")));
        values.put("has_tax_terms", flag(TextFolding.countWords(folded, TAX_TERMS) > 0));
        values.put("has_invoice_terms", flag(TextFolding.countWords(folded, INVOICE_TERMS) > 0));
        values.put("has_toll_terms", flag(TextFolding.countWords(folded, TOLL_TERMS) > 0));

        return new CategoryFeatures(Collections.unmodifiableMap(values), folded);
    }

    public double[] toVector() {
        double[] vector = new double[FEATURE_NAMES.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(FEATURE_NAMES.get(i));
        }
        return vector;
    }

    public Map<String, Double> asMap() {
        return values;
    }

    /** Distinct category keywords present in the text. */
    public int keywordHits(DocumentCategory category) {
        List<String> keywords = KEYWORDS.get(category);
        return keywords == null ? 0 : TextFolding.countWords(folded, keywords);
    }

    /** Folded text the features were computed on. */
    String foldedText() {
        return folded;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static double flag(boolean condition) {
        return condition ? 1.0 : 0.0;
    }

    @Override
    public String toString() {
        return "CategoryFeatures" + values;
    }
}
