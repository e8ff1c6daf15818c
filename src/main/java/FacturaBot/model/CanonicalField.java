package FacturaBot.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * Campos canónicos que el pipeline sabe extraer.
 *
 * Canonical fields the pipeline knows how to extract. The key is the name used in the
 * exposed field map and in training records.
 */
public enum CanonicalField {

    // =====================
    // Identification
    // =====================

    RNC("rnc", FieldKind.IDENTIFIER, MergePolicy.REGEX_LOCKED, true, Set.of(9, 11)),
    NCF("ncf", FieldKind.FISCAL_DOCUMENT_NUMBER, MergePolicy.REGEX_LOCKED, false, Set.of()),
    NUMERO_FACTURA("numero_factura", FieldKind.IDENTIFIER, MergePolicy.REGEX_LOCKED, false, Set.of()),
    RAZON_SOCIAL("razon_social", FieldKind.FREE_TEXT, MergePolicy.REGEX_LOCKED, false, Set.of()),

    // =====================
    // Dates
    // =====================

    FECHA("fecha", FieldKind.CALENDAR_DATE, MergePolicy.HEURISTIC_ELIGIBLE, true, Set.of()),
    FECHA_EMISION("fecha_emision", FieldKind.CALENDAR_DATE, MergePolicy.HEURISTIC_ELIGIBLE, true, Set.of()),
    FECHA_VENCIMIENTO("fecha_vencimiento", FieldKind.CALENDAR_DATE, MergePolicy.HEURISTIC_ELIGIBLE, false, Set.of()),

    // =====================
    // Amounts
    // =====================

    SUBTOTAL("subtotal", FieldKind.MONEY, MergePolicy.HEURISTIC_ELIGIBLE, false, Set.of()),
    ITBIS("itbis", FieldKind.MONEY, MergePolicy.HEURISTIC_ELIGIBLE, false, Set.of()),
    DESCUENTO("descuento", FieldKind.MONEY, MergePolicy.PASS_THROUGH, false, Set.of()),
    TOTAL("total", FieldKind.MONEY, MergePolicy.HEURISTIC_ELIGIBLE, true, Set.of()),

    // =====================
    // Toll tickets
    // =====================

    VEHICULO("vehiculo", FieldKind.FREE_TEXT, MergePolicy.PASS_THROUGH, false, Set.of()),
    ESTACION("estacion", FieldKind.FREE_TEXT, MergePolicy.PASS_THROUGH, false, Set.of());

    private final String key;
    private final FieldKind kind;
    private final MergePolicy mergePolicy;
    private final boolean mustHave;
    private final Set<Integer> identifierLengths;

    CanonicalField(String key, FieldKind kind, MergePolicy mergePolicy, boolean mustHave,
                   Set<Integer> identifierLengths) {
        this.key = key;
        this.kind = kind;
        this.mergePolicy = mergePolicy;
        this.mustHave = mustHave;
        this.identifierLengths = identifierLengths;
    }

    public String key() { return key; }
    public FieldKind kind() { return kind; }
    public MergePolicy mergePolicy() { return mergePolicy; }
    public boolean isMustHave() { return mustHave; }

    /**
     * Digit counts accepted as a normalized identifier. Empty means the trimmed
     * original is always kept.
     */
    public Set<Integer> identifierLengths() { return identifierLengths; }

    public boolean isDate() {
        return kind == FieldKind.CALENDAR_DATE;
    }

    public static Optional<CanonicalField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String wanted = key.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(field -> field.key.equals(wanted))
                .findFirst();
    }
}
