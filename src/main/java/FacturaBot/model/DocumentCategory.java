package FacturaBot.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Categoría de factura detectada por el clasificador.
 *
 * Invoice category. Declaration order doubles as the tie-break priority of the
 * rule-based classifier.
 */
public enum DocumentCategory {

    TOLL("toll", false, EnumSet.of(CanonicalField.VEHICULO, CanonicalField.ESTACION), "peaje"),

    DOMESTIC_FISCAL("domestic_fiscal", true, EnumSet.of(
            CanonicalField.NCF, CanonicalField.SUBTOTAL, CanonicalField.ITBIS, CanonicalField.DESCUENTO,
            CanonicalField.FECHA_EMISION, CanonicalField.FECHA_VENCIMIENTO), "dominican"),

    INTERNATIONAL("international", true, EnumSet.of(
            CanonicalField.NCF, CanonicalField.SUBTOTAL, CanonicalField.ITBIS,
            CanonicalField.FECHA_EMISION, CanonicalField.FECHA_VENCIMIENTO), null),

    DETAILED("detailed", true, EnumSet.of(
            CanonicalField.NCF, CanonicalField.SUBTOTAL, CanonicalField.ITBIS, CanonicalField.DESCUENTO,
            CanonicalField.FECHA_EMISION, CanonicalField.FECHA_VENCIMIENTO), null),

    SIMPLE("simple", true, EnumSet.of(
            CanonicalField.NCF, CanonicalField.SUBTOTAL, CanonicalField.ITBIS,
            CanonicalField.FECHA_EMISION), null),

    GENERIC("generic", true, EnumSet.of(
            CanonicalField.NCF, CanonicalField.SUBTOTAL, CanonicalField.ITBIS, CanonicalField.DESCUENTO,
            CanonicalField.FECHA_EMISION, CanonicalField.FECHA_VENCIMIENTO), null);

    /** Fields every category may carry. */
    public static final Set<CanonicalField> CORE_FIELDS = EnumSet.of(
            CanonicalField.RNC,
            CanonicalField.NUMERO_FACTURA,
            CanonicalField.RAZON_SOCIAL,
            CanonicalField.FECHA,
            CanonicalField.TOTAL);

    private final String key;
    private final boolean requiresFiscalDocumentNumber;
    private final Set<CanonicalField> optionalFields;
    private final String legacyKey;

    DocumentCategory(String key, boolean requiresFiscalDocumentNumber,
                     Set<CanonicalField> optionalFields, String legacyKey) {
        this.key = key;
        this.requiresFiscalDocumentNumber = requiresFiscalDocumentNumber;
        this.optionalFields = optionalFields;
        this.legacyKey = legacyKey;
    }

    public String key() { return key; }
    public boolean requiresFiscalDocumentNumber() { return requiresFiscalDocumentNumber; }
    public Set<CanonicalField> optionalFields() { return optionalFields; }

    public boolean allows(CanonicalField field) {
        if (field == CanonicalField.NCF && !requiresFiscalDocumentNumber) {
            return false;
        }
        return CORE_FIELDS.contains(field) || optionalFields.contains(field);
    }

    /**
     * Resolves a category key; also accepts the labels older models were trained with
     * ("peaje", "dominican").
     */
    public static Optional<DocumentCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String wanted = key.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(c -> c.key.equals(wanted) || wanted.equals(c.legacyKey))
                .findFirst();
    }
}
