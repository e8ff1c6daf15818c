package FacturaBot.extract;

import FacturaBot.model.CanonicalField;

import java.util.Map;
import java.util.Optional;

/**
 * Field names produced by the heuristic strategies (and by older training records)
 * mapped to their canonical field.
 */
public final class FieldSynonyms {

    private static final Map<String, CanonicalField> SYNONYMS = Map.ofEntries(
            Map.entry("monto_detectado", CanonicalField.TOTAL),
            Map.entry("fecha_detectada", CanonicalField.FECHA),
            Map.entry("empresa_detectada", CanonicalField.RAZON_SOCIAL),
            Map.entry("numero_documento", CanonicalField.RNC),
            Map.entry("rnc_emisor", CanonicalField.RNC),
            Map.entry("nit", CanonicalField.RNC),
            Map.entry("comprobante", CanonicalField.NCF),
            Map.entry("impuestos", CanonicalField.ITBIS),
            Map.entry("iva", CanonicalField.ITBIS),
            Map.entry("nombre_emisor", CanonicalField.RAZON_SOCIAL),
            Map.entry("fecha_factura", CanonicalField.FECHA));

    private FieldSynonyms() {
    }

    /** Canonical field for a canonical key or a known synonym. */
    public static Optional<CanonicalField> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Optional<CanonicalField> canonical = CanonicalField.fromKey(name);
        if (canonical.isPresent()) {
            return canonical;
        }
        return Optional.ofNullable(SYNONYMS.get(name.trim().toLowerCase()));
    }
}
