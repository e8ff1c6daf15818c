package FacturaBot.model;

/**
 * Tipo semántico de un campo. Determina qué validador lo normaliza.
 *
 * Semantic kind of a field; selects the validator that normalizes it.
 */
public enum FieldKind {
    IDENTIFIER,
    CALENDAR_DATE,
    MONEY,
    FREE_TEXT,
    FISCAL_DOCUMENT_NUMBER
}
