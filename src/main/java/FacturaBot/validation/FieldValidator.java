package FacturaBot.validation;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.DocumentCategory;
import FacturaBot.model.FieldCandidate;
import FacturaBot.model.FieldValue;
import FacturaBot.support.AmountText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/*
Validación y normalización de campos.
 * Un validador por tipo de campo (FieldKind).
 * Excepción del validador → se conserva el valor crudo.
 * Rechazo explícito → el campo se descarta.

Field validation and normalization.
 * One validator per FieldKind, chosen by an exhaustive switch.
 * Validator exception → field kept with its raw value.
 * Explicit rejection → field dropped.
*/
@Component
public class FieldValidator {

    private static final Logger log = LoggerFactory.getLogger(FieldValidator.class);

    static final BigDecimal MAX_AMOUNT = new BigDecimal("10000000");
    static final int TWO_DIGIT_YEAR_CUTOFF = 2030;

    // 4-digit formats first, so "08/10/25" never reads as year 25
    private static final List<DateFormat> DATE_FORMATS = List.of(
            new DateFormat(formatter("d/M/uuuu"), false),
            new DateFormat(formatter("d-M-uuuu"), false),
            new DateFormat(formatter("uuuu-M-d"), false),
            new DateFormat(formatter("d/M/uu"), true),
            new DateFormat(formatter("d-M-uu"), true));

    private static final List<Pattern> FISCAL_NUMBER_FORMATS = List.of(
            Pattern.compile("B\\d{10}"),            // series B
            Pattern.compile("E\\d{12}"),            // electronic (e-CF)
            Pattern.compile("[ABEFGHIJK]\\d{13}"));  // legacy 19-char layout without separators

    // =====================
    // Stage
    // =====================

    public ValidatedFields validateAll(Map<CanonicalField, FieldCandidate> merged,
                                       DocumentCategory category,
                                       List<String> diagnostics) {
        Map<CanonicalField, FieldValue> values = new EnumMap<>(CanonicalField.class);
        Set<CanonicalField> keptRaw = EnumSet.noneOf(CanonicalField.class);

        for (Map.Entry<CanonicalField, FieldCandidate> entry : merged.entrySet()) {
            CanonicalField field = entry.getKey();
            String raw = entry.getValue().rawValue();

            if (!category.allows(field)) {
                diagnostics.add("dropped " + field.key() + ": not expected for category " + category.key());
                continue;
            }

            try {
                Optional<FieldValue> value = validate(field, raw);
                if (value.isEmpty()) {
                    diagnostics.add("rejected " + field.key() + ": '" + raw + "'");
                    continue;
                }
                if (field.isDate() && value.get() instanceof FieldValue.FreeText) {
                    diagnostics.add("unparseable date kept as text for " + field.key() + ": '" + raw + "'");
                    keptRaw.add(field);
                }
                values.put(field, value.get());
            } catch (RuntimeException e) {
                log.warn("Validator for {} failed on '{}', keeping raw value", field.key(), raw, e);
                diagnostics.add("validator error for " + field.key() + ", raw value kept: " + e.getMessage());
                values.put(field, new FieldValue.FreeText(raw.trim()));
                keptRaw.add(field);
            }
        }

        checkAmountCoherence(values, diagnostics);
        return new ValidatedFields(values, keptRaw);
    }

    /**
     * Normalizes one raw value. Empty means the value was rejected.
     */
    public Optional<FieldValue> validate(CanonicalField field, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (field.kind()) {
            case IDENTIFIER -> identifier(field, raw);
            case CALENDAR_DATE -> Optional.of(date(raw));
            case MONEY -> money(raw);
            case FREE_TEXT -> freeText(raw);
            case FISCAL_DOCUMENT_NUMBER -> fiscalDocumentNumber(raw);
        };
    }

    // =====================
    // Kinds
    // =====================

    Optional<FieldValue> identifier(CanonicalField field, String raw) {
        String digits = raw.replaceAll("\\D", "");
        if (field.identifierLengths().contains(digits.length())) {
            return Optional.of(new FieldValue.Identifier(digits));
        }
        return Optional.of(new FieldValue.Identifier(raw.trim()));
    }

    FieldValue date(String raw) {
        String value = raw.trim();
        for (DateFormat format : DATE_FORMATS) {
            try {
                LocalDate date = LocalDate.parse(value, format.formatter());
                if (format.twoDigitYear() && date.getYear() > TWO_DIGIT_YEAR_CUTOFF) {
                    date = date.minusYears(100);
                }
                return new FieldValue.CalendarDate(date);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return new FieldValue.FreeText(value);
    }

    Optional<FieldValue> money(String raw) {
        Optional<String> normalized = AmountText.normalize(raw);
        if (normalized.isEmpty()) {
            log.debug("Not an amount: '{}'", raw);
            return Optional.empty();
        }

        BigDecimal amount = new BigDecimal(normalized.get());
        if (amount.signum() < 0 || amount.compareTo(MAX_AMOUNT) > 0) {
            return Optional.empty();
        }
        return Optional.of(new FieldValue.Money(amount));
    }

    Optional<FieldValue> freeText(String raw) {
        String text = raw.trim().replaceAll("\\s+", " ");
        if (text.length() < 2) {
            return Optional.empty();
        }
        return Optional.of(new FieldValue.FreeText(text));
    }

    Optional<FieldValue> fiscalDocumentNumber(String raw) {
        String normalized = raw.toUpperCase().replaceAll("[\\s-]", "");
        for (Pattern format : FISCAL_NUMBER_FORMATS) {
            if (format.matcher(normalized).matches()) {
                return Optional.of(new FieldValue.Identifier(normalized));
            }
        }
        return Optional.empty();
    }

    // =====================
    // Cross-field checks
    // =====================

    void checkAmountCoherence(Map<CanonicalField, FieldValue> values, List<String> diagnostics) {
        Optional<BigDecimal> total = amountOf(values, CanonicalField.TOTAL);
        Optional<BigDecimal> subtotal = amountOf(values, CanonicalField.SUBTOTAL);
        Optional<BigDecimal> itbis = amountOf(values, CanonicalField.ITBIS);
        if (total.isEmpty() || subtotal.isEmpty() || itbis.isEmpty()) {
            return;
        }
        BigDecimal discount = amountOf(values, CanonicalField.DESCUENTO).orElse(BigDecimal.ZERO);
        BigDecimal expected = subtotal.get().add(itbis.get()).subtract(discount);
        if (expected.subtract(total.get()).abs().compareTo(new BigDecimal("0.01")) > 0) {
            diagnostics.add("amounts do not add up: subtotal + itbis - descuento = "
                    + expected + ", total = " + total.get());
        }
    }

    private static Optional<BigDecimal> amountOf(Map<CanonicalField, FieldValue> values, CanonicalField field) {
        if (values.get(field) instanceof FieldValue.Money money) {
            return Optional.of(money.amount());
        }
        return Optional.empty();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private record DateFormat(DateTimeFormatter formatter, boolean twoDigitYear) {
    }
}
