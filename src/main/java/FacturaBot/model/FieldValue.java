package FacturaBot.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Normalized value of an extracted field. Closed set of variants.
 */
public sealed interface FieldValue
        permits FieldValue.Money, FieldValue.CalendarDate, FieldValue.Identifier, FieldValue.FreeText {

    DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    /** Value as exposed in the result's field map: BigDecimal for money, String otherwise. */
    Object output();

    /** Amount with exactly two fraction digits, never negative. */
    record Money(BigDecimal amount) implements FieldValue {
        public Money {
            Objects.requireNonNull(amount, "amount");
            if (amount.signum() < 0) {
                throw new IllegalArgumentException("Money must not be negative: " + amount);
            }
            amount = amount.setScale(2, RoundingMode.HALF_UP);
        }

        @Override
        public Object output() { return amount; }
    }

    record CalendarDate(LocalDate date) implements FieldValue {
        public CalendarDate {
            Objects.requireNonNull(date, "date");
        }

        @Override
        public Object output() { return date.format(DATE_FORMAT); }
    }

    record Identifier(String value) implements FieldValue {
        public Identifier {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object output() { return value; }
    }

    record FreeText(String text) implements FieldValue {
        public FreeText {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public Object output() { return text; }
    }
}
