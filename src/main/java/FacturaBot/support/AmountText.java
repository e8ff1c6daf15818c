package FacturaBot.support;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normaliza importes escritos con separadores locales a texto decimal plano.
 *
 * Turns "RD$ 1.234,56", "1,180.00" or "1.234" into "1234.56", "1180.00", "1234".
 * The last separator decides: followed by exactly three digits in a grouped number it
 * is a thousands separator, otherwise it is the decimal mark. More than two fraction
 * digits is not an amount.
 */
public final class AmountText {

    private static final Pattern CURRENCY_MARKERS = Pattern.compile("(?i)rd\\$|us\\$|usd|dop|eur|€|\\$");
    private static final Pattern THOUSANDS_COMMA = Pattern.compile("-?\\d{1,3}(?:,\\d{3})+");
    private static final Pattern THOUSANDS_DOT = Pattern.compile("-?\\d{1,3}(?:\\.\\d{3})+");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("-?\\d+(?:\\.\\d{1,2})?");

    private AmountText() {
    }

    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String clean = CURRENCY_MARKERS.matcher(raw).replaceAll("").replaceAll("[^\\d.,-]", "");
        if (clean.isEmpty()) {
            return Optional.empty();
        }

        int lastComma = clean.lastIndexOf(',');
        int lastDot = clean.lastIndexOf('.');
        if (THOUSANDS_COMMA.matcher(clean).matches()) {
            clean = clean.replace(",", "");
        } else if (THOUSANDS_DOT.matcher(clean).matches()) {
            clean = clean.replace(".", "");
        } else if (lastComma > lastDot) {
            clean = clean.replace(".", "").replace(",", ".");
        } else if (lastDot > lastComma) {
            clean = clean.replace(",", "");
        }

        return PLAIN_DECIMAL.matcher(clean).matches() ? Optional.of(clean) : Optional.empty();
    }
}
