package FacturaBot.extract;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldCandidate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Minimal extraction used when the hybrid pipeline blew up: largest amount as total,
 * first date as fecha, first standalone 9/11-digit number as rnc.
 */
@Component
public class FailsafeExtractor {

    public Map<CanonicalField, FieldCandidate> extract(String text) {
        Map<CanonicalField, FieldCandidate> found = new EnumMap<>(CanonicalField.class);
        if (text == null || text.isEmpty()) {
            return found;
        }

        Matcher amounts = PatternCatalog.FAILSAFE_AMOUNT.matcher(text);
        BigDecimal largest = null;
        while (amounts.find()) {
            String raw = amounts.group().replace(",", "");
            BigDecimal value = new BigDecimal(raw);
            if (largest == null || value.compareTo(largest) > 0) {
                largest = value;
                found.put(CanonicalField.TOTAL, FieldCandidate.pattern(CanonicalField.TOTAL, raw, amounts.start()));
            }
        }

        Matcher date = PatternCatalog.FAILSAFE_DATE.matcher(text);
        if (date.find()) {
            found.put(CanonicalField.FECHA, FieldCandidate.pattern(CanonicalField.FECHA, date.group(1), date.start(1)));
        }

        Matcher id = PatternCatalog.FAILSAFE_IDENTIFIER.matcher(text);
        if (id.find()) {
            found.put(CanonicalField.RNC, FieldCandidate.pattern(CanonicalField.RNC, id.group(1), id.start(1)));
        }
        return found;
    }
}
