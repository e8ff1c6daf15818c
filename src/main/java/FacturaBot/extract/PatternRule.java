package FacturaBot.extract;

import FacturaBot.model.CanonicalField;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One extraction rule: the regex runs on folded (lower-case, unaccented) text and
 * {@code group} selects the value. The rule only counts when one of the context
 * keywords appears near the match.
 */
public record PatternRule(CanonicalField field, Pattern pattern, List<String> contextKeywords, int group) {

    public PatternRule {
        if (contextKeywords.isEmpty()) {
            throw new IllegalArgumentException("Rule for " + field.key() + " declares no context keywords");
        }
        contextKeywords = List.copyOf(contextKeywords);
    }
}
