package FacturaBot.extract;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldCandidate;
import FacturaBot.support.AmountText;
import FacturaBot.support.TextFolding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

/*
Extracción por expresiones regulares.
 * Primera regla que coincide (con contexto) gana para cada campo.

Regex extraction.
 * For every field the first rule whose match has a context keyword within
 * CONTEXT_RADIUS characters wins. Matching runs on folded text; values are cut
 * from the original.
*/
@Service
public class RegexExtractor {

    private static final Logger log = LoggerFactory.getLogger(RegexExtractor.class);

    static final int CONTEXT_RADIUS = 100;

    private final PatternCatalog catalog;

    public RegexExtractor(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    public Map<CanonicalField, FieldCandidate> extract(String text) {
        Map<CanonicalField, FieldCandidate> found = new EnumMap<>(CanonicalField.class);
        if (text == null || text.isBlank()) {
            return found;
        }
        String folded = TextFolding.fold(text);

        for (CanonicalField field : CanonicalField.values()) {
            for (PatternRule rule : catalog.rulesFor(field)) {
                Optional<FieldCandidate> candidate = apply(rule, text, folded);
                if (candidate.isPresent()) {
                    found.put(field, candidate.get());
                    log.debug("Pattern hit {} = '{}' at {}", field.key(), candidate.get().rawValue(),
                            candidate.get().offset());
                    break;
                }
            }
        }
        log.debug("Regex pass found {} fields", found.size());
        return found;
    }

    Optional<FieldCandidate> apply(PatternRule rule, String text, String folded) {
        Matcher m = rule.pattern().matcher(folded);
        while (m.find()) {
            int start = m.start(rule.group());
            if (start < 0) {
                continue;
            }
            if (!TextFolding.anyFragmentNear(text, m.start(), CONTEXT_RADIUS, rule.contextKeywords())) {
                continue;
            }
            String raw = text.substring(start, m.end(rule.group()));
            String cleaned = clean(rule.field(), raw);
            if (!cleaned.isEmpty()) {
                return Optional.of(FieldCandidate.pattern(rule.field(), cleaned, start));
            }
        }
        return Optional.empty();
    }

    static String clean(CanonicalField field, String raw) {
        return switch (field.kind()) {
            case MONEY -> cleanMoney(raw);
            case IDENTIFIER, FISCAL_DOCUMENT_NUMBER -> raw.trim().toUpperCase();
            case CALENDAR_DATE, FREE_TEXT -> raw.trim().replaceAll("\\s+", " ");
        };
    }

    static String cleanMoney(String raw) {
        return AmountText.normalize(raw).orElse("");
    }
}
