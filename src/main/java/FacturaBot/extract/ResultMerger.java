package FacturaBot.extract;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldCandidate;
import FacturaBot.model.FieldKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/*
Combina los candidatos de regex y heurística en un solo mapa.

Merges regex and heuristic candidates into one map, one candidate per field.
 - REGEX_LOCKED:       a regex value is never replaced
 - HEURISTIC_ELIGIBLE: replaced when the heuristic value is better formatted
 - PASS_THROUGH:       regex value wins, heuristic only fills a gap
*/
@Component
public class ResultMerger {

    private static final Logger log = LoggerFactory.getLogger(ResultMerger.class);

    // two fraction digits, optionally with comma thousands separators
    private static final Pattern WELL_FORMED_MONEY = Pattern.compile("(?:\\d+|\\d{1,3}(?:,\\d{3})+)[.,]\\d{2}");

    public Map<CanonicalField, FieldCandidate> merge(Map<CanonicalField, FieldCandidate> regex,
                                                     List<FieldCandidate> heuristic) {
        Map<CanonicalField, FieldCandidate> merged = new EnumMap<>(CanonicalField.class);
        regex.forEach((field, candidate) -> {
            if (!candidate.isBlank()) {
                merged.put(field, candidate);
            }
        });

        for (Map.Entry<CanonicalField, FieldCandidate> entry : latestPerField(heuristic).entrySet()) {
            CanonicalField field = entry.getKey();
            FieldCandidate candidate = entry.getValue();
            FieldCandidate current = merged.get(field);

            if (current == null) {
                merged.put(field, candidate);
                continue;
            }
            switch (field.mergePolicy()) {
                case REGEX_LOCKED, PASS_THROUGH -> log.debug("Keeping pattern value for {}: '{}' over '{}'",
                        field.key(), current.rawValue(), candidate.rawValue());
                case HEURISTIC_ELIGIBLE -> {
                    if (isBetter(field, current.rawValue().trim(), candidate.rawValue().trim())) {
                        log.debug("Heuristic value for {} replaces '{}' with '{}'",
                                field.key(), current.rawValue(), candidate.rawValue());
                        merged.put(field, candidate);
                    }
                }
            }
        }
        return Collections.unmodifiableMap(merged);
    }

    /** Heuristic candidates resolved to canonical fields; the later candidate wins. */
    private Map<CanonicalField, FieldCandidate> latestPerField(List<FieldCandidate> heuristic) {
        Map<CanonicalField, FieldCandidate> latest = new EnumMap<>(CanonicalField.class);
        for (FieldCandidate candidate : heuristic) {
            if (candidate.isBlank()) {
                continue;
            }
            Optional<CanonicalField> field = FieldSynonyms.resolve(candidate.field());
            if (field.isEmpty()) {
                log.debug("Ignoring heuristic candidate with unknown name '{}'", candidate.field());
                continue;
            }
            latest.put(field.get(), new FieldCandidate(
                    field.get().key(), candidate.rawValue(), candidate.provenance(), candidate.offset()));
        }
        return latest;
    }

    static boolean isBetter(CanonicalField field, String current, String challenger) {
        if (field.kind() == FieldKind.MONEY) {
            return WELL_FORMED_MONEY.matcher(challenger).matches()
                    && !WELL_FORMED_MONEY.matcher(current).matches();
        }
        return challenger.length() > current.length();
    }
}
