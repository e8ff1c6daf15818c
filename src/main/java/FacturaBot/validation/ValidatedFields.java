package FacturaBot.validation;

import FacturaBot.model.CanonicalField;
import FacturaBot.model.FieldValue;

import java.util.Map;
import java.util.Set;

/**
 * Output of the validation stage.
 *
 * @param values  every field that survived, normalized where possible
 * @param keptRaw fields kept with their raw text instead of a normalized value
 */
public record ValidatedFields(Map<CanonicalField, FieldValue> values, Set<CanonicalField> keptRaw) {

    public ValidatedFields {
        values = Map.copyOf(values);
        keptRaw = Set.copyOf(keptRaw);
    }

    /** Number of fields that passed their validator. */
    public int passedCount() {
        return values.size() - keptRaw.size();
    }
}
