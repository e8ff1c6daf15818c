package FacturaBot.model;

/**
 * How a heuristic candidate competes with a pattern candidate for the same field.
 */
public enum MergePolicy {

    /** Pattern value always wins once present. */
    REGEX_LOCKED,

    /** Heuristic value wins when the pattern value is missing or worse formatted. */
    HEURISTIC_ELIGIBLE,

    /** Whichever source has it; pattern wins if both do. */
    PASS_THROUGH
}
