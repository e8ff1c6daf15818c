package FacturaBot.model;

/**
 * Extraction strategy that produced a candidate.
 */
public enum Provenance {
    PATTERN,
    HEURISTIC,
    FAILSAFE
}
