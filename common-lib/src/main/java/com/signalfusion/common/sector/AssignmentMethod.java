package com.signalfusion.common.sector;

/**
 * How {@link SectorClassifier} reached its verdict.
 */
public enum AssignmentMethod {
    /** Supplied ticker belongs to the sector; wins outright. */
    TICKER,
    /** Keyword density, possibly boosted by a pattern hit. */
    KEYWORD,
    /** Seeded by a regex pattern alone. */
    PATTERN,
    /** Nothing qualified; {@code general_market} at confidence 0.5. */
    FALLBACK
}
