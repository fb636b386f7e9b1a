package com.signalfusion.common.model;

/**
 * Evidence bucket an item was collected for.
 */
public enum CategoryLabel {
    GENERAL_MARKET,
    STOCK_SPECIFIC,
    SECTOR;

    /** Key used in {@link CombinedSentiment#weightsUsed()} and in JSON output. */
    public String code() {
        return name().toLowerCase();
    }
}
