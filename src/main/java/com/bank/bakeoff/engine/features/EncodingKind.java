package com.bank.bakeoff.engine.features;

public enum EncodingKind {
    /** z-scored value */
    NUMERIC,
    /** {@code <col>_zScore} and {@code <col>_log} derived from an amount column */
    AMOUNT,
    /** one-hot over the most frequent training values */
    CATEGORICAL,
    /** hour, weekday and business-hours flags */
    DATE,
    /** 0/1 */
    BOOLEAN
}
