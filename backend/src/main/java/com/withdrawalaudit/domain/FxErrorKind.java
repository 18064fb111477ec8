package com.withdrawalaudit.domain;

/**
 * Why an FX loss computation could not produce figures.
 */
public enum FxErrorKind {
    /** Non-positive or missing applied amount or reference rate, or missing received amount. */
    INVALID_INPUT,
    /** applied × rate rounded to zero. */
    EXPECTED_AMOUNT_ZERO,
    /** Received amount exceeds the applied/expected amount by more than the 5% tolerance. */
    DATA_ENTRY_ERROR
}
