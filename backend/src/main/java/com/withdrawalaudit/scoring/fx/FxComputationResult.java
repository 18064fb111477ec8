package com.withdrawalaudit.scoring.fx;

import com.withdrawalaudit.domain.FxErrorKind;

import java.math.BigDecimal;

/**
 * Figures of one FX loss computation, or the reason it could not be made. Never both:
 * when error is set every amount and percentage is null.
 * <p>
 * In cross-currency mode deviationPct and lossPct carry the same value; same-currency mode only sets lossPct.
 * Use {@link #effectiveLossPct()} instead of repeating that fallback.
 */
public record FxComputationResult(
        BigDecimal lossAmount,
        BigDecimal lossPct,
        BigDecimal deviationPct,
        BigDecimal expectedAmount,
        boolean severeLoss,
        boolean hasCrossCurrency,
        String appliedCurrency,
        String receivedCurrency,
        BigDecimal referenceRate,
        FxErrorKind error,
        String errorReason
) {

    static FxComputationResult failure(boolean hasCrossCurrency, FxErrorKind error, String errorReason) {
        return new FxComputationResult(null, null, null, null, false, hasCrossCurrency,
                null, null, null, error, errorReason);
    }

    public boolean isError() {
        return error != null;
    }

    /** deviationPct when present, otherwise lossPct; null on error. */
    public BigDecimal effectiveLossPct() {
        return deviationPct != null ? deviationPct : lossPct;
    }
}
