package com.withdrawalaudit.scoring.engine;

import com.withdrawalaudit.domain.OverallResult;
import com.withdrawalaudit.scoring.fx.FxComputationResult;

import java.util.Optional;

/**
 * Output of one engine evaluation: the composite result plus the raw figures behind it.
 * sameCurrencyFx / crossCurrencyFx are null when that mode did not apply to the measurement.
 */
public record AuditEvaluation(
        OverallResult overall,
        Double durationMinutes,
        String formattedDuration,
        FxComputationResult sameCurrencyFx,
        FxComputationResult crossCurrencyFx
) {

    public Optional<FxComputationResult> sameCurrency() {
        return Optional.ofNullable(sameCurrencyFx);
    }

    public Optional<FxComputationResult> crossCurrency() {
        return Optional.ofNullable(crossCurrencyFx);
    }
}
