package com.withdrawalaudit.scoring.fx;

import com.withdrawalaudit.domain.DimensionResult;
import com.withdrawalaudit.domain.FxErrorKind;
import com.withdrawalaudit.scoring.config.ClassificationConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Hidden FX loss of a withdrawal: what the user lost against the applied amount (same currency) or against
 * a fair mid-rate conversion (cross currency), then banded for display.
 * Amounts are rounded to 8 decimals, percentages to 4, half-up.
 */
@Component
public class FxLossCalculator {

    static final int AMOUNT_SCALE = 8;
    static final int PCT_SCALE = 4;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    /** Credited amount may exceed the applied/expected amount by 5% (fee and rounding noise) before it is a data error. */
    private static final BigDecimal RECEIVED_TOLERANCE = new BigDecimal("1.05");

    public FxComputationResult computeSameCurrency(BigDecimal applied, String currency, BigDecimal received) {
        return computeSameCurrency(applied, currency, received, ClassificationConfig.defaults());
    }

    /**
     * Loss of a withdrawal paid out in the currency it was requested in.
     */
    public FxComputationResult computeSameCurrency(BigDecimal applied, String currency, BigDecimal received,
                                                   ClassificationConfig config) {
        if (applied == null || applied.signum() <= 0 || received == null) {
            return FxComputationResult.failure(false, FxErrorKind.INVALID_INPUT, "apply_amount_invalid");
        }
        if (received.compareTo(applied.multiply(RECEIVED_TOLERANCE)) > 0) {
            return FxComputationResult.failure(false, FxErrorKind.DATA_ENTRY_ERROR, "received_exceeds_applied");
        }

        BigDecimal lossAmount = applied.subtract(received).setScale(AMOUNT_SCALE, ROUNDING);
        BigDecimal lossPct = percentOf(lossAmount, applied);
        String ccy = normalizeCurrency(currency);
        return new FxComputationResult(
                lossAmount,
                lossPct,
                null,
                null,
                isSevere(lossPct, config),
                false,
                ccy,
                ccy,
                null,
                null,
                null);
    }

    public FxComputationResult computeCrossCurrency(BigDecimal applied, String appliedCurrency,
                                                    BigDecimal received, String receivedCurrency,
                                                    BigDecimal referenceRate) {
        return computeCrossCurrency(applied, appliedCurrency, received, receivedCurrency, referenceRate,
                ClassificationConfig.defaults());
    }

    /**
     * Deviation between what the user should have received at the reference mid-rate and what was credited.
     *
     * @param referenceRate 1 unit of appliedCurrency = referenceRate units of receivedCurrency
     */
    public FxComputationResult computeCrossCurrency(BigDecimal applied, String appliedCurrency,
                                                    BigDecimal received, String receivedCurrency,
                                                    BigDecimal referenceRate, ClassificationConfig config) {
        if (applied == null || applied.signum() <= 0 || received == null) {
            return FxComputationResult.failure(true, FxErrorKind.INVALID_INPUT, "apply_amount_invalid");
        }
        if (referenceRate == null || referenceRate.signum() <= 0) {
            return FxComputationResult.failure(true, FxErrorKind.INVALID_INPUT, "reference_rate_invalid");
        }

        BigDecimal expectedAmount = applied.multiply(referenceRate).setScale(AMOUNT_SCALE, ROUNDING);
        if (expectedAmount.signum() <= 0) {
            return FxComputationResult.failure(true, FxErrorKind.EXPECTED_AMOUNT_ZERO, "expected_amount_zero");
        }
        if (received.compareTo(expectedAmount.multiply(RECEIVED_TOLERANCE)) > 0) {
            return FxComputationResult.failure(true, FxErrorKind.DATA_ENTRY_ERROR, "received_exceeds_expected");
        }

        BigDecimal lossAmount = expectedAmount.subtract(received).setScale(AMOUNT_SCALE, ROUNDING);
        BigDecimal deviationPct = percentOf(lossAmount, expectedAmount);
        return new FxComputationResult(
                lossAmount,
                deviationPct,
                deviationPct,
                expectedAmount,
                isSevere(deviationPct, config),
                true,
                normalizeCurrency(appliedCurrency),
                normalizeCurrency(receivedCurrency),
                referenceRate,
                null,
                null);
    }

    /**
     * Four-band severity of a loss percentage (callers pass {@link FxComputationResult#effectiveLossPct()}).
     * Score scale: favorable/zero_loss/minimal +1, moderate -1, severe -3, unknown -1.
     * Negative (rate moved in the user's favor) and exactly zero are both non-penalizing but keep distinct codes.
     */
    public DimensionResult classifySeverity(BigDecimal lossOrDeviationPct, ClassificationConfig config) {
        if (lossOrDeviationPct == null) {
            return DimensionResult.of("unknown", "汇损数据缺失", -1);
        }
        ClassificationConfig thresholds = config != null ? config : ClassificationConfig.defaults();
        int sign = lossOrDeviationPct.signum();
        if (sign < 0) {
            return new DimensionResult("favorable", "无汇损", 1, List.of("无汇损", "汇率有利"));
        }
        if (sign == 0) {
            return DimensionResult.of("zero_loss", "无汇损", 1);
        }
        if (lossOrDeviationPct.compareTo(thresholds.normalLossPct()) <= 0) {
            return DimensionResult.of("minimal", "汇损极低", 1);
        }
        if (lossOrDeviationPct.compareTo(thresholds.warnLossPct()) <= 0) {
            return DimensionResult.of("moderate", "存在汇损", -1);
        }
        return DimensionResult.of("severe", "汇损严重", -3);
    }

    private static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        return part.multiply(HUNDRED).divide(whole, PCT_SCALE, ROUNDING);
    }

    private static boolean isSevere(BigDecimal pct, ClassificationConfig config) {
        BigDecimal threshold = (config != null ? config : ClassificationConfig.defaults()).severeLossThreshold();
        return pct.compareTo(threshold) > 0;
    }

    private static String normalizeCurrency(String currency) {
        return currency == null ? null : currency.strip().toUpperCase(Locale.ROOT);
    }
}
