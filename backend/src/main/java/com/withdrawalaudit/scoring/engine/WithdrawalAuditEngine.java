package com.withdrawalaudit.scoring.engine;

import com.withdrawalaudit.domain.DimensionResult;
import com.withdrawalaudit.domain.OverallResult;
import com.withdrawalaudit.domain.RawMeasurement;
import com.withdrawalaudit.scoring.classifier.DurationClassifier;
import com.withdrawalaudit.scoring.classifier.KycFrictionClassifier;
import com.withdrawalaudit.scoring.classifier.SettlementClassifier;
import com.withdrawalaudit.scoring.config.ClassificationConfig;
import com.withdrawalaudit.scoring.config.ClassificationConfigOverride;
import com.withdrawalaudit.scoring.fx.FxComputationResult;
import com.withdrawalaudit.scoring.fx.FxLossCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Scores one withdrawal test: resolve duration, compute FX loss, classify every dimension, aggregate.
 * Stateless; the data content of a measurement never makes it throw.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalAuditEngine {

    private final DurationClassifier durationClassifier;
    private final FxLossCalculator fxLossCalculator;
    private final KycFrictionClassifier kycFrictionClassifier;
    private final SettlementClassifier settlementClassifier;
    private final RiskAggregator riskAggregator;
    private final ClassificationConfig activeClassificationConfig;

    public AuditEvaluation evaluate(RawMeasurement measurement) {
        return evaluate(measurement, null);
    }

    /**
     * Evaluate with a per-call override merged field by field over the active deployment config.
     *
     * @throws IllegalArgumentException if measurement is null
     */
    public AuditEvaluation evaluate(RawMeasurement measurement, ClassificationConfigOverride override) {
        if (measurement == null) {
            throw new IllegalArgumentException("measurement is required");
        }
        ClassificationConfig config = activeClassificationConfig.merge(override);

        Double minutes = resolveMinutes(measurement);
        DimensionResult speed = durationClassifier.classifySpeed(minutes, config);

        FxComputationResult sameCurrencyFx = null;
        FxComputationResult crossCurrencyFx = null;
        if (isSameCurrency(measurement)) {
            sameCurrencyFx = fxLossCalculator.computeSameCurrency(
                    measurement.appliedAmount(), measurement.appliedCurrency(), measurement.receivedAmount(), config);
            logFxError(sameCurrencyFx, measurement);
        } else if (measurement.referenceRate() != null) {
            crossCurrencyFx = fxLossCalculator.computeCrossCurrency(
                    measurement.appliedAmount(), measurement.appliedCurrency(),
                    measurement.receivedAmount(), measurement.receivedCurrency(),
                    measurement.referenceRate(), config);
            logFxError(crossCurrencyFx, measurement);
        }
        DimensionResult fx = fxLossCalculator.classifySeverity(effectiveLossPct(sameCurrencyFx, crossCurrencyFx), config);

        DimensionResult kyc = kycFrictionClassifier.classify(measurement.kycStatus());
        DimensionResult settlement = settlementClassifier.classify(
                measurement.settlementStatus(), measurement.receivedAmount());

        OverallResult overall = riskAggregator.aggregate(speed, fx, kyc, settlement);
        log.debug("Audit evaluated: speed={} fx={} kyc={} settlement={} total={} -> {}",
                speed.code(), fx.code(), kyc.code(), settlement.code(), overall.totalScore(), overall.overallCode());
        return new AuditEvaluation(
                overall,
                minutes,
                durationClassifier.formatDuration(minutes),
                sameCurrencyFx,
                crossCurrencyFx);
    }

    private Double resolveMinutes(RawMeasurement measurement) {
        if (measurement.durationMinutes() != null) {
            return measurement.durationMinutes();
        }
        return durationClassifier.durationFromTimestamps(measurement.startTimestamp(), measurement.endTimestamp());
    }

    /** Same currency when codes match ignoring case, or no received currency was recorded. */
    private static boolean isSameCurrency(RawMeasurement measurement) {
        String received = normalize(measurement.receivedCurrency());
        return received.isEmpty() || received.equals(normalize(measurement.appliedCurrency()));
    }

    private static BigDecimal effectiveLossPct(FxComputationResult sameCurrencyFx, FxComputationResult crossCurrencyFx) {
        if (crossCurrencyFx != null && !crossCurrencyFx.isError()) {
            return crossCurrencyFx.effectiveLossPct();
        }
        if (sameCurrencyFx != null && !sameCurrencyFx.isError()) {
            return sameCurrencyFx.effectiveLossPct();
        }
        return null;
    }

    private static void logFxError(FxComputationResult result, RawMeasurement measurement) {
        if (result.isError()) {
            log.warn("FX loss not computable ({} / {}): applied={} {} received={} {} rate={}",
                    result.error(), result.errorReason(),
                    measurement.appliedAmount(), measurement.appliedCurrency(),
                    measurement.receivedAmount(), measurement.receivedCurrency(),
                    measurement.referenceRate());
        }
    }

    private static String normalize(String currency) {
        return currency == null ? "" : currency.strip().toUpperCase(Locale.ROOT);
    }
}
