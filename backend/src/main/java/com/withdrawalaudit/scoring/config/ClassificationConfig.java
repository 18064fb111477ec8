package com.withdrawalaudit.scoring.config;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Thresholds consumed by every classifier. Immutable; safe to share across concurrent evaluations.
 * <p>
 * Speed thresholds are minutes. normal/warn are loss percentages for the four-band FX severity;
 * severeLossThreshold drives only the calculator's binary severeLoss flag. The two are independent.
 * Ordering instant ≤ fast ≤ slow and normal ≤ warn is the caller's responsibility.
 */
public record ClassificationConfig(
        double instantMinutes,
        double fastMinutes,
        double slowMinutes,
        BigDecimal normalLossPct,
        BigDecimal warnLossPct,
        BigDecimal severeLossThreshold
) {

    public static final double DEFAULT_INSTANT_MINUTES = 5;
    public static final double DEFAULT_FAST_MINUTES = 30;
    public static final double DEFAULT_SLOW_MINUTES = 240;
    public static final BigDecimal DEFAULT_NORMAL_LOSS_PCT = new BigDecimal("0.5");
    public static final BigDecimal DEFAULT_WARN_LOSS_PCT = new BigDecimal("2.0");
    public static final BigDecimal DEFAULT_SEVERE_LOSS_THRESHOLD = new BigDecimal("2.0");

    private static final ClassificationConfig DEFAULTS = new ClassificationConfig(
            DEFAULT_INSTANT_MINUTES, DEFAULT_FAST_MINUTES, DEFAULT_SLOW_MINUTES,
            DEFAULT_NORMAL_LOSS_PCT, DEFAULT_WARN_LOSS_PCT, DEFAULT_SEVERE_LOSS_THRESHOLD);

    public ClassificationConfig {
        Objects.requireNonNull(normalLossPct, "normalLossPct");
        Objects.requireNonNull(warnLossPct, "warnLossPct");
        Objects.requireNonNull(severeLossThreshold, "severeLossThreshold");
    }

    public static ClassificationConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Field-by-field merge: every non-null override field replaces the matching field, the rest are kept.
     */
    public ClassificationConfig merge(ClassificationConfigOverride override) {
        if (override == null || override.isEmpty()) {
            return this;
        }
        return new ClassificationConfig(
                override.instantMinutes() != null ? override.instantMinutes() : instantMinutes,
                override.fastMinutes() != null ? override.fastMinutes() : fastMinutes,
                override.slowMinutes() != null ? override.slowMinutes() : slowMinutes,
                override.normalLossPct() != null ? override.normalLossPct() : normalLossPct,
                override.warnLossPct() != null ? override.warnLossPct() : warnLossPct,
                override.severeLossThreshold() != null ? override.severeLossThreshold() : severeLossThreshold);
    }
}
