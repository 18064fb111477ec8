package com.withdrawalaudit.scoring.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Deployment thresholds. Documented in application.yml under withdrawalaudit.classification.
 * Unset keys keep the {@link ClassificationConfig} defaults.
 */
@ConfigurationProperties(prefix = "withdrawalaudit.classification")
@Getter
@Setter
public class ClassificationProperties {

    private SpeedProperties speed = new SpeedProperties();

    private LossProperties loss = new LossProperties();

    @Getter
    @Setter
    public static class SpeedProperties {
        /** At or below: instant payout (minutes). */
        private double instant = ClassificationConfig.DEFAULT_INSTANT_MINUTES;
        /** At or below: fast payout (minutes). */
        private double fast = ClassificationConfig.DEFAULT_FAST_MINUTES;
        /** At or below: normal payout; above: slow (minutes). */
        private double slow = ClassificationConfig.DEFAULT_SLOW_MINUTES;
    }

    @Getter
    @Setter
    public static class LossProperties {
        /** Upper bound (percent, inclusive) of the minimal-loss band. */
        private BigDecimal normal = ClassificationConfig.DEFAULT_NORMAL_LOSS_PCT;
        /** Upper bound (percent, inclusive) of the moderate-loss band; above is severe. */
        private BigDecimal warn = ClassificationConfig.DEFAULT_WARN_LOSS_PCT;
        /** Loss percent strictly above which the calculator sets severeLoss. */
        private BigDecimal severeThreshold = ClassificationConfig.DEFAULT_SEVERE_LOSS_THRESHOLD;
    }

    public ClassificationConfig toConfig() {
        return ClassificationConfig.defaults().merge(new ClassificationConfigOverride(
                speed.getInstant(),
                speed.getFast(),
                speed.getSlow(),
                loss.getNormal(),
                loss.getWarn(),
                loss.getSevereThreshold()));
    }
}
