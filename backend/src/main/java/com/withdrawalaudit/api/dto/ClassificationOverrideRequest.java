package com.withdrawalaudit.api.dto;

import com.withdrawalaudit.scoring.config.ClassificationConfigOverride;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Optional per-request thresholds. Omitted fields keep the deployment value.
 */
public record ClassificationOverrideRequest(
        @PositiveOrZero Double instant,
        @PositiveOrZero Double fast,
        @PositiveOrZero Double slow,
        @PositiveOrZero BigDecimal normal,
        @PositiveOrZero BigDecimal warn,
        @PositiveOrZero BigDecimal severeLossThreshold
) {

    public ClassificationConfigOverride toOverride() {
        return new ClassificationConfigOverride(instant, fast, slow, normal, warn, severeLossThreshold);
    }
}
