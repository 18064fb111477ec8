package com.withdrawalaudit.scoring.config;

import java.math.BigDecimal;

/**
 * Per-call partial override of {@link ClassificationConfig}. Null fields fall back to the base config.
 */
public record ClassificationConfigOverride(
        Double instantMinutes,
        Double fastMinutes,
        Double slowMinutes,
        BigDecimal normalLossPct,
        BigDecimal warnLossPct,
        BigDecimal severeLossThreshold
) {

    public static ClassificationConfigOverride none() {
        return new ClassificationConfigOverride(null, null, null, null, null, null);
    }

    public boolean isEmpty() {
        return instantMinutes == null && fastMinutes == null && slowMinutes == null
                && normalLossPct == null && warnLossPct == null && severeLossThreshold == null;
    }
}
