package com.withdrawalaudit.api.dto;

import com.withdrawalaudit.scoring.config.ClassificationConfig;

import java.math.BigDecimal;

/**
 * GET /api/v1/audits/config response: thresholds active for this deployment.
 */
public record ClassificationConfigResponse(
        double instant,
        double fast,
        double slow,
        BigDecimal normal,
        BigDecimal warn,
        BigDecimal severeLossThreshold
) {

    public static ClassificationConfigResponse from(ClassificationConfig config) {
        return new ClassificationConfigResponse(
                config.instantMinutes(),
                config.fastMinutes(),
                config.slowMinutes(),
                config.normalLossPct(),
                config.warnLossPct(),
                config.severeLossThreshold());
    }
}
