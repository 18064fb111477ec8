package com.withdrawalaudit.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/audits/evaluate request body.
 */
public record EvaluateAuditRequest(
        @NotNull(message = "INVALID_REQUEST")
        @Valid
        MeasurementRequest measurement,

        @Valid
        ClassificationOverrideRequest config
) {
}
