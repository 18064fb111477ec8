package com.withdrawalaudit.api.dto;

import com.withdrawalaudit.api.validation.DurationInputValidator;
import com.withdrawalaudit.api.validation.DurationMinutes;
import com.withdrawalaudit.domain.RawMeasurement;
import com.withdrawalaudit.domain.SettlementStatus;

import java.math.BigDecimal;

/**
 * Raw withdrawal test figures as submitted by the audit back office.
 * durationMinutes is kept as text so non-numeric entries reach validation instead of failing JSON binding.
 */
public record MeasurementRequest(
        BigDecimal appliedAmount,
        BigDecimal receivedAmount,
        String appliedCurrency,
        String receivedCurrency,
        BigDecimal referenceRate,
        Long startTimestamp,
        Long endTimestamp,
        @DurationMinutes
        String durationMinutes,
        String kycStatus,
        String settlementStatus
) {

    public RawMeasurement toMeasurement() {
        return new RawMeasurement(
                appliedAmount,
                receivedAmount,
                appliedCurrency,
                receivedCurrency,
                referenceRate,
                startTimestamp,
                endTimestamp,
                minutes(),
                kycStatus,
                SettlementStatus.fromCode(settlementStatus));
    }

    private Double minutes() {
        BigDecimal parsed = DurationInputValidator.parseMinutes(durationMinutes);
        return parsed == null ? null : parsed.doubleValue();
    }
}
