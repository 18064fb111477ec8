package com.withdrawalaudit.domain;

import java.math.BigDecimal;

/**
 * Raw figures of one real-money withdrawal test, as entered by the auditor. Never mutated by the engine.
 * referenceRate is the market mid-rate: 1 unit of appliedCurrency = N units of receivedCurrency.
 * durationMinutes, when present, takes precedence over the start/end timestamps (epoch seconds).
 */
public record RawMeasurement(
        BigDecimal appliedAmount,
        BigDecimal receivedAmount,
        String appliedCurrency,
        String receivedCurrency,
        BigDecimal referenceRate,
        Long startTimestamp,
        Long endTimestamp,
        Double durationMinutes,
        String kycStatus,
        SettlementStatus settlementStatus
) {
}
