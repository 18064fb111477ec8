package com.withdrawalaudit.domain;

/**
 * Composite audit result for one withdrawal test. Built fresh per evaluation and never persisted here.
 */
public record OverallResult(
        DimensionResult speed,
        DimensionResult fx,
        DimensionResult kyc,
        DimensionResult settlement,
        int totalScore,
        OverallRiskLevel riskLevel
) {

    public String overallCode() {
        return riskLevel.code();
    }

    public String overallLabel() {
        return riskLevel.label();
    }

    public String overallColor() {
        return riskLevel.color();
    }
}
