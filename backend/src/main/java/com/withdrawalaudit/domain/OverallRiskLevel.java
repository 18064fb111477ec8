package com.withdrawalaudit.domain;

/**
 * Overall risk band of an audited withdrawal, with its display label and color.
 */
public enum OverallRiskLevel {
    HIGH_RISK("high_risk", "高风险", "red"),
    MEDIUM_RISK("medium_risk", "中等风险", "orange"),
    LOW_RISK("low_risk", "低风险", "green");

    private final String code;
    private final String label;
    private final String color;

    OverallRiskLevel(String code, String label, String color) {
        this.code = code;
        this.label = label;
        this.color = color;
    }

    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public String color() {
        return color;
    }
}
