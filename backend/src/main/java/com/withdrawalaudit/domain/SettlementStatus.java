package com.withdrawalaudit.domain;

/**
 * Settlement outcome reported for a withdrawal test. Wire tokens are lowercase.
 */
public enum SettlementStatus {
    SUCCESS,
    FAILED,
    BLOCKED,
    OTHER;

    /**
     * Parses a wire token. Null or blank returns null; unrecognized tokens (e.g. "pending") map to OTHER.
     */
    public static SettlementStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return switch (code.strip()) {
            case "success" -> SUCCESS;
            case "failed" -> FAILED;
            case "blocked" -> BLOCKED;
            default -> OTHER;
        };
    }
}
