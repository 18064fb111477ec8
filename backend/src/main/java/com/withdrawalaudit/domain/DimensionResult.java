package com.withdrawalaudit.domain;

import java.util.List;

/**
 * One scored audit dimension: stable code, display label, score contribution and display tags.
 * Labels and tags are consumed verbatim by display and structured-data consumers.
 */
public record DimensionResult(String code, String label, int score, List<String> tags) {

    public DimensionResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Result whose only tag is its label. */
    public static DimensionResult of(String code, String label, int score) {
        return new DimensionResult(code, label, score, List.of(label));
    }
}
