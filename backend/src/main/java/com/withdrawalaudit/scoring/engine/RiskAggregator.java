package com.withdrawalaudit.scoring.engine;

import com.withdrawalaudit.domain.DimensionResult;
import com.withdrawalaudit.domain.OverallResult;
import com.withdrawalaudit.domain.OverallRiskLevel;
import org.springframework.stereotype.Component;

/**
 * Sums the four dimension scores and bands the total: ≤ -4 high, ≥ 1 low, -3..0 medium.
 * Scores are trusted as produced by the classifiers; nothing is re-validated here.
 */
@Component
public class RiskAggregator {

    static final int HIGH_RISK_MAX_SCORE = -4;
    static final int LOW_RISK_MIN_SCORE = 1;

    public OverallResult aggregate(DimensionResult speed, DimensionResult fx,
                                   DimensionResult kyc, DimensionResult settlement) {
        int total = speed.score() + fx.score() + kyc.score() + settlement.score();
        return new OverallResult(speed, fx, kyc, settlement, total, band(total));
    }

    static OverallRiskLevel band(int totalScore) {
        if (totalScore <= HIGH_RISK_MAX_SCORE) {
            return OverallRiskLevel.HIGH_RISK;
        }
        if (totalScore >= LOW_RISK_MIN_SCORE) {
            return OverallRiskLevel.LOW_RISK;
        }
        return OverallRiskLevel.MEDIUM_RISK;
    }
}
