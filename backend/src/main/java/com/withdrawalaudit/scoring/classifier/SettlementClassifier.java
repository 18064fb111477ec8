package com.withdrawalaudit.scoring.classifier;

import com.withdrawalaudit.domain.DimensionResult;
import com.withdrawalaudit.domain.SettlementStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Settlement outcome. A record marked successful with no positive credited amount is scored as a
 * failure risk, the same as an explicit failure or block.
 */
@Component
public class SettlementClassifier {

    public DimensionResult classify(SettlementStatus status, BigDecimal receivedAmount) {
        if (status == SettlementStatus.SUCCESS) {
            if (receivedAmount != null && receivedAmount.signum() > 0) {
                return DimensionResult.of("success", "到账成功", 2);
            }
            return failureRisk();
        }
        if (status == SettlementStatus.FAILED || status == SettlementStatus.BLOCKED) {
            return failureRisk();
        }
        return DimensionResult.of("needs_review", "到账待核实", -1);
    }

    private static DimensionResult failureRisk() {
        return DimensionResult.of("failure_risk", "出款失败风险", -3);
    }
}
