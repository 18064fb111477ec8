package com.withdrawalaudit.scoring.classifier;

import com.withdrawalaudit.domain.DimensionResult;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Maps the KYC step a tester hit during withdrawal to a friction band.
 * Tokens are matched exactly (case-sensitive). An unrecognized token is "moderate", not "unknown":
 * a value was recorded, it just is not one we grade.
 */
@Component
public class KycFrictionClassifier {

    private static final String NO_KYC = "none";
    private static final Set<String> LIGHT_TOKENS = Set.of("sms", "id_card");
    private static final Set<String> HIGH_TOKENS = Set.of("video", "face", "stuck");

    public DimensionResult classify(String kycStatus) {
        if (kycStatus == null || kycStatus.isEmpty()) {
            return DimensionResult.of("insufficient_info", "KYC信息不足", -1);
        }
        if (NO_KYC.equals(kycStatus)) {
            return DimensionResult.of("low_friction", "无需KYC", 1);
        }
        if (LIGHT_TOKENS.contains(kycStatus)) {
            return DimensionResult.of("light_friction", "轻度KYC验证", 0);
        }
        if (HIGH_TOKENS.contains(kycStatus)) {
            return DimensionResult.of("high_friction", "高强度KYC", -2);
        }
        return DimensionResult.of("moderate_friction", "需KYC验证", -1);
    }
}
