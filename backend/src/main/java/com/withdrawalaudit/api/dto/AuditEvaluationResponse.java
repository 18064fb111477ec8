package com.withdrawalaudit.api.dto;

import com.withdrawalaudit.domain.DimensionResult;
import com.withdrawalaudit.domain.OverallResult;
import com.withdrawalaudit.scoring.engine.AuditEvaluation;
import com.withdrawalaudit.scoring.fx.FxComputationResult;

import java.math.BigDecimal;
import java.util.List;

/**
 * POST /api/v1/audits/evaluate response.
 */
public record AuditEvaluationResponse(
        DimensionBody speed,
        DimensionBody fx,
        DimensionBody kyc,
        DimensionBody settlement,
        int totalScore,
        String overallCode,
        String overallLabel,
        String overallColor,
        Double durationMinutes,
        String formattedDuration,
        FxFigures sameCurrencyFx,
        FxFigures crossCurrencyFx
) {

    public static AuditEvaluationResponse from(AuditEvaluation evaluation) {
        OverallResult overall = evaluation.overall();
        return new AuditEvaluationResponse(
                DimensionBody.from(overall.speed()),
                DimensionBody.from(overall.fx()),
                DimensionBody.from(overall.kyc()),
                DimensionBody.from(overall.settlement()),
                overall.totalScore(),
                overall.overallCode(),
                overall.overallLabel(),
                overall.overallColor(),
                evaluation.durationMinutes(),
                evaluation.formattedDuration(),
                evaluation.sameCurrency().map(FxFigures::from).orElse(null),
                evaluation.crossCurrency().map(FxFigures::from).orElse(null));
    }

    public record DimensionBody(String code, String label, int score, List<String> tags) {

        static DimensionBody from(DimensionResult result) {
            return new DimensionBody(result.code(), result.label(), result.score(), result.tags());
        }
    }

    public record FxFigures(
            BigDecimal lossAmount,
            BigDecimal lossPct,
            BigDecimal deviationPct,
            BigDecimal expectedAmount,
            boolean severeLoss,
            boolean hasCrossCurrency,
            String appliedCurrency,
            String receivedCurrency,
            BigDecimal referenceRate,
            String error,
            String errorReason
    ) {

        static FxFigures from(FxComputationResult r) {
            return new FxFigures(
                    r.lossAmount(),
                    r.lossPct(),
                    r.deviationPct(),
                    r.expectedAmount(),
                    r.severeLoss(),
                    r.hasCrossCurrency(),
                    r.appliedCurrency(),
                    r.receivedCurrency(),
                    r.referenceRate(),
                    r.error() != null ? r.error().name() : null,
                    r.errorReason());
        }
    }
}
