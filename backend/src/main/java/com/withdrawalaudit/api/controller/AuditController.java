package com.withdrawalaudit.api.controller;

import com.withdrawalaudit.api.dto.AuditEvaluationResponse;
import com.withdrawalaudit.api.dto.ClassificationConfigResponse;
import com.withdrawalaudit.api.dto.ErrorBody;
import com.withdrawalaudit.api.dto.EvaluateAuditRequest;
import com.withdrawalaudit.scoring.config.ClassificationConfig;
import com.withdrawalaudit.scoring.config.ClassificationConfigOverride;
import com.withdrawalaudit.scoring.engine.AuditEvaluation;
import com.withdrawalaudit.scoring.engine.WithdrawalAuditEngine;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /audits/evaluate scores one withdrawal test; GET /audits/config shows the active thresholds.
 */
@RestController
@RequestMapping("/api/v1/audits")
@RequiredArgsConstructor
public class AuditController {

    private final WithdrawalAuditEngine withdrawalAuditEngine;
    private final ClassificationConfig activeClassificationConfig;

    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody @Valid EvaluateAuditRequest request) {
        if (request == null || request.measurement() == null) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", "measurement is required"));
        }
        ClassificationConfigOverride override = request.config() != null ? request.config().toOverride() : null;
        AuditEvaluation evaluation = withdrawalAuditEngine.evaluate(request.measurement().toMeasurement(), override);
        return ResponseEntity.ok(AuditEvaluationResponse.from(evaluation));
    }

    @GetMapping("/config")
    public ResponseEntity<ClassificationConfigResponse> config() {
        return ResponseEntity.ok(ClassificationConfigResponse.from(activeClassificationConfig));
    }
}
