package com.withdrawalaudit.scoring.classifier;

import com.withdrawalaudit.domain.DimensionResult;
import com.withdrawalaudit.scoring.config.ClassificationConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Withdrawal processing speed: duration from timestamps, display formatting and speed banding.
 * Score scale: instant +2, fast +1, normal 0, slow -2, unknown -1.
 */
@Component
public class DurationClassifier {

    static final String INSTANT_MARKER = "秒级";
    static final String HOURS_SUFFIX = "小时";
    static final String MINUTES_SUFFIX = "分钟";

    private static final BigDecimal SECONDS_PER_MINUTE = BigDecimal.valueOf(60);

    /**
     * Minutes between two epoch-second timestamps, rounded to 2 decimals.
     * Null when either is missing or end is before start (duration unavailable, not an error).
     */
    public Double durationFromTimestamps(Long startTimestamp, Long endTimestamp) {
        if (startTimestamp == null || endTimestamp == null || endTimestamp < startTimestamp) {
            return null;
        }
        return BigDecimal.valueOf(endTimestamp).subtract(BigDecimal.valueOf(startTimestamp))
                .divide(SECONDS_PER_MINUTE, 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    /**
     * Human-readable duration: 0.3 → "秒级", 7.5 → "7.5分钟", 90 → "1.5小时". Empty string on invalid input.
     */
    public String formatDuration(Double minutes) {
        if (!isValidMinutes(minutes)) {
            return "";
        }
        if (minutes < 1) {
            return INSTANT_MARKER;
        }
        if (minutes >= 60) {
            return oneDecimal(minutes / 60) + HOURS_SUFFIX;
        }
        return oneDecimal(minutes) + MINUTES_SUFFIX;
    }

    /**
     * Bands minutes against config thresholds. A value exactly on a threshold belongs to the faster band.
     */
    public DimensionResult classifySpeed(Double minutes, ClassificationConfig config) {
        if (!isValidMinutes(minutes)) {
            return DimensionResult.of("unknown", "耗时数据缺失", -1);
        }
        ClassificationConfig thresholds = config != null ? config : ClassificationConfig.defaults();
        if (minutes <= thresholds.instantMinutes()) {
            return DimensionResult.of("instant", "秒级出款", 2);
        }
        if (minutes <= thresholds.fastMinutes()) {
            return DimensionResult.of("fast", "快速出款", 1);
        }
        if (minutes <= thresholds.slowMinutes()) {
            return DimensionResult.of("normal", "出款时效正常", 0);
        }
        return DimensionResult.of("slow", "出款偏慢", -2);
    }

    private static boolean isValidMinutes(Double minutes) {
        return minutes != null && Double.isFinite(minutes) && minutes >= 0;
    }

    private static String oneDecimal(double value) {
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            return "1";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }
}
