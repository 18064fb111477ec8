package com.withdrawalaudit.api.validation;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Admin-side check of a manually entered withdrawal duration (minutes).
 * Returns the message shown to the auditor, or empty string when the value is acceptable.
 */
@Component
public class DurationInputValidator {

    /** 30 days. */
    static final BigDecimal MAX_MINUTES = BigDecimal.valueOf(43200);

    /** Plain ASCII decimal with optional sign and exponent. */
    private static final Pattern NUMERIC_TEXT = Pattern.compile("[+-]?([0-9]+(\\.[0-9]*)?|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    static final String NOT_NUMERIC = "提款耗时必须为数字（分钟）";
    static final String NEGATIVE = "提款耗时不能为负数，请检查填写的时间";
    static final String TOO_LONG = "提款耗时超过30天，请核实数据是否正确";

    /**
     * Null or empty is valid (the field is optional).
     */
    public String validate(Object value) {
        if (value == null || "".equals(value)) {
            return "";
        }
        BigDecimal minutes = parseMinutes(value);
        if (minutes == null) {
            return NOT_NUMERIC;
        }
        if (minutes.signum() < 0) {
            return NEGATIVE;
        }
        if (minutes.compareTo(MAX_MINUTES) > 0) {
            return TOO_LONG;
        }
        return "";
    }

    public boolean isValid(Object value) {
        return validate(value).isEmpty();
    }

    /**
     * Numeric value of a duration entry, or null when it is not a finite number written in ASCII.
     */
    public static BigDecimal parseMinutes(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        String text = value.toString().strip();
        if (!NUMERIC_TEXT.matcher(text).matches()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
