package com.withdrawalaudit.api.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class DurationInputValidatorTest {

    private final DurationInputValidator validator = new DurationInputValidator();

    @Test
    @DisplayName("null and empty are accepted (optional field)")
    void optional() {
        assertThat(validator.validate(null)).isEmpty();
        assertThat(validator.validate("")).isEmpty();
    }

    @Test
    @DisplayName("numeric values within 30 days are accepted")
    void valid() {
        assertThat(validator.isValid("12.5")).isTrue();
        assertThat(validator.isValid(0)).isTrue();
        assertThat(validator.isValid(43200)).isTrue();
        assertThat(validator.isValid(new BigDecimal("90"))).isTrue();
    }

    @Test
    @DisplayName("non-numeric input is rejected")
    void nonNumeric() {
        assertThat(validator.validate("abc")).isEqualTo("提款耗时必须为数字（分钟）");
        assertThat(validator.validate("NaN")).isEqualTo("提款耗时必须为数字（分钟）");
        assertThat(validator.validate(Double.POSITIVE_INFINITY)).isEqualTo("提款耗时必须为数字（分钟）");
    }

    @Test
    @DisplayName("full-width digits from an IME are not numeric")
    void fullWidthDigits() {
        assertThat(validator.validate("１０")).isEqualTo("提款耗时必须为数字（分钟）");
        assertThat(validator.validate("٣")).isEqualTo("提款耗时必须为数字（分钟）");
        assertThat(DurationInputValidator.parseMinutes("１０")).isNull();
    }

    @Test
    @DisplayName("parseMinutes reads the same value the validator accepted")
    void parseMinutes() {
        assertThat(DurationInputValidator.parseMinutes(" 12.5 ")).isEqualByComparingTo("12.5");
        assertThat(DurationInputValidator.parseMinutes("1e2")).isEqualByComparingTo("100");
        assertThat(DurationInputValidator.parseMinutes(".5")).isEqualByComparingTo("0.5");
        assertThat(DurationInputValidator.parseMinutes("")).isNull();
        assertThat(DurationInputValidator.parseMinutes(null)).isNull();
    }

    @Test
    @DisplayName("negative input is rejected")
    void negative() {
        assertThat(validator.validate("-1")).isEqualTo("提款耗时不能为负数，请检查填写的时间");
        assertThat(validator.validate(-0.5)).isEqualTo("提款耗时不能为负数，请检查填写的时间");
    }

    @Test
    @DisplayName("more than 30 days is rejected")
    void tooLong() {
        assertThat(validator.validate("43200.01")).isEqualTo("提款耗时超过30天，请核实数据是否正确");
        assertThat(validator.validate(50_000L)).isEqualTo("提款耗时超过30天，请核实数据是否正确");
    }
}
