package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * SizeOperator - 数值条件运算符（用于 total_size / file_count）
 *
 * @author whenthen
 */
public enum SizeOperator {

    GT("gt"),
    LT("lt"),
    /**
     * 闭区间 [numericValue, numericValueEnd]
     */
    BETWEEN("between");

    private final String code;

    SizeOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SizeOperator fromCode(String code) {
        for (SizeOperator operator : values()) {
            if (operator.code.equalsIgnoreCase(code) || operator.name().equalsIgnoreCase(code)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown size operator: " + code);
    }
}
