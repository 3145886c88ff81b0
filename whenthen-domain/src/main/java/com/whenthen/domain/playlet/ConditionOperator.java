package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ConditionOperator - 字符串条件运算符
 *
 * @author whenthen
 */
public enum ConditionOperator {

    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    EQUALS("equals"),
    REGEX("regex");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ConditionOperator fromCode(String code) {
        for (ConditionOperator operator : values()) {
            if (operator.code.equalsIgnoreCase(code) || operator.name().equalsIgnoreCase(code)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + code);
    }
}
