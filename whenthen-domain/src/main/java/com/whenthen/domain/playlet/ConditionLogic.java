package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ConditionLogic - 多个条件的组合方式
 *
 * @author whenthen
 */
public enum ConditionLogic {

    AND("and"),
    OR("or");

    private final String code;

    ConditionLogic(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ConditionLogic fromCode(String code) {
        if (code == null) {
            return AND;
        }
        for (ConditionLogic logic : values()) {
            if (logic.code.equalsIgnoreCase(code)) {
                return logic;
            }
        }
        throw new IllegalArgumentException("Unknown condition logic: " + code);
    }
}
