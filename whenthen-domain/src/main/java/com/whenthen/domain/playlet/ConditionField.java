package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ConditionField - 条件字段枚举
 *
 * @author whenthen
 */
public enum ConditionField {

    NAME("name", false),
    TOTAL_SIZE("total_size", true),
    FILE_COUNT("file_count", true);

    private final String code;
    private final boolean numeric;

    ConditionField(String code, boolean numeric) {
        this.code = code;
        this.numeric = numeric;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isNumeric() {
        return numeric;
    }

    @JsonCreator
    public static ConditionField fromCode(String code) {
        for (ConditionField field : values()) {
            if (field.code.equalsIgnoreCase(code) || field.name().equalsIgnoreCase(code)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown condition field: " + code);
    }
}
