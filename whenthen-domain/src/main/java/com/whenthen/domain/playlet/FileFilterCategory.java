package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * FileFilterCategory - 文件过滤类别
 *
 * @author whenthen
 */
public enum FileFilterCategory {

    ALL("all"),
    VIDEO("video"),
    AUDIO("audio"),
    SUBTITLE("subtitle"),
    CUSTOM("custom");

    private final String code;

    FileFilterCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static FileFilterCategory fromCode(String code) {
        for (FileFilterCategory category : values()) {
            if (category.code.equalsIgnoreCase(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown file filter category: " + code);
    }
}
