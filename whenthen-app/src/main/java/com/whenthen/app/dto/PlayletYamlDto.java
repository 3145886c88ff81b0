package com.whenthen.app.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Playlet 的 YAML 定义
 */
@Data
public class PlayletYamlDto {
    private String id;
    private String name;
    private Boolean enabled;
    private TriggerYamlDto trigger;
    private String conditionLogic; // and / or
    private List<ConditionYamlDto> conditions;
    private FileFilterYamlDto fileFilter;
    private List<ActionYamlDto> actions;

    @Data
    public static class TriggerYamlDto {
        private String type;
        private Double seedingRatio;
        private String watchFolder;
    }

    @Data
    public static class ConditionYamlDto {
        private String id;
        private String field;
        private String operator;
        private String sizeOperator;
        private String value;
        private Double numericValue;
        private Double numericValueEnd;
        private boolean negate;
    }

    @Data
    public static class FileFilterYamlDto {
        private String category;
        private List<String> customExtensions;
        private boolean selectLargest;
        private Double minSizeMb;
        private String namePattern;
    }

    @Data
    public static class ActionYamlDto {
        private String id;
        private String type;
        // merged over the type's default config
        private Map<String, Object> config;
    }
}
