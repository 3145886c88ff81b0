package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * ActionType - 行为类型枚举
 * <p>
 * 每种类型由一个外部 {@code ActionExecutor} 实现，
 * verb 用于生成 Playlet 的默认显示名称，defaultConfig 为新建行为时的初始配置。
 * </p>
 *
 * @author whenthen
 */
public enum ActionType {

    CAST("cast", "cast", Map.of()),
    MOVE("move", "move", Map.of("destination", "")),
    NOTIFY("notify", "notify", Map.of("method", "system")),
    PLAY("play", "play", Map.of("app", "")),
    SUBTITLE("subtitle", "subtitle", Map.of("languages", List.of())),
    AUTOMATION("automation", "automate", Map.of("method", "shell", "script", "", "shortcutName", "")),
    DELAY("delay", "wait", Map.of("seconds", 5, "delayUnit", "seconds")),
    WEBHOOK("webhook", "webhook", Map.of("url", "", "method", "POST")),
    DELETE_SOURCE("delete_source", "clean up", Map.of("deleteFiles", true));

    private final String code;
    private final String verb;
    private final Map<String, Object> defaultConfig;

    ActionType(String code, String verb, Map<String, Object> defaultConfig) {
        this.code = code;
        this.verb = verb;
        this.defaultConfig = defaultConfig;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getVerb() {
        return verb;
    }

    /**
     * 返回默认配置的可变副本
     */
    public Map<String, Object> newDefaultConfig() {
        return new HashMap<>(defaultConfig);
    }

    @JsonCreator
    public static ActionType fromCode(String code) {
        for (ActionType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + code);
    }
}
