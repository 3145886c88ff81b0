package com.whenthen.domain.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * TaskStatus - 任务状态枚举
 *
 * @author whenthen
 */
public enum TaskStatus {

    /**
     * 等待中 - 尚未开始，或等待前置条件（下载完成 / 并发槽位 / Playlet 重新启用）
     */
    WAITING("waiting", "等待中"),

    /**
     * 执行中 - 某个行为正在执行或处于两个行为之间
     */
    EXECUTING("executing", "执行中"),

    /**
     * 已完成
     */
    COMPLETED("completed", "已完成"),

    /**
     * 已失败 - 可重试
     */
    FAILED("failed", "已失败");

    private final String code;
    private final String description;

    TaskStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isActive() {
        return this == WAITING || this == EXECUTING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static TaskStatus fromCode(String code) {
        for (TaskStatus status : values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + code);
    }
}
