package com.whenthen.domain.event;

/**
 * TaskEventType - 任务变更事件类型
 *
 * @author whenthen
 */
public enum TaskEventType {

    TASK_CREATED("task.created"),
    TASK_STATUS_CHANGED("task.status_changed"),
    ACTION_STATUS_CHANGED("task.action_changed"),
    TASK_REMOVED("task.removed");

    private final String code;

    TaskEventType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
