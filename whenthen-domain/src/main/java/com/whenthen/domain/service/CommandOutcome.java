package com.whenthen.domain.service;

/**
 * CommandOutcome - 用户命令的处理结果
 *
 * @author whenthen
 */
public enum CommandOutcome {

    ACCEPTED("OK", "Accepted"),
    TASK_NOT_FOUND("TASK_NOT_FOUND", "Task not found"),
    PLAYLET_NOT_FOUND("PLAYLET_NOT_FOUND", "Playlet not found"),
    PLAYLET_DISABLED("PLAYLET_DISABLED", "Playlet is disabled"),
    DUPLICATE_ASSIGNMENT("DUPLICATE_ASSIGNMENT", "Torrent already has an active task"),
    TRIGGER_MISMATCH("TRIGGER_MISMATCH", "Playlet does not trigger on torrent added"),
    CONDITIONS_NOT_MET("CONDITIONS_NOT_MET", "Torrent does not match the playlet conditions"),
    NOT_RETRYABLE("NOT_RETRYABLE", "Only failed tasks can be retried"),
    NOT_REASSIGNABLE("NOT_REASSIGNABLE", "Only waiting tasks that have not started can be reassigned");

    private final String errCode;
    private final String message;

    CommandOutcome(String errCode, String message) {
        this.errCode = errCode;
        this.message = message;
    }

    public String getErrCode() {
        return errCode;
    }

    public String getMessage() {
        return message;
    }

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
