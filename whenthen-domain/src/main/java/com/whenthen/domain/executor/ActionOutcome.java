package com.whenthen.domain.executor;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ActionOutcome - 行为执行结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionOutcome {

    private boolean success;

    private String error;

    public static ActionOutcome success() {
        return new ActionOutcome(true, null);
    }

    public static ActionOutcome failure(String error) {
        return new ActionOutcome(false, error);
    }

    /**
     * 从异常构造失败结果，消息为空时使用异常类名
     */
    public static ActionOutcome failure(Throwable error) {
        String message = error.getMessage();
        return failure(message != null && !message.isBlank() ? message : error.getClass().getSimpleName());
    }
}
