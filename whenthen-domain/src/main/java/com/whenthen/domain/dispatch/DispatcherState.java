package com.whenthen.domain.dispatch;

/**
 * DispatcherState - 触发分发器状态
 */
public enum DispatcherState {
    /**
     * 未启动或已停止，收到的事件被忽略
     */
    IDLE,
    LISTENING
}
