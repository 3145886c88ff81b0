package com.whenthen.domain.event;

/**
 * TaskEventPublisher - 任务事件发布接口
 *
 * @author whenthen
 */
public interface TaskEventPublisher {
    /**
     * 发布一个事件
     * @param event 事件对象
     */
    void publish(TaskEvent event);
}
