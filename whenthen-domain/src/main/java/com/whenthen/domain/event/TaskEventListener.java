package com.whenthen.domain.event;

/**
 * TaskEventListener - 任务事件监听接口
 *
 * @author whenthen
 */
public interface TaskEventListener {
    /**
     * 处理任务事件
     * @param event 事件对象
     */
    void onTaskEvent(TaskEvent event);
}
