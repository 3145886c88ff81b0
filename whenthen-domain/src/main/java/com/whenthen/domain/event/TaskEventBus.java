package com.whenthen.domain.event;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * TaskEventBus - 进程内任务事件总线
 * <p>
 * 监听器抛出的异常只记录日志，不影响其他监听器和引擎本身。
 * </p>
 *
 * @author whenthen
 */
@Slf4j
public class TaskEventBus implements TaskEventPublisher {

    private final CopyOnWriteArrayList<TaskEventListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void publish(TaskEvent event) {
        log.debug("Publishing {} for task {}", event.getType().getCode(), event.getTaskId());
        for (TaskEventListener listener : listeners) {
            try {
                listener.onTaskEvent(event);
            } catch (Exception e) {
                log.warn("Listener threw exception processing {}: {}", event.getType().getCode(), e.getMessage(), e);
            }
        }
    }

    public Subscription subscribe(TaskEventListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * 取消订阅句柄
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
