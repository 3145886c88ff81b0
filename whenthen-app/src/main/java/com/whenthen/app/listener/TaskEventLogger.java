package com.whenthen.app.listener;

import com.whenthen.domain.event.TaskEvent;
import com.whenthen.domain.event.TaskEventListener;
import com.whenthen.domain.event.TaskEventType;
import com.whenthen.domain.task.ActionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TaskEventLogger - 把任务事件写入日志
 */
@Slf4j
@Component
public class TaskEventLogger implements TaskEventListener {

    @Override
    public void onTaskEvent(TaskEvent event) {
        if (event.getType() == TaskEventType.ACTION_STATUS_CHANGED) {
            if (event.getActionStatus() == ActionStatus.FAILED) {
                log.warn("[task {}] action {} failed: {}", event.getTaskId(), event.getActionId(), event.getError());
            } else {
                log.debug("[task {}] action {} -> {}", event.getTaskId(), event.getActionId(), event.getActionStatus().getCode());
            }
            return;
        }
        log.info("[task {}] {} (torrent {}, status {})", event.getTaskId(), event.getType().getCode(),
                event.getTorrentId(), event.getTaskStatus() != null ? event.getTaskStatus().getCode() : "-");
    }
}
