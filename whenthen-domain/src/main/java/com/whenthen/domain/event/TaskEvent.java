package com.whenthen.domain.event;

import com.whenthen.domain.task.ActionResult;
import com.whenthen.domain.task.ActionStatus;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.TaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TaskEvent - 任务状态变更通知
 * <p>
 * 引擎在任务或行为状态变化时发布，UI / 通知层显式订阅。
 * </p>
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskEvent {

    private TaskEventType type;

    private String taskId;

    private long torrentId;

    private String playletId;

    private TaskStatus taskStatus;

    /**
     * 仅 ACTION_STATUS_CHANGED 使用
     */
    private String actionId;

    private ActionStatus actionStatus;

    private String error;

    @Builder.Default
    private Instant time = Instant.now();

    public static TaskEvent of(TaskEventType type, Task task) {
        return TaskEvent.builder()
                .type(type)
                .taskId(task.getId())
                .torrentId(task.getTorrentId())
                .playletId(task.getPlayletId())
                .taskStatus(task.getStatus())
                .build();
    }

    public static TaskEvent actionChanged(Task task, ActionResult result) {
        return TaskEvent.builder()
                .type(TaskEventType.ACTION_STATUS_CHANGED)
                .taskId(task.getId())
                .torrentId(task.getTorrentId())
                .playletId(task.getPlayletId())
                .taskStatus(task.getStatus())
                .actionId(result.getActionId())
                .actionStatus(result.getStatus())
                .error(result.getError())
                .build();
    }
}
