package com.whenthen.infrastructure.persistence.task.converter;

import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.domain.task.ActionResult;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.TaskStatus;
import com.whenthen.infrastructure.persistence.JsonColumns;
import com.whenthen.infrastructure.persistence.task.entity.TaskDO;

/**
 * TaskConverter - 任务转换器
 */
public class TaskConverter {

    /**
     * 领域对象转数据对象
     */
    public static TaskDO toDataObject(Task domain) {
        if (domain == null) {
            return null;
        }

        TaskDO dataObject = new TaskDO();
        dataObject.setId(domain.getId());
        dataObject.setTorrentId(domain.getTorrentId());
        dataObject.setTorrentName(domain.getTorrentName());
        dataObject.setPlayletId(domain.getPlayletId());
        dataObject.setPlayletName(domain.getPlayletName());
        dataObject.setStatus(domain.getStatus().getCode());
        dataObject.setAwaitCompletion(domain.isAwaitCompletion());
        dataObject.setActions(JsonColumns.toMaps(domain.getActions()));
        dataObject.setFileFilter(JsonColumns.toMap(domain.getFileFilter()));
        dataObject.setActionResults(JsonColumns.toMaps(domain.getActionResults()));
        dataObject.setCreatedAt(domain.getCreatedAt());
        dataObject.setCompletedAt(domain.getCompletedAt());
        return dataObject;
    }

    /**
     * 数据对象转领域对象
     */
    public static Task toDomain(TaskDO dataObject) {
        if (dataObject == null) {
            return null;
        }

        Task domain = new Task();
        domain.setId(dataObject.getId());
        domain.setTorrentId(dataObject.getTorrentId() != null ? dataObject.getTorrentId() : 0L);
        domain.setTorrentName(dataObject.getTorrentName());
        domain.setPlayletId(dataObject.getPlayletId());
        domain.setPlayletName(dataObject.getPlayletName());
        domain.setStatus(TaskStatus.fromCode(dataObject.getStatus()));
        domain.setAwaitCompletion(Boolean.TRUE.equals(dataObject.getAwaitCompletion()));
        domain.setActions(JsonColumns.fromMaps(dataObject.getActions(), PlayletAction.class));
        domain.setFileFilter(JsonColumns.fromMap(dataObject.getFileFilter(), FileFilter.class));
        domain.setActionResults(JsonColumns.fromMaps(dataObject.getActionResults(), ActionResult.class));
        domain.setCreatedAt(dataObject.getCreatedAt());
        domain.setCompletedAt(dataObject.getCompletedAt());
        return domain;
    }
}
