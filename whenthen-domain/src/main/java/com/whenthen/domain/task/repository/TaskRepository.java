package com.whenthen.domain.task.repository;

import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.TaskStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * TaskRepository - 任务仓储接口
 * <p>
 * 引擎在每次状态变更后显式调用 save；启动时通过 findAll 全量加载。
 * 返回列表的查询均按创建时间倒序。
 * </p>
 *
 * @author whenthen
 */
public interface TaskRepository {

    List<Task> findAll();

    Optional<Task> findById(@NotBlank String taskId);

    List<Task> findByStatus(@NotNull TaskStatus status);

    /**
     * 查找种子当前的活跃任务（WAITING / EXECUTING）
     */
    Optional<Task> findActiveByTorrentId(long torrentId);

    List<Task> findByPlayletId(@NotBlank String playletId);

    void save(@NotNull Task task);

    void delete(@NotBlank String taskId);
}
