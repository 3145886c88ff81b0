package com.whenthen.infrastructure.persistence.task;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.TaskStatus;
import com.whenthen.domain.task.repository.TaskRepository;
import com.whenthen.infrastructure.persistence.task.converter.TaskConverter;
import com.whenthen.infrastructure.persistence.task.entity.TaskDO;
import com.whenthen.infrastructure.persistence.task.mapper.TaskMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TaskRepositoryImpl - 任务仓储实现
 * <p>
 * 所有列表查询按创建时间倒序返回。每次状态变更都整行写回。
 * </p>
 */
@Repository
@Validated
public class TaskRepositoryImpl implements TaskRepository {

    private final TaskMapper taskMapper;

    public TaskRepositoryImpl(TaskMapper taskMapper) {
        this.taskMapper = taskMapper;
    }

    @Override
    public List<Task> findAll() {
        return select(newestFirst());
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(TaskConverter.toDomain(taskMapper.selectById(taskId)));
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return select(newestFirst().eq(TaskDO::getStatus, status.getCode()));
    }

    @Override
    public Optional<Task> findActiveByTorrentId(long torrentId) {
        return select(newestFirst()
                .eq(TaskDO::getTorrentId, torrentId)
                .in(TaskDO::getStatus, TaskStatus.WAITING.getCode(), TaskStatus.EXECUTING.getCode())
        ).stream().findFirst();
    }

    @Override
    public List<Task> findByPlayletId(String playletId) {
        return select(newestFirst().eq(TaskDO::getPlayletId, playletId));
    }

    @Override
    @Transactional
    public void save(Task task) {
        TaskDO dataObject = TaskConverter.toDataObject(task);
        if (taskMapper.selectById(task.getId()) == null) {
            taskMapper.insert(dataObject);
        } else {
            taskMapper.updateById(dataObject);
        }
    }

    @Override
    public void delete(String taskId) {
        taskMapper.deleteById(taskId);
    }

    private LambdaQueryWrapper<TaskDO> newestFirst() {
        return new LambdaQueryWrapper<TaskDO>()
                .orderByDesc(TaskDO::getCreatedAt)
                .orderByDesc(TaskDO::getId);
    }

    private List<Task> select(LambdaQueryWrapper<TaskDO> query) {
        return taskMapper.selectList(query).stream()
                .map(TaskConverter::toDomain)
                .collect(Collectors.toList());
    }
}
