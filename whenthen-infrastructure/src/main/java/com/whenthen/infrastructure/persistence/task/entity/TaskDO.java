package com.whenthen.infrastructure.persistence.task.entity;

import com.baomidou.mybatisplus.annotation.FieldStrategy;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * TaskDO - 任务数据对象
 * <p>
 * actions 与 fileFilter 是创建时的快照，actionResults 与 actions 按下标一一对应。
 * </p>
 *
 * @author whenthen
 */
@Data
@TableName(value = "task", autoResultMap = true)
public class TaskDO {

    @TableId(type = IdType.INPUT)
    private String id;

    private Long torrentId;

    private String torrentName;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String playletId;

    private String playletName;

    /**
     * waiting / executing / completed / failed
     */
    private String status;

    private Boolean awaitCompletion;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Map<String, Object>> actions;

    @TableField(typeHandler = JacksonTypeHandler.class, updateStrategy = FieldStrategy.ALWAYS)
    private Map<String, Object> fileFilter;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Map<String, Object>> actionResults;

    private Instant createdAt;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private Instant completedAt;
}
