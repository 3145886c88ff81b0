package com.whenthen.infrastructure.persistence.task.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.whenthen.infrastructure.persistence.task.entity.TaskDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * TaskMapper - 任务Mapper
 */
@Mapper
public interface TaskMapper extends BaseMapper<TaskDO> {
}
