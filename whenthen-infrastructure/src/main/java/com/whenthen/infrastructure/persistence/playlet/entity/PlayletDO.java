package com.whenthen.infrastructure.persistence.playlet.entity;

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
 * PlayletDO - Playlet 数据对象
 *
 * @author whenthen
 */
@Data
@TableName(value = "playlet", autoResultMap = true)
public class PlayletDO {

    /**
     * 业务 ID，由领域层生成
     */
    @TableId(type = IdType.INPUT)
    private String id;

    @TableField(updateStrategy = FieldStrategy.ALWAYS)
    private String name;

    private Boolean enabled;

    /**
     * 触发配置：type / seedingRatio / watchFolder
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> triggerConfig;

    private String conditionLogic;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Map<String, Object>> conditions;

    @TableField(typeHandler = JacksonTypeHandler.class, updateStrategy = FieldStrategy.ALWAYS)
    private Map<String, Object> fileFilter;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Map<String, Object>> actions;

    /**
     * 用户排列顺序，新建时追加到末尾
     */
    private Integer sortOrder;

    private Instant createdAt;
}
