package com.whenthen.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PlayletDTO - Playlet 摘要视图
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayletDTO {

    private String id;

    /**
     * 显示名称，未命名时为推导出的名称
     */
    private String name;

    private boolean enabled;

    private String triggerType;

    @Builder.Default
    private List<String> actionTypes = new ArrayList<>();

    private int conditionCount;

    private Instant createdAt;
}
