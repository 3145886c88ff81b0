package com.whenthen.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * EngineStatusDTO - 引擎运行状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStatusDTO {

    /**
     * idle / listening
     */
    private String state;

    private int runningTasks;

    private int queuedTasks;
}
