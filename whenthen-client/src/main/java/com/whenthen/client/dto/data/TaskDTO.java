package com.whenthen.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * TaskDTO - 任务视图
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDTO {

    private String id;

    private long torrentId;

    private String torrentName;

    private String playletId;

    private String playletName;

    /**
     * waiting / executing / completed / failed
     */
    private String status;

    private boolean awaitCompletion;

    @Builder.Default
    private List<ActionResultDTO> actionResults = new ArrayList<>();

    private Instant createdAt;

    private Instant completedAt;
}
