package com.whenthen.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResultDTO {

    private String actionId;

    /**
     * 行为类型编码，如 move / webhook
     */
    private String actionType;

    /**
     * pending / running / done / failed / skipped
     */
    private String status;

    private Instant startedAt;

    private Instant completedAt;

    private String error;
}
