package com.whenthen.domain.task;

import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.playlet.PlayletAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * ActionResult - 行为执行结果
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResult {

    /**
     * 对应任务快照中的行为 ID
     */
    private String actionId;

    private ActionType actionType;

    @Builder.Default
    private ActionStatus status = ActionStatus.PENDING;

    private Instant startedAt;

    private Instant completedAt;

    private String error;

    public static ActionResult pendingFor(PlayletAction action) {
        return ActionResult.builder()
                .actionId(action.getId())
                .actionType(action.getType())
                .status(ActionStatus.PENDING)
                .build();
    }

    void reset() {
        status = ActionStatus.PENDING;
        startedAt = null;
        completedAt = null;
        error = null;
    }
}
