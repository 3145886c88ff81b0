package com.whenthen.domain.dispatch;

import com.whenthen.domain.service.CommandOutcome;
import com.whenthen.domain.task.Task;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AssignmentResult - 指派结果，成功时携带新建的任务
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentResult {

    private CommandOutcome outcome;

    private Task task;

    public static AssignmentResult accepted(Task task) {
        return new AssignmentResult(CommandOutcome.ACCEPTED, task);
    }

    public static AssignmentResult rejected(CommandOutcome outcome) {
        return new AssignmentResult(outcome, null);
    }

    public boolean isAccepted() {
        return outcome == CommandOutcome.ACCEPTED;
    }
}
