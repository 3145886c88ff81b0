package com.whenthen.app.assembler;

import com.whenthen.client.dto.data.ActionResultDTO;
import com.whenthen.client.dto.data.TaskDTO;
import com.whenthen.domain.task.ActionResult;
import com.whenthen.domain.task.Task;

import java.util.List;
import java.util.stream.Collectors;

public final class TaskAssembler {

    private TaskAssembler() {
    }

    public static TaskDTO toDTO(Task task) {
        return TaskDTO.builder()
                .id(task.getId())
                .torrentId(task.getTorrentId())
                .torrentName(task.getTorrentName())
                .playletId(task.getPlayletId())
                .playletName(task.getPlayletName())
                .status(task.getStatus().getCode())
                .awaitCompletion(task.isAwaitCompletion())
                .actionResults(task.getActionResults().stream()
                        .map(TaskAssembler::toDTO)
                        .collect(Collectors.toList()))
                .createdAt(task.getCreatedAt())
                .completedAt(task.getCompletedAt())
                .build();
    }

    public static List<TaskDTO> toDTOs(List<Task> tasks) {
        return tasks.stream().map(TaskAssembler::toDTO).collect(Collectors.toList());
    }

    private static ActionResultDTO toDTO(ActionResult result) {
        return ActionResultDTO.builder()
                .actionId(result.getActionId())
                .actionType(result.getActionType() != null ? result.getActionType().getCode() : null)
                .status(result.getStatus().getCode())
                .startedAt(result.getStartedAt())
                .completedAt(result.getCompletedAt())
                .error(result.getError())
                .build();
    }
}
