package com.whenthen.adapter.web;

import com.whenthen.app.service.AutomationAppService;
import com.whenthen.client.dto.MultiResponse;
import com.whenthen.client.dto.Response;
import com.whenthen.client.dto.SingleResponse;
import com.whenthen.client.dto.cmd.ReassignTaskCmd;
import com.whenthen.client.dto.data.TaskDTO;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * TaskController - 任务查询与操作接口
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final AutomationAppService automationAppService;

    @GetMapping
    public MultiResponse<TaskDTO> list() {
        return automationAppService.listTasks();
    }

    @GetMapping("/{id}")
    public SingleResponse<TaskDTO> get(@PathVariable("id") String id) {
        return automationAppService.getTask(id);
    }

    @PostMapping("/{id}/retry")
    public Response retry(@PathVariable("id") String id) {
        return automationAppService.retryTask(id);
    }

    @PostMapping("/{id}/reassign")
    public Response reassign(@PathVariable("id") String id, @Valid @RequestBody ReassignTaskCmd cmd) {
        return automationAppService.reassignTask(id, cmd.getPlayletId());
    }

    @DeleteMapping("/{id}")
    public Response remove(@PathVariable("id") String id) {
        return automationAppService.removeTask(id);
    }

    /**
     * 清除所有已完成和失败的任务
     */
    @DeleteMapping("/finished")
    public SingleResponse<Integer> clearFinished() {
        return SingleResponse.of(automationAppService.clearFinishedTasks());
    }
}
