package com.whenthen.adapter.web;

import com.whenthen.app.service.AutomationAppService;
import com.whenthen.client.dto.MultiResponse;
import com.whenthen.client.dto.cmd.TorrentEventCmd;
import com.whenthen.client.dto.data.TaskDTO;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * TorrentEventController - 接收下载引擎推送的种子事件
 * <p>
 * 返回该事件创建的任务。引擎处于 idle 状态时事件被忽略，返回空列表。
 * </p>
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class TorrentEventController {

    private final AutomationAppService automationAppService;

    @PostMapping
    public MultiResponse<TaskDTO> onEvent(@Valid @RequestBody TorrentEventCmd cmd) {
        return MultiResponse.of(automationAppService.onTorrentEvent(cmd));
    }
}
