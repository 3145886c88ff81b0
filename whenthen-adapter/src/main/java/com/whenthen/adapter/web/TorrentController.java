package com.whenthen.adapter.web;

import com.whenthen.app.service.AutomationAppService;
import com.whenthen.client.dto.Response;
import com.whenthen.client.dto.SingleResponse;
import com.whenthen.client.dto.cmd.AddTorrentCmd;
import com.whenthen.client.dto.cmd.AssignTorrentCmd;
import com.whenthen.client.dto.cmd.TorrentCommandCmd;
import com.whenthen.client.dto.data.TaskDTO;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * TorrentController - 种子添加、指派与控制接口
 */
@RestController
@RequestMapping("/api/torrents")
@RequiredArgsConstructor
public class TorrentController {

    private final AutomationAppService automationAppService;

    /**
     * 添加种子并直接指派给 Playlet
     */
    @PostMapping
    public SingleResponse<TaskDTO> add(@Valid @RequestBody AddTorrentCmd cmd) {
        return automationAppService.addAndAssign(cmd);
    }

    @PostMapping("/assign")
    public SingleResponse<TaskDTO> assign(@Valid @RequestBody AssignTorrentCmd cmd) {
        return automationAppService.assign(cmd);
    }

    @PostMapping("/{id}/commands")
    public Response command(@PathVariable("id") long torrentId, @Valid @RequestBody TorrentCommandCmd cmd) {
        return automationAppService.torrentCommand(torrentId, cmd);
    }
}
