package com.whenthen.adapter.web;

import com.whenthen.app.service.AutomationAppService;
import com.whenthen.client.dto.MultiResponse;
import com.whenthen.client.dto.Response;
import com.whenthen.client.dto.SingleResponse;
import com.whenthen.client.dto.data.PlayletDTO;
import com.whenthen.domain.playlet.Playlet;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * PlayletController - Playlet 管理接口
 * <p>
 * 支持 JSON 方式保存单个 Playlet，以及 YAML 文本批量导入。
 * </p>
 */
@RestController
@RequestMapping("/api/playlets")
@RequiredArgsConstructor
public class PlayletController {

    private final AutomationAppService automationAppService;

    @GetMapping
    public MultiResponse<PlayletDTO> list() {
        return automationAppService.listPlaylets();
    }

    @GetMapping("/{id}")
    public SingleResponse<Playlet> get(@PathVariable("id") String id) {
        return automationAppService.getPlaylet(id);
    }

    @PostMapping
    public SingleResponse<PlayletDTO> save(@RequestBody Playlet playlet) {
        return SingleResponse.of(automationAppService.savePlaylet(playlet));
    }

    @PostMapping(value = "/import", consumes = {"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN_VALUE})
    public MultiResponse<PlayletDTO> importYaml(@RequestBody String yaml) {
        return MultiResponse.of(automationAppService.importPlaylets(yaml));
    }

    @PutMapping("/{id}/enabled")
    public Response setEnabled(@PathVariable("id") String id, @RequestParam("value") boolean enabled) {
        return automationAppService.setPlayletEnabled(id, enabled);
    }

    @DeleteMapping("/{id}")
    public Response delete(@PathVariable("id") String id) {
        return automationAppService.deletePlaylet(id);
    }
}
