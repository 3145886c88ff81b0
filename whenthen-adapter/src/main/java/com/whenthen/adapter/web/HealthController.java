package com.whenthen.adapter.web;

import com.whenthen.app.service.AutomationAppService;
import com.whenthen.client.dto.SingleResponse;
import com.whenthen.client.dto.data.EngineStatusDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HealthController - 健康检查与引擎状态
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {

    private final AutomationAppService automationAppService;

    @GetMapping("/health")
    public SingleResponse<EngineStatusDTO> health() {
        return SingleResponse.of(automationAppService.status());
    }
}
