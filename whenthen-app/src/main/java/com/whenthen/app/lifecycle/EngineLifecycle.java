package com.whenthen.app.lifecycle;

import com.whenthen.app.config.EngineProperties;
import com.whenthen.app.service.AutomationAppService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 应用就绪后加载并对账任务、开始监听；关闭时停止监听
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineLifecycle {

    private final AutomationAppService appService;
    private final EngineProperties properties;

    private volatile boolean started;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.isAutoStart()) {
            log.info("Engine auto-start disabled");
            return;
        }
        int reconciled = appService.start();
        started = true;
        log.info("Automation engine started, {} interrupted tasks reconciled", reconciled);
    }

    @PreDestroy
    public void shutdown() {
        if (!started) {
            return;
        }
        try {
            appService.stop();
            log.info("Automation engine stopped");
        } catch (RuntimeException e) {
            log.warn("Engine did not stop cleanly: {}", e.getMessage());
        }
        started = false;
    }
}
