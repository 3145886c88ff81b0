package com.whenthen.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * EngineProperties - 引擎配置，绑定 {@code whenthen.engine.*}
 */
@Data
@ConfigurationProperties(prefix = "whenthen.engine")
public class EngineProperties {

    /**
     * 同时执行的任务上限，0 表示不限制
     */
    private int maxConcurrentTasks = 0;

    private String loopThreadName = "whenthen-engine";

    /**
     * 调用方等待引擎循环处理命令的最长时间
     */
    private int commandTimeoutSeconds = 30;

    /**
     * 应用就绪后自动对账并开始监听事件
     */
    private boolean autoStart = true;
}
