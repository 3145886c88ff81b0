package com.whenthen.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * InfrastructureProperties - 外部系统相关配置
 */
@Data
@ConfigurationProperties(prefix = "whenthen.infra")
public class InfrastructureProperties {

    /**
     * 种子引擎 HTTP 接口地址
     */
    private String torrentEngineBaseUrl = "http://localhost:9091/api";

    private int connectTimeoutSeconds = 5;

    /**
     * webhook 与种子引擎请求的读超时，超时即行为失败
     */
    private int webhookTimeoutSeconds = 30;

    /**
     * delay 行为未配置时长时的默认秒数
     */
    private long defaultDelaySeconds = 5;

    /**
     * 随 webhook 负载一起发送的下载目录，可为空
     */
    private String downloadDirectory;

    /**
     * 执行阻塞 HTTP 调用的线程数
     */
    private int ioThreads = 4;
}
