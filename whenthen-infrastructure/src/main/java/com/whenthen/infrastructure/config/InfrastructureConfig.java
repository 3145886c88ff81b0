package com.whenthen.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * InfrastructureConfig - HTTP 客户端与 IO 线程池
 */
@Configuration
@EnableConfigurationProperties(InfrastructureProperties.class)
public class InfrastructureConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, InfrastructureProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .setReadTimeout(Duration.ofSeconds(properties.getWebhookTimeoutSeconds()))
                .build();
    }

    /**
     * 阻塞的 RestTemplate 调用在这里执行，结果以 CompletableFuture 交回引擎
     */
    @Bean
    public ThreadPoolTaskExecutor ioExecutor(InfrastructureProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getIoThreads());
        executor.setMaxPoolSize(properties.getIoThreads());
        executor.setThreadNamePrefix("whenthen-io-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
