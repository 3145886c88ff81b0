package com.whenthen.infrastructure.executor;

import com.whenthen.domain.executor.ActionContext;
import com.whenthen.domain.executor.ActionExecutor;
import com.whenthen.domain.executor.ActionOutcome;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.infrastructure.config.InfrastructureProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * WebhookActionExecutor - webhook 行为执行器
 * <p>
 * 向配置的 url 发送种子名称、ID 与文件列表。只有 POST 携带请求体；
 * 非 2xx 响应以 "Webhook returned {status}" 失败，超时由 RestTemplate 的读超时决定。
 * </p>
 */
@Slf4j
@Component
public class WebhookActionExecutor implements ActionExecutor {

    private final RestTemplate restTemplate;
    private final Executor ioExecutor;
    private final InfrastructureProperties properties;

    public WebhookActionExecutor(RestTemplate restTemplate,
                                 @Qualifier("ioExecutor") Executor ioExecutor,
                                 InfrastructureProperties properties) {
        this.restTemplate = restTemplate;
        this.ioExecutor = ioExecutor;
        this.properties = properties;
    }

    @Override
    public ActionType type() {
        return ActionType.WEBHOOK;
    }

    @Override
    public CompletableFuture<ActionOutcome> execute(ActionContext context) {
        PlayletAction action = context.getAction();
        String url = action.getString("url");
        if (!StringUtils.hasText(url)) {
            return CompletableFuture.completedFuture(ActionOutcome.failure("No webhook URL set"));
        }
        HttpMethod method = getMethod(action.getString("method"));
        return CompletableFuture.supplyAsync(() -> send(url, method, context), ioExecutor);
    }

    private ActionOutcome send(String url, HttpMethod method, ActionContext context) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = HttpMethod.POST.equals(method)
                ? new HttpEntity<>(buildPayload(context), headers)
                : new HttpEntity<>(headers);

        log.info("Calling webhook {} {} for task {}", method, url, context.getTaskId());
        try {
            restTemplate.exchange(url, method, request, String.class);
            return ActionOutcome.success();
        } catch (RestClientResponseException e) {
            log.warn("Webhook {} answered {} for task {}", url, e.getStatusCode().value(), context.getTaskId());
            return ActionOutcome.failure("Webhook returned " + e.getStatusCode().value());
        } catch (RestClientException e) {
            log.warn("Webhook {} failed for task {}: {}", url, context.getTaskId(), e.getMessage());
            return ActionOutcome.failure(e);
        }
    }

    private Map<String, Object> buildPayload(ActionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("torrentName", context.getTorrentName());
        payload.put("torrentId", context.getTorrentId());
        payload.put("files", toFilePayload(context.getFiles()));
        if (properties.getDownloadDirectory() != null) {
            payload.put("downloadDir", properties.getDownloadDirectory());
        }
        return payload;
    }

    private List<Map<String, Object>> toFilePayload(List<TorrentFile> files) {
        if (files == null) {
            return List.of();
        }
        return files.stream().map(f -> {
            Map<String, Object> file = new LinkedHashMap<>();
            file.put("name", f.getName());
            file.put("path", f.getPath());
            file.put("size", f.getSize());
            file.put("mime_type", f.getMimeType());
            return file;
        }).collect(Collectors.toList());
    }

    private HttpMethod getMethod(String method) {
        if (!StringUtils.hasText(method)) {
            return HttpMethod.POST;
        }
        return HttpMethod.valueOf(method.toUpperCase(Locale.ROOT));
    }
}
