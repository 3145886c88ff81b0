package com.whenthen.infrastructure.torrent;

import com.whenthen.domain.gateway.TorrentAddResult;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.gateway.TorrentGateway;
import com.whenthen.infrastructure.config.InfrastructureProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * HttpTorrentGateway - 通过 HTTP 接口操作种子引擎
 * <p>
 * 接口约定：
 * <ul>
 *     <li>POST {base}/torrents，请求体 {source, savePath}，返回 {id, name, infoHash, fileCount}</li>
 *     <li>POST {base}/torrents/{id}/pause 与 /resume</li>
 *     <li>DELETE {base}/torrents/{id}?deleteFiles=</li>
 *     <li>GET {base}/torrents/{id}/files，返回 [{name, path, size, mimeType}]</li>
 * </ul>
 * 所有调用在 IO 线程池上执行，不阻塞引擎循环。
 * </p>
 */
@Slf4j
@Component
public class HttpTorrentGateway implements TorrentGateway {

    private final RestTemplate restTemplate;
    private final Executor ioExecutor;
    private final InfrastructureProperties properties;

    public HttpTorrentGateway(RestTemplate restTemplate,
                              @Qualifier("ioExecutor") Executor ioExecutor,
                              InfrastructureProperties properties) {
        this.restTemplate = restTemplate;
        this.ioExecutor = ioExecutor;
        this.properties = properties;
    }

    @Override
    public CompletableFuture<TorrentAddResult> addTorrent(String source, String savePath) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Object> body = new HashMap<>();
            body.put("source", source);
            if (savePath != null) {
                body.put("savePath", savePath);
            }
            log.info("Adding torrent from {}", source);
            TorrentAddResult result = restTemplate.postForObject(url("/torrents"), body, TorrentAddResult.class);
            if (result == null) {
                throw new IllegalStateException("Torrent engine returned no torrent for " + source);
            }
            return result;
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> pause(long torrentId) {
        return CompletableFuture.runAsync(() -> {
            log.info("Pausing torrent {}", torrentId);
            restTemplate.postForLocation(url("/torrents/" + torrentId + "/pause"), null);
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> resume(long torrentId) {
        return CompletableFuture.runAsync(() -> {
            log.info("Resuming torrent {}", torrentId);
            restTemplate.postForLocation(url("/torrents/" + torrentId + "/resume"), null);
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Void> delete(long torrentId, boolean deleteFiles) {
        return CompletableFuture.runAsync(() -> {
            log.info("Deleting torrent {} (files: {})", torrentId, deleteFiles);
            String uri = UriComponentsBuilder.fromHttpUrl(url("/torrents/" + torrentId))
                    .queryParam("deleteFiles", deleteFiles)
                    .toUriString();
            restTemplate.delete(uri);
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<List<TorrentFile>> listFiles(long torrentId) {
        return CompletableFuture.supplyAsync(() -> {
            TorrentFile[] files = restTemplate.getForObject(url("/torrents/" + torrentId + "/files"), TorrentFile[].class);
            return files != null ? Arrays.asList(files) : List.of();
        }, ioExecutor);
    }

    private String url(String path) {
        String baseUrl = properties.getTorrentEngineBaseUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + path;
    }
}
