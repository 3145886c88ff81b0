package com.whenthen.infrastructure.executor;

import com.whenthen.domain.executor.ActionContext;
import com.whenthen.domain.executor.ActionOutcome;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.infrastructure.config.InfrastructureProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class WebhookActionExecutorTest {

    private MockRestServiceServer mockServer;
    private WebhookActionExecutor executor;
    private InfrastructureProperties properties;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.createServer(restTemplate);
        properties = new InfrastructureProperties();
        executor = new WebhookActionExecutor(restTemplate, Runnable::run, properties);
    }

    private ActionContext context(String url, String method) {
        PlayletAction action = PlayletAction.create(ActionType.WEBHOOK);
        action.getConfig().put("url", url);
        action.getConfig().put("method", method);
        return ActionContext.builder()
                .taskId("t1")
                .action(action)
                .torrentId(42)
                .torrentName("Movie.2024.1080p")
                .files(List.of(TorrentFile.builder()
                        .name("movie.mkv").path("/downloads/movie.mkv").size(1024L).mimeType("video/x-matroska")
                        .build()))
                .build();
    }

    @Test
    void testPostSendsTorrentPayload() {
        properties.setDownloadDirectory("/downloads");
        mockServer.expect(requestTo("http://hooks.local/done"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.torrentName").value("Movie.2024.1080p"))
                .andExpect(jsonPath("$.torrentId").value(42))
                .andExpect(jsonPath("$.files[0].path").value("/downloads/movie.mkv"))
                .andExpect(jsonPath("$.files[0].mime_type").value("video/x-matroska"))
                .andExpect(jsonPath("$.downloadDir").value("/downloads"))
                .andRespond(withSuccess());

        ActionOutcome outcome = executor.execute(context("http://hooks.local/done", "POST")).join();

        assertTrue(outcome.isSuccess());
        mockServer.verify();
    }

    @Test
    void testGetSendsNoBody() {
        mockServer.expect(requestTo("http://hooks.local/ping"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(content().string(""))
                .andRespond(withSuccess());

        assertTrue(executor.execute(context("http://hooks.local/ping", "GET")).join().isSuccess());
        mockServer.verify();
    }

    @Test
    void testNonSuccessStatusFailsAction() {
        mockServer.expect(requestTo("http://hooks.local/done"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        ActionOutcome outcome = executor.execute(context("http://hooks.local/done", "POST")).join();

        assertFalse(outcome.isSuccess());
        assertEquals("Webhook returned 503", outcome.getError());
    }

    @Test
    void testMissingUrlFailsWithoutRequest() {
        ActionOutcome outcome = executor.execute(context("", "POST")).join();

        assertFalse(outcome.isSuccess());
        assertEquals("No webhook URL set", outcome.getError());
        mockServer.verify();
    }
}
