package com.whenthen.infrastructure.torrent;

import com.whenthen.domain.gateway.TorrentAddResult;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.infrastructure.config.InfrastructureProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpTorrentGatewayTest {

    private MockRestServiceServer mockServer;
    private HttpTorrentGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.createServer(restTemplate);
        InfrastructureProperties properties = new InfrastructureProperties();
        properties.setTorrentEngineBaseUrl("http://engine.local/api/");
        gateway = new HttpTorrentGateway(restTemplate, Runnable::run, properties);
    }

    @Test
    void testAddTorrent() {
        mockServer.expect(requestTo("http://engine.local/api/torrents"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.source").value("magnet:?xt=abc"))
                .andExpect(jsonPath("$.savePath").value("/downloads"))
                .andRespond(withSuccess("{\"id\":12,\"name\":\"Movie\",\"infoHash\":\"abc\",\"fileCount\":3}",
                        MediaType.APPLICATION_JSON));

        TorrentAddResult result = gateway.addTorrent("magnet:?xt=abc", "/downloads").join();

        assertThat(result.getId()).isEqualTo(12L);
        assertThat(result.getName()).isEqualTo("Movie");
        mockServer.verify();
    }

    @Test
    void testListFiles() {
        mockServer.expect(requestTo("http://engine.local/api/torrents/12/files"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[{\"name\":\"a.mkv\",\"path\":\"/d/a.mkv\",\"size\":10,\"mimeType\":\"video/x-matroska\"}]",
                        MediaType.APPLICATION_JSON));

        List<TorrentFile> files = gateway.listFiles(12).join();

        assertThat(files).hasSize(1);
        assertThat(files.get(0).getPath()).isEqualTo("/d/a.mkv");
        assertThat(files.get(0).getSize()).isEqualTo(10L);
    }

    @Test
    void testCommands() {
        mockServer.expect(requestTo("http://engine.local/api/torrents/12/pause"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());
        mockServer.expect(requestTo("http://engine.local/api/torrents/12/resume"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess());
        mockServer.expect(requestTo("http://engine.local/api/torrents/12?deleteFiles=false"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        gateway.pause(12).join();
        gateway.resume(12).join();
        gateway.delete(12, false).join();

        mockServer.verify();
    }

    @Test
    void testEngineErrorCompletesExceptionally() {
        mockServer.expect(requestTo("http://engine.local/api/torrents/99/pause"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> gateway.pause(99).join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(HttpClientErrorException.class);
    }
}
