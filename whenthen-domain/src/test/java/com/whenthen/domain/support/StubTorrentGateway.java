package com.whenthen.domain.support;

import com.whenthen.domain.gateway.TorrentAddResult;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.gateway.TorrentGateway;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public class StubTorrentGateway implements TorrentGateway {
    private final Map<Long, List<TorrentFile>> files = new HashMap<>();

    private final List<String> commands = new ArrayList<>();

    private boolean failListing;

    @Override
    public CompletableFuture<TorrentAddResult> addTorrent(String source, String savePath) {
        commands.add("add:" + source);
        return CompletableFuture.completedFuture(TorrentAddResult.builder().id(1L).name(source).build());
    }

    @Override
    public CompletableFuture<Void> pause(long torrentId) {
        commands.add("pause:" + torrentId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> resume(long torrentId) {
        commands.add("resume:" + torrentId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> delete(long torrentId, boolean deleteFiles) {
        commands.add("delete:" + torrentId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<TorrentFile>> listFiles(long torrentId) {
        if (failListing) {
            return CompletableFuture.failedFuture(new IllegalStateException("engine offline"));
        }
        return CompletableFuture.completedFuture(files.getOrDefault(torrentId, new ArrayList<>()));
    }

    // --- 测试辅助方法 ---

    public void putFiles(long torrentId, List<TorrentFile> torrentFiles) {
        files.put(torrentId, torrentFiles);
    }

    public void setFailListing(boolean failListing) {
        this.failListing = failListing;
    }

    public List<String> getCommands() {
        return commands;
    }
}
