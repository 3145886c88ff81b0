package com.whenthen.infrastructure.torrent;

import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.event.TorrentEventType;
import com.whenthen.domain.gateway.TorrentInfo;
import com.whenthen.domain.gateway.TorrentRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemoryTorrentRegistry - 由入站事件维护的种子快照
 * <p>
 * 只保留最近一次已知的值；事件中缺失的字段不覆盖已有值。完成状态一旦置位不再回退。
 * </p>
 */
@Slf4j
@Component
public class InMemoryTorrentRegistry implements TorrentRegistry {

    private final Map<Long, TorrentInfo> torrents = new ConcurrentHashMap<>();

    @Override
    public Optional<TorrentInfo> find(long torrentId) {
        TorrentInfo info = torrents.get(torrentId);
        if (info == null) {
            return Optional.empty();
        }
        return Optional.of(TorrentInfo.builder()
                .id(info.getId())
                .name(info.getName())
                .infoHash(info.getInfoHash())
                .totalBytes(info.getTotalBytes())
                .uploadedBytes(info.getUploadedBytes())
                .fileCount(info.getFileCount())
                .state(info.getState())
                .completed(info.isCompleted())
                .build());
    }

    @Override
    public boolean isComplete(long torrentId) {
        TorrentInfo info = torrents.get(torrentId);
        return info != null && info.isCompleted();
    }

    @Override
    public void record(TorrentEvent event) {
        torrents.compute(event.getTorrentId(), (id, existing) -> {
            TorrentInfo info = existing != null ? existing : TorrentInfo.builder().id(id).build();
            if (event.getName() != null && !event.getName().isBlank()) {
                info.setName(event.getName());
            }
            if (event.getInfoHash() != null) {
                info.setInfoHash(event.getInfoHash());
            }
            if (event.getFileCount() != null) {
                info.setFileCount(event.getFileCount());
            }
            if (event.getTotalBytes() != null) {
                info.setTotalBytes(event.getTotalBytes());
            }
            if (event.getUploadedBytes() != null) {
                info.setUploadedBytes(event.getUploadedBytes());
            }
            if (event.getState() != null) {
                info.setState(event.getState());
            }
            if (event.getType() == TorrentEventType.COMPLETED || event.isStateCompleted()) {
                info.setCompleted(true);
            }
            return info;
        });
        log.debug("Torrent {} recorded from {} event", event.getTorrentId(), event.getType());
    }

    @Override
    public void forget(long torrentId) {
        torrents.remove(torrentId);
    }
}
