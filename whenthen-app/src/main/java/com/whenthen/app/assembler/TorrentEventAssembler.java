package com.whenthen.app.assembler;

import com.whenthen.client.dto.cmd.TorrentEventCmd;
import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.event.TorrentEventType;

import java.time.Instant;
import java.util.Locale;

/**
 * TorrentEventAssembler - 把外部上报的事件命令转换为领域事件
 */
public final class TorrentEventAssembler {

    private TorrentEventAssembler() {
    }

    public static TorrentEvent toEvent(TorrentEventCmd cmd, Instant now) {
        return TorrentEvent.builder()
                .type(parseType(cmd.getType()))
                .torrentId(cmd.getTorrentId())
                .name(cmd.getName())
                .infoHash(cmd.getInfoHash())
                .fileCount(cmd.getFileCount())
                .state(cmd.getState())
                .totalBytes(cmd.getTotalBytes())
                .uploadedBytes(cmd.getUploadedBytes())
                .path(cmd.getPath())
                .time(now)
                .build();
    }

    static TorrentEventType parseType(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Torrent event type is required");
        }
        switch (type.toLowerCase(Locale.ROOT)) {
            case "added":
                return TorrentEventType.ADDED;
            case "completed":
                return TorrentEventType.COMPLETED;
            case "metadata":
                return TorrentEventType.METADATA;
            case "progress":
                return TorrentEventType.PROGRESS;
            case "folder_watch_detected":
                return TorrentEventType.FOLDER_WATCH_DETECTED;
            default:
                throw new IllegalArgumentException("Unknown torrent event type: " + type);
        }
    }
}
