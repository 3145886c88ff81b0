package com.whenthen.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * TorrentEvent - 种子事件
 * <p>
 * 由外部下载引擎产生，按发出顺序逐个交给触发分发器。
 * 不同类型只使用部分字段，见 {@link TorrentEventType}。
 * </p>
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TorrentEvent {

    /**
     * 下载完成状态在 PROGRESS 事件中的取值
     */
    public static final String STATE_COMPLETED = "completed";

    private TorrentEventType type;

    private long torrentId;

    private String name;

    private String infoHash;

    private Integer fileCount;

    /**
     * 下载状态：initializing / downloading / paused / completed / error
     */
    private String state;

    private Long totalBytes;

    private Long uploadedBytes;

    /**
     * 监控目录中发现的种子文件路径
     */
    private String path;

    @Builder.Default
    private Instant time = Instant.now();

    public boolean isStateCompleted() {
        return STATE_COMPLETED.equalsIgnoreCase(state);
    }

    public static TorrentEvent added(long id, String name, String infoHash, Integer fileCount) {
        return TorrentEvent.builder().type(TorrentEventType.ADDED)
                .torrentId(id).name(name).infoHash(infoHash).fileCount(fileCount).build();
    }

    public static TorrentEvent completed(long id) {
        return TorrentEvent.builder().type(TorrentEventType.COMPLETED).torrentId(id).build();
    }

    public static TorrentEvent metadata(long id, String name) {
        return TorrentEvent.builder().type(TorrentEventType.METADATA).torrentId(id).name(name).build();
    }

    public static TorrentEvent progress(long id, String state, Long totalBytes, Long uploadedBytes) {
        return TorrentEvent.builder().type(TorrentEventType.PROGRESS)
                .torrentId(id).state(state).totalBytes(totalBytes).uploadedBytes(uploadedBytes).build();
    }

    public static TorrentEvent folderWatchDetected(String path, long id, String name) {
        return TorrentEvent.builder().type(TorrentEventType.FOLDER_WATCH_DETECTED)
                .path(path).torrentId(id).name(name).build();
    }
}
