package com.whenthen.domain.event;

/**
 * TorrentEventType - 外部种子事件类型
 *
 * @author whenthen
 */
public enum TorrentEventType {

    /**
     * {id, name, infoHash, fileCount}
     */
    ADDED,

    /**
     * {id}
     */
    COMPLETED,

    /**
     * {id, name}
     */
    METADATA,

    /**
     * {id, state, totalBytes, uploadedBytes}
     */
    PROGRESS,

    /**
     * {path, id, name}
     */
    FOLDER_WATCH_DETECTED
}
