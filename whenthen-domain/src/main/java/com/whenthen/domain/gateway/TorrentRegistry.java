package com.whenthen.domain.gateway;

import com.whenthen.domain.event.TorrentEvent;

import java.util.Optional;

/**
 * TorrentRegistry - 种子状态查询
 * <p>
 * 引擎只读；应用层在分发每个事件之前调用 {@link #record(TorrentEvent)} 更新快照。
 * </p>
 */
public interface TorrentRegistry {

    Optional<TorrentInfo> find(long torrentId);

    /**
     * 种子是否已下载完成，未知种子视为未完成
     */
    boolean isComplete(long torrentId);

    void record(TorrentEvent event);

    void forget(long torrentId);
}
