package com.whenthen.domain.gateway;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * TorrentGateway - 下载引擎的命令接口
 * <p>
 * 所有调用都是异步的，失败通过异常完成的 future 返回。
 * </p>
 */
public interface TorrentGateway {

    /**
     * 添加种子
     * @param source magnet 链接或 .torrent 文件路径
     * @param savePath 保存目录，为空时使用引擎默认目录
     */
    CompletableFuture<TorrentAddResult> addTorrent(String source, String savePath);

    CompletableFuture<Void> pause(long torrentId);

    CompletableFuture<Void> resume(long torrentId);

    CompletableFuture<Void> delete(long torrentId, boolean deleteFiles);

    CompletableFuture<List<TorrentFile>> listFiles(long torrentId);
}
