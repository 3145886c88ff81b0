package com.whenthen.domain.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TorrentInfo - 种子的最新已知状态
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TorrentInfo {

    private long id;

    private String name;

    private String infoHash;

    /**
     * 未知时为空
     */
    private Long totalBytes;

    private Long uploadedBytes;

    private Integer fileCount;

    private String state;

    private boolean completed;
}
