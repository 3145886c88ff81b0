package com.whenthen.domain.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TorrentFile - 种子内的单个文件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TorrentFile {

    private String name;

    /**
     * 磁盘上的绝对路径
     */
    private String path;

    private long size;

    private String mimeType;
}
