package com.whenthen.domain.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TorrentAddResult - 添加种子命令的返回
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TorrentAddResult {

    private long id;

    private String name;

    private String infoHash;

    private Integer fileCount;
}
