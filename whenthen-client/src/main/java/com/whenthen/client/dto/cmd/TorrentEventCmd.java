package com.whenthen.client.dto.cmd;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * TorrentEventCmd - 下载引擎推送的种子事件
 * <p>
 * type 取值：added / completed / metadata / progress / folder_watch_detected。
 * </p>
 */
@Data
public class TorrentEventCmd {

    @NotBlank
    private String type;

    @PositiveOrZero
    private long torrentId;

    private String name;

    private String infoHash;

    private Integer fileCount;

    private String state;

    private Long totalBytes;

    private Long uploadedBytes;

    private String path;
}
