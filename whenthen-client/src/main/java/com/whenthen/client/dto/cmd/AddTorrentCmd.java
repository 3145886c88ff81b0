package com.whenthen.client.dto.cmd;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * AddTorrentCmd - 添加种子并直接指派给 Playlet（手动拖放）
 */
@Data
public class AddTorrentCmd {

    /**
     * magnet 链接或 .torrent 文件路径
     */
    @NotBlank
    private String source;

    private String savePath;

    @NotBlank
    private String playletId;
}
