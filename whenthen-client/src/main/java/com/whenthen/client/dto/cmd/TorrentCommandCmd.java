package com.whenthen.client.dto.cmd;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * TorrentCommandCmd - 对种子的控制命令
 */
@Data
public class TorrentCommandCmd {

    @NotBlank
    @Pattern(regexp = "pause|resume|delete")
    private String command;

    /**
     * 仅 delete 使用
     */
    private boolean deleteFiles;
}
