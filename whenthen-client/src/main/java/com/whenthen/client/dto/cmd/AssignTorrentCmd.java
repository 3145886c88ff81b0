package com.whenthen.client.dto.cmd;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AssignTorrentCmd - 把已有种子指派给 Playlet
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AssignTorrentCmd {

    @PositiveOrZero
    private long torrentId;

    private String torrentName;

    @NotBlank
    private String playletId;

    /**
     * 手动指派跳过触发类型与条件检查
     */
    private boolean manual = true;
}
