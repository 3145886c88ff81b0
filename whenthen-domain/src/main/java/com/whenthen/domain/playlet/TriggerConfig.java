package com.whenthen.domain.playlet;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TriggerConfig - 触发器配置（值对象）
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerConfig {

    /**
     * 未配置阈值时的默认分享率
     */
    public static final double DEFAULT_SEEDING_RATIO = 1.0;

    /**
     * 触发类型
     */
    @Builder.Default
    private TriggerType type = TriggerType.TORRENT_ADDED;

    /**
     * 分享率阈值（仅 seeding_ratio）
     */
    private Double seedingRatio;

    /**
     * 监控目录（仅 folder_watch，可为空表示任意目录）
     */
    private String watchFolder;

    public double effectiveSeedingRatio() {
        return seedingRatio != null ? seedingRatio : DEFAULT_SEEDING_RATIO;
    }

    public boolean hasWatchFolder() {
        return watchFolder != null && !watchFolder.isBlank();
    }

    public static TriggerConfig of(TriggerType type) {
        return TriggerConfig.builder().type(type).build();
    }
}
