package com.whenthen.domain.playlet;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * TriggerType - 触发类型枚举
 * <p>
 * 决定哪一类种子事件可以让 Playlet 生成任务。
 * </p>
 *
 * @author whenthen
 */
public enum TriggerType {

    /**
     * 种子添加 - 每个种子只能归属一个 Playlet
     */
    TORRENT_ADDED("torrent_added", "添加时", true),

    /**
     * 下载完成
     */
    DOWNLOAD_COMPLETE("download_complete", "下载完成", false),

    /**
     * 元数据就绪
     */
    METADATA_RECEIVED("metadata_received", "元数据就绪", false),

    /**
     * 分享率达到阈值
     */
    SEEDING_RATIO("seeding_ratio", "分享率达标", false),

    /**
     * 监控目录发现新种子
     */
    FOLDER_WATCH("folder_watch", "目录监控", false);

    private final String code;
    private final String description;
    private final boolean singleOwner;

    TriggerType(String code, String description, boolean singleOwner) {
        this.code = code;
        this.description = description;
        this.singleOwner = singleOwner;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 是否只允许一个 Playlet 认领同一个种子（需要按特异性打分）
     */
    public boolean isSingleOwner() {
        return singleOwner;
    }

    @JsonCreator
    public static TriggerType fromCode(String code) {
        for (TriggerType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + code);
    }
}
