package com.whenthen.domain.playlet;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * FileFilter - 文件过滤配置
 * <p>
 * 引擎只负责透传给行为执行器，不解释其语义；仅在特异性打分时参与计算。
 * </p>
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileFilter {

    @Builder.Default
    private FileFilterCategory category = FileFilterCategory.ALL;

    @Builder.Default
    private List<String> customExtensions = new ArrayList<>();

    private boolean selectLargest;

    private Double minSizeMb;

    private String namePattern;

    public boolean hasMinSize() {
        return minSizeMb != null && minSizeMb > 0;
    }

    public FileFilter copy() {
        return FileFilter.builder()
                .category(category)
                .customExtensions(customExtensions != null ? new ArrayList<>(customExtensions) : new ArrayList<>())
                .selectLargest(selectLargest)
                .minSizeMb(minSizeMb)
                .namePattern(namePattern)
                .build();
    }
}
