package com.whenthen.domain.matcher;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MatchSubject - 条件匹配的输入
 * <p>
 * 数值属性为空表示事件或注册表中暂时不可得。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchSubject {

    private String name;

    private Long totalBytes;

    private Integer fileCount;

    public static MatchSubject named(String name) {
        return MatchSubject.builder().name(name).build();
    }
}
