package com.whenthen.app.dto;

import lombok.Data;

import java.util.List;

/**
 * 一次导入的多个 Playlet，顺序即用户排列顺序
 */
@Data
public class PlayletBundleYamlDto {
    private List<PlayletYamlDto> playlets;
}
