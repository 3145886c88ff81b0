package com.whenthen.domain.playlet;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * PlayletAction - Playlet 中的一个行为步骤
 * <p>
 * config 的结构由 type 决定，例如 move 需要 destination，webhook 需要 url 与 method。
 * </p>
 *
 * @author whenthen
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayletAction {

    private String id;

    private ActionType type;

    @Builder.Default
    private Map<String, Object> config = new HashMap<>();

    /**
     * 以类型默认配置创建行为
     */
    public static PlayletAction create(ActionType type) {
        return PlayletAction.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .config(type.newDefaultConfig())
                .build();
    }

    public String getString(String key) {
        Object value = config != null ? config.get(key) : null;
        return value != null ? value.toString() : null;
    }

    public PlayletAction copy() {
        return PlayletAction.builder()
                .id(id)
                .type(type)
                .config(config != null ? new HashMap<>(config) : new HashMap<>())
                .build();
    }
}
