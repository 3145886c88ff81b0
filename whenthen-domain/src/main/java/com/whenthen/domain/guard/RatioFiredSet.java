package com.whenthen.domain.guard;

import java.util.HashSet;
import java.util.Set;

/**
 * RatioFiredSet - 做种比例触发去重
 * <p>
 * 每个 (playletId, torrentId) 组合在分发器一次监听周期内至多触发一次。
 * 仅由引擎循环线程访问。
 * </p>
 */
public class RatioFiredSet {

    private final Set<String> fired = new HashSet<>();

    /**
     * 标记组合为已触发
     *
     * @return 之前未触发过时返回 true
     */
    public boolean markIfAbsent(String playletId, long torrentId) {
        return fired.add(key(playletId, torrentId));
    }

    public boolean contains(String playletId, long torrentId) {
        return fired.contains(key(playletId, torrentId));
    }

    public void clear() {
        fired.clear();
    }

    public int size() {
        return fired.size();
    }

    private static String key(String playletId, long torrentId) {
        return playletId + ":" + torrentId;
    }
}
