package com.whenthen.domain.guard;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * ManualDropCounter - 手动添加种子计数
 * <p>
 * 用户"添加并指派"时先 begin()，随后到达的 torrent_added 事件消耗一次计数，
 * 不再走自动匹配。添加命令完成与事件到达之间存在竞争，计数只能保证数量对应，
 * 不保证是同一个种子。
 * </p>
 */
public class ManualDropCounter {

    private final AtomicInteger pending = new AtomicInteger();

    public void begin() {
        pending.incrementAndGet();
    }

    /**
     * 有待消耗的计数时减一并返回 true
     */
    public boolean consumeIfPending() {
        while (true) {
            int current = pending.get();
            if (current <= 0) {
                return false;
            }
            if (pending.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    /**
     * 添加命令失败时撤销 begin()
     */
    public void cancel() {
        consumeIfPending();
    }

    public int pending() {
        return pending.get();
    }
}
