package com.whenthen.domain.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * TaskAdmission - 任务并发准入
 * <p>
 * 通过前置条件的任务进入 FIFO 就绪队列；执行中的任务数小于上限时才允许出队。
 * 上限为 0 表示不限制。仅由引擎循环线程访问。
 * </p>
 */
public class TaskAdmission {

    private final int maxConcurrent;

    private final Deque<String> ready = new ArrayDeque<>();

    private final Set<String> running = new LinkedHashSet<>();

    public TaskAdmission(int maxConcurrent) {
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException("maxConcurrent must be >= 0, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    /**
     * 加入就绪队列，已排队或执行中的任务忽略
     */
    public boolean offer(String taskId) {
        if (running.contains(taskId) || ready.contains(taskId)) {
            return false;
        }
        ready.addLast(taskId);
        return true;
    }

    /**
     * 按空闲槽位出队，出队的任务计入执行中
     */
    public List<String> drain() {
        List<String> admitted = new ArrayList<>();
        while (!ready.isEmpty() && hasFreeSlot()) {
            String taskId = ready.pollFirst();
            running.add(taskId);
            admitted.add(taskId);
        }
        return admitted;
    }

    public void release(String taskId) {
        running.remove(taskId);
    }

    /**
     * 从队列和执行集合中同时移除
     */
    public void withdraw(String taskId) {
        ready.remove(taskId);
        running.remove(taskId);
    }

    public boolean hasFreeSlot() {
        return maxConcurrent == 0 || running.size() < maxConcurrent;
    }

    public boolean isRunning(String taskId) {
        return running.contains(taskId);
    }

    public boolean isQueued(String taskId) {
        return ready.contains(taskId);
    }

    public int runningCount() {
        return running.size();
    }

    public int queuedCount() {
        return ready.size();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }
}
