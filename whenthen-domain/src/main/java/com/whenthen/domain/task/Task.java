package com.whenthen.domain.task;

import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.PlayletAction;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Task - 任务（聚合根）
 * <p>
 * 一个 Playlet 的行为序列针对一个种子的一次运行。
 * 创建时对 Playlet 的行为列表和文件过滤做快照，之后对 Playlet 的编辑不影响已创建的任务。
 * </p>
 * <p>
 * 不变式：DONE 结果总是构成行为顺序的前缀；第一个非 DONE 的结果只能是
 * RUNNING、PENDING，或者 FAILED 且其后全部为 SKIPPED。
 * </p>
 *
 * @author whenthen
 */
@Data
public class Task {

    private String id;

    private long torrentId;

    private String torrentName;

    /**
     * 所属 Playlet，可为空（例如获取失败的记录）
     */
    private String playletId;

    private String playletName;

    private TaskStatus status = TaskStatus.WAITING;

    /**
     * 第一个行为是否需要等到下载完成后才能开始
     */
    private boolean awaitCompletion;

    /**
     * 创建时的行为快照
     */
    private List<PlayletAction> actions = new ArrayList<>();

    /**
     * 创建时的文件过滤快照
     */
    private FileFilter fileFilter;

    /**
     * 与 actions 一一对应的执行结果
     */
    private List<ActionResult> actionResults = new ArrayList<>();

    private Instant createdAt;

    private Instant completedAt;

    /**
     * 创建新任务，所有行为结果初始化为 PENDING
     */
    public static Task create(long torrentId, String torrentName, Playlet playlet,
                              boolean awaitCompletion, Instant now) {
        Task task = new Task();
        task.id = UUID.randomUUID().toString();
        task.torrentId = torrentId;
        task.torrentName = torrentName;
        task.awaitCompletion = awaitCompletion;
        task.createdAt = now;
        task.status = TaskStatus.WAITING;
        if (playlet != null) {
            task.applyPlaylet(playlet);
        }
        return task;
    }

    private void applyPlaylet(Playlet playlet) {
        this.playletId = playlet.getId();
        this.playletName = playlet.displayName();
        this.actions = playlet.getActions().stream()
                .map(PlayletAction::copy)
                .collect(Collectors.toList());
        this.fileFilter = playlet.getFileFilter() != null ? playlet.getFileFilter().copy() : null;
        this.actionResults = actions.stream()
                .map(ActionResult::pendingFor)
                .collect(Collectors.toList());
    }

    public boolean isActive() {
        return status.isActive();
    }

    /**
     * 是否已有行为开始执行过
     */
    public boolean hasStarted() {
        return actionResults.stream().anyMatch(r -> r.getStatus() != ActionStatus.PENDING);
    }

    /**
     * 第一个非 DONE 结果的下标，全部完成时返回 -1
     */
    public int firstUnfinishedIndex() {
        for (int i = 0; i < actionResults.size(); i++) {
            if (actionResults.get(i).getStatus() != ActionStatus.DONE) {
                return i;
            }
        }
        return -1;
    }

    public Optional<PlayletAction> findAction(String actionId) {
        return actions.stream().filter(a -> a.getId().equals(actionId)).findFirst();
    }

    // ==================== 状态迁移 ====================

    public void startExecution() {
        if (status != TaskStatus.WAITING) {
            throw new IllegalStateException("Only waiting tasks can start executing. TaskId: " + id);
        }
        status = TaskStatus.EXECUTING;
    }

    /**
     * 在行为边界暂停，回到 WAITING
     */
    public void pause() {
        if (status == TaskStatus.EXECUTING) {
            status = TaskStatus.WAITING;
        }
    }

    public void markActionRunning(int index, Instant now) {
        ActionResult result = actionResults.get(index);
        result.setStatus(ActionStatus.RUNNING);
        result.setStartedAt(now);
        result.setCompletedAt(null);
        result.setError(null);
    }

    public void markActionDone(int index, Instant now) {
        ActionResult result = actionResults.get(index);
        result.setStatus(ActionStatus.DONE);
        result.setCompletedAt(now);
        result.setError(null);
    }

    /**
     * 标记行为失败：其后所有 PENDING 结果置为 SKIPPED，任务进入 FAILED
     */
    public void markActionFailed(int index, String error, Instant now) {
        ActionResult result = actionResults.get(index);
        result.setStatus(ActionStatus.FAILED);
        result.setCompletedAt(now);
        result.setError(error);
        for (int i = index + 1; i < actionResults.size(); i++) {
            ActionResult later = actionResults.get(i);
            if (later.getStatus() == ActionStatus.PENDING) {
                later.setStatus(ActionStatus.SKIPPED);
                later.setCompletedAt(now);
            }
        }
        status = TaskStatus.FAILED;
        completedAt = now;
    }

    public void complete(Instant now) {
        status = TaskStatus.COMPLETED;
        completedAt = now;
    }

    /**
     * 重试前重置：FAILED 与 SKIPPED 恢复为 PENDING，DONE 保持不变
     *
     * @return 任务不是 FAILED 时返回 false
     */
    public boolean resetForRetry() {
        if (status != TaskStatus.FAILED) {
            return false;
        }
        for (ActionResult result : actionResults) {
            if (result.getStatus() == ActionStatus.FAILED || result.getStatus() == ActionStatus.SKIPPED) {
                result.reset();
            }
        }
        status = TaskStatus.WAITING;
        completedAt = null;
        return true;
    }

    /**
     * 改派到另一个 Playlet，仅限尚未开始的等待任务
     *
     * @return 不满足条件时返回 false
     */
    public boolean reassign(Playlet playlet) {
        if (status != TaskStatus.WAITING || hasStarted()) {
            return false;
        }
        applyPlaylet(playlet);
        return true;
    }

    /**
     * 进程重启后的对账：EXECUTING 回到 WAITING，RUNNING 的行为回到 PENDING
     *
     * @return 是否有改动
     */
    public boolean reconcileAfterRestart() {
        if (status != TaskStatus.EXECUTING) {
            return false;
        }
        status = TaskStatus.WAITING;
        for (ActionResult result : actionResults) {
            if (result.getStatus() == ActionStatus.RUNNING) {
                result.reset();
            }
        }
        return true;
    }
}
