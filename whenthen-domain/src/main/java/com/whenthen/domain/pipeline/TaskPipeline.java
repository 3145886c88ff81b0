package com.whenthen.domain.pipeline;

import com.whenthen.domain.event.TaskEvent;
import com.whenthen.domain.event.TaskEventPublisher;
import com.whenthen.domain.event.TaskEventType;
import com.whenthen.domain.executor.ActionContext;
import com.whenthen.domain.executor.ActionExecutor;
import com.whenthen.domain.executor.ActionExecutorRegistry;
import com.whenthen.domain.executor.ActionOutcome;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.gateway.TorrentGateway;
import com.whenthen.domain.gateway.TorrentRegistry;
import com.whenthen.domain.playlet.PlayletAction;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import com.whenthen.domain.task.ActionResult;
import com.whenthen.domain.task.ActionStatus;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.TaskStatus;
import com.whenthen.domain.task.repository.TaskRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * TaskPipeline - 任务流水线
 * <p>
 * 按顺序逐个执行任务的行为，记录每个行为的结果。所有方法都必须在 {@link EngineLoop} 上调用；
 * 执行器的异步结果通过 EngineLoop 投递回来后再修改任务状态。
 * </p>
 * <p>
 * 流水线本身不抛出异常：执行器返回的失败、抛出的异常、异常完成的 future、缺失的执行器
 * 都记录到 {@link ActionResult#getError()}。
 * </p>
 */
@Slf4j
public class TaskPipeline {

    private final TaskRepository taskRepository;
    private final PlayletRepository playletRepository;
    private final ActionExecutorRegistry executorRegistry;
    private final TorrentGateway torrentGateway;
    private final TorrentRegistry torrentRegistry;
    private final TaskEventPublisher eventPublisher;
    private final EngineLoop loop;
    private final TaskAdmission admission;
    private final Clock clock;

    public TaskPipeline(TaskRepository taskRepository,
                        PlayletRepository playletRepository,
                        ActionExecutorRegistry executorRegistry,
                        TorrentGateway torrentGateway,
                        TorrentRegistry torrentRegistry,
                        TaskEventPublisher eventPublisher,
                        EngineLoop loop,
                        TaskAdmission admission,
                        Clock clock) {
        this.taskRepository = taskRepository;
        this.playletRepository = playletRepository;
        this.executorRegistry = executorRegistry;
        this.torrentGateway = torrentGateway;
        this.torrentRegistry = torrentRegistry;
        this.eventPublisher = eventPublisher;
        this.loop = loop;
        this.admission = admission;
        this.clock = clock;
    }

    // ==================== 入口 ====================

    /**
     * 条件启动：等待下载完成的任务在种子完成前保持 WAITING。
     * 已经执行过行为的任务不再检查下载状态。
     */
    public void attemptResume(Task task) {
        if (task.getStatus() != TaskStatus.WAITING) {
            return;
        }
        if (task.isAwaitCompletion() && !task.hasStarted() && !torrentRegistry.isComplete(task.getTorrentId())) {
            log.debug("Task {} waits for torrent {} to complete", task.getId(), task.getTorrentId());
            return;
        }
        admit(task);
    }

    /**
     * 恢复某个种子上所有等待中的任务
     */
    public void resumeWaitingForTorrent(long torrentId) {
        taskRepository.findByStatus(TaskStatus.WAITING).stream()
                .filter(t -> t.getTorrentId() == torrentId)
                .forEach(this::attemptResume);
    }

    /**
     * Playlet 重新启用后恢复其等待中的任务
     */
    public void resumeWaitingForPlaylet(String playletId) {
        taskRepository.findByPlayletId(playletId).stream()
                .filter(t -> t.getStatus() == TaskStatus.WAITING)
                .forEach(this::attemptResume);
    }

    /**
     * 重试失败任务：跳过前置条件，直接进入就绪队列
     *
     * @return 任务不是 FAILED 时返回 false
     */
    public boolean retry(Task task) {
        if (!task.resetForRetry()) {
            return false;
        }
        taskRepository.save(task);
        task.getActionResults().stream()
                .filter(r -> r.getStatus() == ActionStatus.PENDING)
                .forEach(r -> eventPublisher.publish(TaskEvent.actionChanged(task, r)));
        eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
        log.info("Retrying task {} from action {}", task.getId(), task.firstUnfinishedIndex());
        admit(task);
        return true;
    }

    /**
     * 删除任务记录。进行中的执行器调用不会被中断，结果返回时被丢弃。
     */
    public void remove(Task task) {
        admission.withdraw(task.getId());
        taskRepository.delete(task.getId());
        eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_REMOVED, task));
        log.info("Task {} removed (status: {})", task.getId(), task.getStatus().getCode());
        drainReady();
    }

    /**
     * 进程重启后的对账与恢复
     *
     * @return 被重置的任务数
     */
    public int reconcileAndResume() {
        Set<String> reconciled = new HashSet<>();
        for (Task task : taskRepository.findAll()) {
            if (task.reconcileAfterRestart()) {
                taskRepository.save(task);
                eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
                reconciled.add(task.getId());
            }
        }
        if (!reconciled.isEmpty()) {
            log.info("Reconciled {} interrupted tasks back to waiting", reconciled.size());
        }
        // oldest first, the repository returns newest first
        List<Task> waiting = taskRepository.findByStatus(TaskStatus.WAITING);
        for (int i = waiting.size() - 1; i >= 0; i--) {
            Task task = waiting.get(i);
            if (reconciled.contains(task.getId())) {
                // the download precondition was met before the restart
                admit(task);
            } else {
                attemptResume(task);
            }
        }
        return reconciled.size();
    }

    public TaskAdmission getAdmission() {
        return admission;
    }

    // ==================== 准入 ====================

    private void admit(Task task) {
        admission.offer(task.getId());
        drainReady();
    }

    private void drainReady() {
        for (String taskId : admission.drain()) {
            Optional<Task> found = taskRepository.findById(taskId);
            if (found.isEmpty() || found.get().getStatus() != TaskStatus.WAITING) {
                admission.release(taskId);
                continue;
            }
            start(found.get());
        }
    }

    private void finish(String taskId) {
        admission.release(taskId);
        drainReady();
    }

    // ==================== 执行 ====================

    private void start(Task task) {
        task.startExecution();
        taskRepository.save(task);
        eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
        log.info("Task {} executing: playlet '{}' on torrent {}", task.getId(), task.getPlayletName(), task.getTorrentId());

        String taskId = task.getId();
        CompletableFuture<List<TorrentFile>> files;
        try {
            files = torrentGateway.listFiles(task.getTorrentId());
        } catch (RuntimeException e) {
            files = CompletableFuture.failedFuture(e);
        }
        files.whenComplete((list, error) -> {
            if (error != null) {
                log.warn("Could not list files of torrent {}: {}", task.getTorrentId(), unwrap(error).getMessage());
            }
            List<TorrentFile> resolved = error == null && list != null ? list : Collections.emptyList();
            loop.post(() -> runNext(taskId, resolved));
        });
    }

    private void runNext(String taskId, List<TorrentFile> files) {
        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            log.info("Task {} no longer exists, stopping", taskId);
            finish(taskId);
            return;
        }
        Task task = found.get();
        if (task.getStatus() != TaskStatus.EXECUTING) {
            finish(taskId);
            return;
        }

        if (isPlayletDisabled(task)) {
            task.pause();
            taskRepository.save(task);
            eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
            log.info("Task {} paused: playlet {} is disabled", taskId, task.getPlayletId());
            finish(taskId);
            return;
        }

        int index = task.firstUnfinishedIndex();
        if (index < 0) {
            task.complete(clock.instant());
            taskRepository.save(task);
            eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
            log.info("Task {} completed", taskId);
            finish(taskId);
            return;
        }

        PlayletAction action = task.getActions().get(index);
        task.markActionRunning(index, clock.instant());
        taskRepository.save(task);
        eventPublisher.publish(TaskEvent.actionChanged(task, task.getActionResults().get(index)));

        String actionId = action.getId();
        Optional<ActionExecutor> executor = executorRegistry.find(action.getType());
        if (executor.isEmpty()) {
            String code = action.getType() != null ? action.getType().getCode() : "null";
            onActionSettled(taskId, index, actionId, ActionOutcome.failure("No executor for action type: " + code), files);
            return;
        }

        ActionContext context = ActionContext.builder()
                .taskId(taskId)
                .action(action.copy())
                .torrentId(task.getTorrentId())
                .torrentName(task.getTorrentName())
                .files(files)
                .fileFilter(task.getFileFilter() != null ? task.getFileFilter().copy() : null)
                .build();

        CompletableFuture<ActionOutcome> future;
        try {
            future = executor.get().execute(context);
            if (future == null) {
                future = CompletableFuture.completedFuture(
                        ActionOutcome.failure("Executor returned no result for action type: " + action.getType().getCode()));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((outcome, error) -> {
            ActionOutcome settled;
            if (error != null) {
                settled = ActionOutcome.failure(unwrap(error));
            } else if (outcome == null) {
                settled = ActionOutcome.failure("Executor returned no result");
            } else {
                settled = outcome;
            }
            loop.post(() -> onActionSettled(taskId, index, actionId, settled, files));
        });
    }

    private void onActionSettled(String taskId, int index, String actionId, ActionOutcome outcome, List<TorrentFile> files) {
        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            log.info("Task {} was removed while action {} was running, result discarded", taskId, actionId);
            finish(taskId);
            return;
        }
        Task task = found.get();
        if (task.getStatus() != TaskStatus.EXECUTING || index >= task.getActionResults().size()
                || !Objects.equals(actionId, task.getActionResults().get(index).getActionId())
                || task.getActionResults().get(index).getStatus() != ActionStatus.RUNNING) {
            log.debug("Stale result for task {} action {} ignored", taskId, actionId);
            return;
        }

        if (outcome.isSuccess()) {
            task.markActionDone(index, clock.instant());
            taskRepository.save(task);
            eventPublisher.publish(TaskEvent.actionChanged(task, task.getActionResults().get(index)));
            runNext(taskId, files);
            return;
        }

        task.markActionFailed(index, outcome.getError(), clock.instant());
        taskRepository.save(task);
        for (int i = index; i < task.getActionResults().size(); i++) {
            eventPublisher.publish(TaskEvent.actionChanged(task, task.getActionResults().get(i)));
        }
        eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
        log.warn("Task {} failed at action {} ({}): {}", taskId, index,
                task.getActions().get(index).getType().getCode(), outcome.getError());
        finish(taskId);
    }

    private boolean isPlayletDisabled(Task task) {
        if (task.getPlayletId() == null) {
            return false;
        }
        return playletRepository.findById(task.getPlayletId())
                .map(p -> !p.isEnabled())
                .orElse(false);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
