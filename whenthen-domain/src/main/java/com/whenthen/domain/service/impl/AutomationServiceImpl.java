package com.whenthen.domain.service.impl;

import com.whenthen.domain.dispatch.AssignmentResult;
import com.whenthen.domain.dispatch.TriggerDispatcher;
import com.whenthen.domain.event.TaskEvent;
import com.whenthen.domain.event.TaskEventPublisher;
import com.whenthen.domain.event.TaskEventType;
import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.gateway.TorrentRegistry;
import com.whenthen.domain.pipeline.TaskPipeline;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import com.whenthen.domain.service.AutomationService;
import com.whenthen.domain.service.CommandOutcome;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
public class AutomationServiceImpl implements AutomationService {

    private final PlayletRepository playletRepository;
    private final TaskRepository taskRepository;
    private final TorrentRegistry torrentRegistry;
    private final TriggerDispatcher dispatcher;
    private final TaskPipeline pipeline;
    private final TaskEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public int start() {
        int reconciled = pipeline.reconcileAndResume();
        dispatcher.start();
        log.info("Automation engine started: {} playlets, {} tasks",
                playletRepository.findAll().size(), taskRepository.findAll().size());
        return reconciled;
    }

    @Override
    public void stop() {
        dispatcher.stop();
    }

    @Override
    public List<Task> onTorrentEvent(TorrentEvent event) {
        log.debug("Received torrent event: {} for torrent {}", event.getType(), event.getTorrentId());
        torrentRegistry.record(event);
        return dispatcher.dispatch(event);
    }

    @Override
    public AssignmentResult assign(long torrentId, String torrentName, String playletId, boolean manual) {
        return dispatcher.assign(torrentId, torrentName, playletId, manual);
    }

    @Override
    public CommandOutcome retryTask(String taskId) {
        Optional<Task> task = taskRepository.findById(taskId);
        if (task.isEmpty()) {
            return CommandOutcome.TASK_NOT_FOUND;
        }
        return pipeline.retry(task.get()) ? CommandOutcome.ACCEPTED : CommandOutcome.NOT_RETRYABLE;
    }

    @Override
    public CommandOutcome removeTask(String taskId) {
        Optional<Task> task = taskRepository.findById(taskId);
        if (task.isEmpty()) {
            return CommandOutcome.TASK_NOT_FOUND;
        }
        pipeline.remove(task.get());
        return CommandOutcome.ACCEPTED;
    }

    @Override
    public CommandOutcome reassignTask(String taskId, String playletId) {
        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            return CommandOutcome.TASK_NOT_FOUND;
        }
        Optional<Playlet> playlet = playletRepository.findById(playletId);
        if (playlet.isEmpty()) {
            return CommandOutcome.PLAYLET_NOT_FOUND;
        }
        if (!playlet.get().isEnabled()) {
            return CommandOutcome.PLAYLET_DISABLED;
        }
        Task task = found.get();
        if (!task.reassign(playlet.get())) {
            return CommandOutcome.NOT_REASSIGNABLE;
        }
        taskRepository.save(task);
        eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_STATUS_CHANGED, task));
        log.info("Task {} reassigned to playlet '{}'", taskId, task.getPlayletName());
        pipeline.attemptResume(task);
        return CommandOutcome.ACCEPTED;
    }

    @Override
    public int clearFinishedTasks() {
        List<Task> finished = taskRepository.findAll().stream()
                .filter(t -> t.getStatus().isTerminal())
                .collect(Collectors.toList());
        finished.forEach(pipeline::remove);
        log.info("Cleared {} finished tasks", finished.size());
        return finished.size();
    }

    @Override
    public Playlet savePlaylet(Playlet playlet) {
        if (playlet.getId() == null || playlet.getId().isBlank()) {
            playlet.setId(UUID.randomUUID().toString());
        }
        if (playlet.getCreatedAt() == null) {
            playlet.setCreatedAt(clock.instant());
        }
        playlet.validate();

        boolean wasDisabled = playletRepository.findById(playlet.getId())
                .map(existing -> !existing.isEnabled())
                .orElse(false);
        playletRepository.save(playlet);
        log.info("Playlet saved: {} ({})", playlet.displayName(), playlet.getId());
        if (wasDisabled && playlet.isEnabled()) {
            pipeline.resumeWaitingForPlaylet(playlet.getId());
        }
        return playlet;
    }

    @Override
    public CommandOutcome setPlayletEnabled(String playletId, boolean enabled) {
        Optional<Playlet> found = playletRepository.findById(playletId);
        if (found.isEmpty()) {
            return CommandOutcome.PLAYLET_NOT_FOUND;
        }
        Playlet playlet = found.get();
        if (playlet.isEnabled() == enabled) {
            return CommandOutcome.ACCEPTED;
        }
        playlet.setEnabled(enabled);
        playletRepository.save(playlet);
        log.info("Playlet '{}' {}", playlet.displayName(), enabled ? "enabled" : "disabled");
        if (enabled) {
            pipeline.resumeWaitingForPlaylet(playletId);
        }
        return CommandOutcome.ACCEPTED;
    }

    @Override
    public CommandOutcome deletePlaylet(String playletId) {
        if (playletRepository.findById(playletId).isEmpty()) {
            return CommandOutcome.PLAYLET_NOT_FOUND;
        }
        playletRepository.delete(playletId);
        log.info("Playlet {} deleted", playletId);
        return CommandOutcome.ACCEPTED;
    }
}
