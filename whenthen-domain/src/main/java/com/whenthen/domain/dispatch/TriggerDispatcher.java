package com.whenthen.domain.dispatch;

import com.whenthen.domain.event.TaskEvent;
import com.whenthen.domain.event.TaskEventPublisher;
import com.whenthen.domain.event.TaskEventType;
import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.gateway.TorrentInfo;
import com.whenthen.domain.gateway.TorrentRegistry;
import com.whenthen.domain.guard.ManualDropCounter;
import com.whenthen.domain.guard.RatioFiredSet;
import com.whenthen.domain.matcher.ConditionEvaluator;
import com.whenthen.domain.matcher.MatchSubject;
import com.whenthen.domain.matcher.SpecificityScorer;
import com.whenthen.domain.pipeline.TaskPipeline;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.TriggerType;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import com.whenthen.domain.service.CommandOutcome;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.repository.TaskRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TriggerDispatcher - 触发分发器
 * <p>
 * 把种子事件映射为任务创建：
 * torrent_added 只选出得分最高的一个 Playlet；download_complete / metadata_received /
 * folder_watch 为每个符合条件的 Playlet 各创建一个任务；seeding_ratio 每个
 * (Playlet, 种子) 组合至多触发一次。
 * </p>
 * <p>
 * 事件按到达顺序逐个处理，不重排、不合并。必须在引擎循环上调用。
 * </p>
 */
@Slf4j
public class TriggerDispatcher {

    private final PlayletRepository playletRepository;
    private final TaskRepository taskRepository;
    private final TorrentRegistry torrentRegistry;
    private final ConditionEvaluator conditionEvaluator;
    private final SpecificityScorer specificityScorer;
    private final RatioFiredSet ratioFiredSet;
    private final ManualDropCounter manualDropCounter;
    private final TaskPipeline pipeline;
    private final TaskEventPublisher eventPublisher;
    private final Clock clock;

    private DispatcherState state = DispatcherState.IDLE;

    public TriggerDispatcher(PlayletRepository playletRepository,
                             TaskRepository taskRepository,
                             TorrentRegistry torrentRegistry,
                             ConditionEvaluator conditionEvaluator,
                             SpecificityScorer specificityScorer,
                             RatioFiredSet ratioFiredSet,
                             ManualDropCounter manualDropCounter,
                             TaskPipeline pipeline,
                             TaskEventPublisher eventPublisher,
                             Clock clock) {
        this.playletRepository = playletRepository;
        this.taskRepository = taskRepository;
        this.torrentRegistry = torrentRegistry;
        this.conditionEvaluator = conditionEvaluator;
        this.specificityScorer = specificityScorer;
        this.ratioFiredSet = ratioFiredSet;
        this.manualDropCounter = manualDropCounter;
        this.pipeline = pipeline;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public void start() {
        state = DispatcherState.LISTENING;
        log.info("Trigger dispatcher listening");
    }

    /**
     * 停止监听并清空做种比例去重集合
     */
    public void stop() {
        state = DispatcherState.IDLE;
        ratioFiredSet.clear();
        log.info("Trigger dispatcher stopped");
    }

    public DispatcherState getState() {
        return state;
    }

    /**
     * 处理一个种子事件
     *
     * @return 本次事件创建的任务
     */
    public List<Task> dispatch(TorrentEvent event) {
        if (state != DispatcherState.LISTENING) {
            log.debug("Dispatcher idle, ignoring {} for torrent {}", event.getType(), event.getTorrentId());
            return List.of();
        }
        switch (event.getType()) {
            case ADDED:
                return onAdded(event);
            case COMPLETED:
                return onCompleted(event);
            case METADATA:
                return fireAll(TriggerType.METADATA_RECEIVED, event);
            case PROGRESS:
                return onProgress(event);
            case FOLDER_WATCH_DETECTED:
                return onFolderWatch(event);
            default:
                log.warn("Unsupported torrent event type: {}", event.getType());
                return List.of();
        }
    }

    // ==================== 事件处理 ====================

    private List<Task> onAdded(TorrentEvent event) {
        if (manualDropCounter.consumeIfPending()) {
            log.info("Torrent {} added by a manual drop, skipping auto-assignment", event.getTorrentId());
            return List.of();
        }
        if (taskRepository.findActiveByTorrentId(event.getTorrentId()).isPresent()) {
            log.info("Torrent {} already has an active task, skipping auto-assignment", event.getTorrentId());
            return List.of();
        }

        MatchSubject subject = subjectFor(event);
        List<Playlet> candidates = eligible(TriggerType.TORRENT_ADDED, subject);
        Optional<Playlet> best = specificityScorer.pickBest(candidates);
        if (best.isEmpty()) {
            log.debug("No torrent_added playlet matches '{}'", subject.getName());
            return List.of();
        }
        log.info("Torrent '{}' auto-assigned to playlet '{}' ({} candidates)",
                subject.getName(), best.get().displayName(), candidates.size());
        return List.of(createAndStart(event.getTorrentId(), subject.getName(), best.get(), true));
    }

    private List<Task> onCompleted(TorrentEvent event) {
        pipeline.resumeWaitingForTorrent(event.getTorrentId());
        return fireAll(TriggerType.DOWNLOAD_COMPLETE, event);
    }

    private List<Task> fireAll(TriggerType triggerType, TorrentEvent event) {
        MatchSubject subject = subjectFor(event);
        return eligible(triggerType, subject).stream()
                .map(p -> createAndStart(event.getTorrentId(), subject.getName(), p, false))
                .collect(Collectors.toList());
    }

    private List<Task> onProgress(TorrentEvent event) {
        if (!event.isStateCompleted()) {
            return List.of();
        }
        // a finished torrent may never send COMPLETED again, e.g. after a restart
        pipeline.resumeWaitingForTorrent(event.getTorrentId());
        long total = event.getTotalBytes() != null ? event.getTotalBytes() : 0L;
        long uploaded = event.getUploadedBytes() != null ? event.getUploadedBytes() : 0L;
        if (total <= 0 || uploaded <= 0) {
            return List.of();
        }
        double ratio = (double) uploaded / total;

        MatchSubject subject = subjectFor(event);
        List<Playlet> candidates = playletRepository.findAll().stream()
                .filter(Playlet::isEnabled)
                .filter(p -> p.hasTrigger(TriggerType.SEEDING_RATIO))
                .filter(p -> ratio >= p.getTrigger().effectiveSeedingRatio())
                .filter(p -> !ratioFiredSet.contains(p.getId(), event.getTorrentId()))
                .filter(p -> conditionEvaluator.matches(p.getConditions(), p.getConditionLogic(), subject))
                .collect(Collectors.toList());

        return candidates.stream()
                .filter(p -> ratioFiredSet.markIfAbsent(p.getId(), event.getTorrentId()))
                .map(p -> {
                    log.info("Seeding ratio {} reached for torrent {} on playlet '{}'",
                            String.format("%.2f", ratio), event.getTorrentId(), p.displayName());
                    return createAndStart(event.getTorrentId(), subject.getName(), p, false);
                })
                .collect(Collectors.toList());
    }

    private List<Task> onFolderWatch(TorrentEvent event) {
        String path = event.getPath() != null ? event.getPath() : "";
        MatchSubject subject = MatchSubject.named(event.getName());
        return playletRepository.findAll().stream()
                .filter(Playlet::isEnabled)
                .filter(p -> p.hasTrigger(TriggerType.FOLDER_WATCH))
                .filter(p -> !p.getTrigger().hasWatchFolder() || path.startsWith(p.getTrigger().getWatchFolder()))
                .filter(p -> conditionEvaluator.matches(p.getConditions(), p.getConditionLogic(), subject))
                .map(p -> createAndStart(event.getTorrentId(), event.getName(), p, false))
                .collect(Collectors.toList());
    }

    // ==================== 指派 ====================

    /**
     * 把种子指派给指定 Playlet
     *
     * @param manual 为 true 时跳过触发类型与条件检查（用户手动拖放）
     */
    public AssignmentResult assign(long torrentId, String torrentName, String playletId, boolean manual) {
        Optional<Playlet> found = playletRepository.findById(playletId);
        if (found.isEmpty()) {
            return reject(torrentId, playletId, CommandOutcome.PLAYLET_NOT_FOUND);
        }
        Playlet playlet = found.get();
        if (!playlet.isEnabled()) {
            return reject(torrentId, playletId, CommandOutcome.PLAYLET_DISABLED);
        }

        String name = resolveName(torrentId, torrentName);
        if (!manual) {
            if (!playlet.hasTrigger(TriggerType.TORRENT_ADDED)) {
                return reject(torrentId, playletId, CommandOutcome.TRIGGER_MISMATCH);
            }
            MatchSubject subject = subjectFor(torrentId, name);
            if (!conditionEvaluator.matches(playlet.getConditions(), playlet.getConditionLogic(), subject)) {
                return reject(torrentId, playletId, CommandOutcome.CONDITIONS_NOT_MET);
            }
        }
        if (taskRepository.findActiveByTorrentId(torrentId).isPresent()) {
            return reject(torrentId, playletId, CommandOutcome.DUPLICATE_ASSIGNMENT);
        }

        log.info("Torrent '{}' assigned to playlet '{}' (manual: {})", name, playlet.displayName(), manual);
        return AssignmentResult.accepted(createAndStart(torrentId, name, playlet, true));
    }

    private AssignmentResult reject(long torrentId, String playletId, CommandOutcome outcome) {
        log.warn("Assignment of torrent {} to playlet {} rejected: {}", torrentId, playletId, outcome);
        return AssignmentResult.rejected(outcome);
    }

    // ==================== 辅助 ====================

    private List<Playlet> eligible(TriggerType triggerType, MatchSubject subject) {
        return playletRepository.findAll().stream()
                .filter(Playlet::isEnabled)
                .filter(p -> p.hasTrigger(triggerType))
                .filter(p -> conditionEvaluator.matches(p.getConditions(), p.getConditionLogic(), subject))
                .collect(Collectors.toList());
    }

    private Task createAndStart(long torrentId, String torrentName, Playlet playlet, boolean awaitCompletion) {
        Task task = Task.create(torrentId, torrentName, playlet, awaitCompletion, clock.instant());
        taskRepository.save(task);
        eventPublisher.publish(TaskEvent.of(TaskEventType.TASK_CREATED, task));
        log.info("Task {} created for torrent {} by playlet '{}'", task.getId(), torrentId, task.getPlayletName());
        pipeline.attemptResume(task);
        return task;
    }

    private MatchSubject subjectFor(TorrentEvent event) {
        MatchSubject subject = subjectFor(event.getTorrentId(), resolveName(event.getTorrentId(), event.getName()));
        if (event.getFileCount() != null) {
            subject.setFileCount(event.getFileCount());
        }
        return subject;
    }

    private MatchSubject subjectFor(long torrentId, String name) {
        Optional<TorrentInfo> info = torrentRegistry.find(torrentId);
        return MatchSubject.builder()
                .name(name)
                .totalBytes(info.map(TorrentInfo::getTotalBytes).orElse(null))
                .fileCount(info.map(TorrentInfo::getFileCount).orElse(null))
                .build();
    }

    private String resolveName(long torrentId, String name) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return torrentRegistry.find(torrentId)
                .map(TorrentInfo::getName)
                .filter(n -> !n.isBlank())
                .orElse("Torrent " + torrentId);
    }
}
