package com.whenthen.app.service;

import com.whenthen.app.assembler.PlayletAssembler;
import com.whenthen.app.assembler.TaskAssembler;
import com.whenthen.app.assembler.TorrentEventAssembler;
import com.whenthen.app.config.EngineProperties;
import com.whenthen.app.parser.PlayletYamlParser;
import com.whenthen.client.dto.MultiResponse;
import com.whenthen.client.dto.Response;
import com.whenthen.client.dto.SingleResponse;
import com.whenthen.client.dto.cmd.AddTorrentCmd;
import com.whenthen.client.dto.cmd.AssignTorrentCmd;
import com.whenthen.client.dto.cmd.TorrentCommandCmd;
import com.whenthen.client.dto.cmd.TorrentEventCmd;
import com.whenthen.client.dto.data.EngineStatusDTO;
import com.whenthen.client.dto.data.PlayletDTO;
import com.whenthen.client.dto.data.TaskDTO;
import com.whenthen.domain.dispatch.AssignmentResult;
import com.whenthen.domain.dispatch.TriggerDispatcher;
import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.gateway.TorrentAddResult;
import com.whenthen.domain.gateway.TorrentGateway;
import com.whenthen.domain.guard.InFlightCommandRegistry;
import com.whenthen.domain.guard.ManualDropCounter;
import com.whenthen.domain.pipeline.EngineLoop;
import com.whenthen.domain.pipeline.TaskAdmission;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import com.whenthen.domain.service.AutomationService;
import com.whenthen.domain.service.CommandOutcome;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * AutomationAppService - 面向调用方的引擎入口
 * <p>
 * 所有读写都投递到 {@link EngineLoop} 上执行，调用线程同步等待结果（最长 commandTimeoutSeconds）。
 * 因此本类的方法不能在引擎循环线程上调用。
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutomationAppService {

    public static final String ADD_FAILED = "ADD_FAILED";
    public static final String COMMAND_FAILED = "COMMAND_FAILED";

    private final AutomationService automationService;
    private final TriggerDispatcher dispatcher;
    private final TaskAdmission admission;
    private final PlayletRepository playletRepository;
    private final TaskRepository taskRepository;
    private final TorrentGateway torrentGateway;
    private final ManualDropCounter manualDropCounter;
    private final InFlightCommandRegistry inFlightCommands;
    private final PlayletYamlParser parser;
    private final EngineLoop engineLoop;
    private final EngineProperties properties;
    private final Clock clock;

    // ==================== 生命周期 ====================

    public int start() {
        return onLoop(automationService::start);
    }

    public void stop() {
        onLoop(() -> {
            automationService.stop();
            return null;
        });
    }

    public EngineStatusDTO status() {
        return onLoop(() -> EngineStatusDTO.builder()
                .state(dispatcher.getState().name().toLowerCase(Locale.ROOT))
                .runningTasks(admission.runningCount())
                .queuedTasks(admission.queuedCount())
                .build());
    }

    // ==================== 种子事件 ====================

    public List<TaskDTO> onTorrentEvent(TorrentEventCmd cmd) {
        TorrentEvent event = TorrentEventAssembler.toEvent(cmd, clock.instant());
        log.info("Torrent event received: {} for torrent {}", event.getType(), event.getTorrentId());
        return onLoop(() -> TaskAssembler.toDTOs(automationService.onTorrentEvent(event)));
    }

    public SingleResponse<TaskDTO> assign(AssignTorrentCmd cmd) {
        AssignmentResult result = onLoop(() ->
                automationService.assign(cmd.getTorrentId(), cmd.getTorrentName(), cmd.getPlayletId(), cmd.isManual()));
        if (!result.isAccepted()) {
            return SingleResponse.failure(result.getOutcome().getErrCode(), result.getOutcome().getMessage());
        }
        return SingleResponse.of(TaskAssembler.toDTO(result.getTask()));
    }

    /**
     * 添加种子并指派给 Playlet（用户拖放）
     * <p>
     * 添加前登记一次手动拖放，使随后到达的 ADDED 事件不再自动指派；添加失败时撤销登记。
     * </p>
     */
    public SingleResponse<TaskDTO> addAndAssign(AddTorrentCmd cmd) {
        manualDropCounter.begin();
        TorrentAddResult added;
        try {
            added = await(torrentGateway.addTorrent(cmd.getSource(), cmd.getSavePath()));
        } catch (RuntimeException e) {
            manualDropCounter.cancel();
            log.warn("Adding torrent from {} failed: {}", cmd.getSource(), e.getMessage());
            return SingleResponse.failure(ADD_FAILED, e.getMessage());
        }
        log.info("Torrent {} added from a manual drop onto playlet {}", added.getId(), cmd.getPlayletId());
        return assign(new AssignTorrentCmd(added.getId(), added.getName(), cmd.getPlayletId(), true));
    }

    /**
     * 暂停、恢复或删除种子。同一种子上的相同命令在执行期间只发出一次。
     */
    public Response torrentCommand(long torrentId, TorrentCommandCmd cmd) {
        String command = cmd.getCommand() != null ? cmd.getCommand().toLowerCase(Locale.ROOT) : "";
        Supplier<CompletableFuture<Void>> operation;
        switch (command) {
            case "pause":
                operation = () -> torrentGateway.pause(torrentId);
                break;
            case "resume":
                operation = () -> torrentGateway.resume(torrentId);
                break;
            case "delete":
                operation = () -> torrentGateway.delete(torrentId, cmd.isDeleteFiles());
                break;
            default:
                throw new IllegalArgumentException("Unknown torrent command: " + cmd.getCommand());
        }
        try {
            await(inFlightCommands.dedup(command, torrentId, operation));
            return Response.buildSuccess();
        } catch (RuntimeException e) {
            log.warn("Torrent command {} on {} failed: {}", command, torrentId, e.getMessage());
            return Response.buildFailure(COMMAND_FAILED, e.getMessage());
        }
    }

    // ==================== 任务 ====================

    public MultiResponse<TaskDTO> listTasks() {
        return MultiResponse.of(onLoop(() -> TaskAssembler.toDTOs(taskRepository.findAll())));
    }

    public SingleResponse<TaskDTO> getTask(String taskId) {
        Optional<Task> task = onLoop(() -> taskRepository.findById(taskId));
        return task.map(t -> SingleResponse.of(TaskAssembler.toDTO(t)))
                .orElseGet(() -> SingleResponse.failure(CommandOutcome.TASK_NOT_FOUND.getErrCode(),
                        CommandOutcome.TASK_NOT_FOUND.getMessage()));
    }

    public Response retryTask(String taskId) {
        return toResponse(onLoop(() -> automationService.retryTask(taskId)));
    }

    public Response removeTask(String taskId) {
        return toResponse(onLoop(() -> automationService.removeTask(taskId)));
    }

    public Response reassignTask(String taskId, String playletId) {
        return toResponse(onLoop(() -> automationService.reassignTask(taskId, playletId)));
    }

    public int clearFinishedTasks() {
        return onLoop(automationService::clearFinishedTasks);
    }

    // ==================== Playlet ====================

    public MultiResponse<PlayletDTO> listPlaylets() {
        return MultiResponse.of(onLoop(() -> PlayletAssembler.toDTOs(playletRepository.findAll())));
    }

    public SingleResponse<Playlet> getPlaylet(String playletId) {
        Optional<Playlet> playlet = onLoop(() -> playletRepository.findById(playletId));
        return playlet.map(SingleResponse::of)
                .orElseGet(() -> SingleResponse.failure(CommandOutcome.PLAYLET_NOT_FOUND.getErrCode(),
                        CommandOutcome.PLAYLET_NOT_FOUND.getMessage()));
    }

    /**
     * 导入 YAML 定义的 Playlet；任意一个无效时整体拒绝
     */
    public List<PlayletDTO> importPlaylets(String yamlContent) {
        List<Playlet> playlets = parser.parse(yamlContent);
        playlets.forEach(Playlet::validate);
        log.info("Importing {} playlets", playlets.size());
        return onLoop(() -> playlets.stream()
                .map(automationService::savePlaylet)
                .map(PlayletAssembler::toDTO)
                .collect(Collectors.toList()));
    }

    public PlayletDTO savePlaylet(Playlet playlet) {
        return onLoop(() -> PlayletAssembler.toDTO(automationService.savePlaylet(playlet)));
    }

    public Response setPlayletEnabled(String playletId, boolean enabled) {
        return toResponse(onLoop(() -> automationService.setPlayletEnabled(playletId, enabled)));
    }

    public Response deletePlaylet(String playletId) {
        return toResponse(onLoop(() -> automationService.deletePlaylet(playletId)));
    }

    // ==================== 辅助 ====================

    private static Response toResponse(CommandOutcome outcome) {
        if (outcome.isAccepted()) {
            return Response.buildSuccess();
        }
        return Response.buildFailure(outcome.getErrCode(), outcome.getMessage());
    }

    private <T> T onLoop(Supplier<T> work) {
        return await(engineLoop.submit(work));
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(properties.getCommandTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the engine", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException(
                    "Engine did not respond within " + properties.getCommandTimeoutSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause != null ? cause.getMessage() : e.getMessage(), cause);
        }
    }
}
