package com.whenthen.domain.support;

import com.whenthen.domain.dispatch.TriggerDispatcher;
import com.whenthen.domain.event.TaskEvent;
import com.whenthen.domain.event.TaskEventBus;
import com.whenthen.domain.executor.ActionExecutorRegistry;
import com.whenthen.domain.guard.ManualDropCounter;
import com.whenthen.domain.guard.RatioFiredSet;
import com.whenthen.domain.matcher.ConditionEvaluator;
import com.whenthen.domain.matcher.SpecificityScorer;
import com.whenthen.domain.pipeline.EngineLoop;
import com.whenthen.domain.pipeline.TaskAdmission;
import com.whenthen.domain.pipeline.TaskPipeline;
import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.service.impl.AutomationServiceImpl;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * TestEngine - 组装一套完整的引擎用于测试
 * <p>
 * 使用直接执行的 EngineLoop 和固定时钟；每种行为类型注册一个 RecordingActionExecutor。
 * </p>
 */
public class TestEngine {

    public static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    public final InMemoryPlayletRepository playlets = new InMemoryPlayletRepository();
    public final InMemoryTaskRepository tasks = new InMemoryTaskRepository();
    public final StubTorrentRegistry registry = new StubTorrentRegistry();
    public final StubTorrentGateway gateway = new StubTorrentGateway();
    public final TaskEventBus eventBus = new TaskEventBus();
    public final List<TaskEvent> events = new ArrayList<>();
    public final Map<ActionType, RecordingActionExecutor> executors = new EnumMap<>(ActionType.class);
    public final ActionExecutorRegistry executorRegistry = new ActionExecutorRegistry();
    public final RatioFiredSet ratioFiredSet = new RatioFiredSet();
    public final ManualDropCounter manualDrops = new ManualDropCounter();
    public final TaskAdmission admission;
    public final TaskPipeline pipeline;
    public final TriggerDispatcher dispatcher;
    public final AutomationServiceImpl service;

    public TestEngine() {
        this(0);
    }

    public TestEngine(int maxConcurrentTasks) {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EngineLoop loop = EngineLoop.direct();
        for (ActionType type : ActionType.values()) {
            RecordingActionExecutor executor = new RecordingActionExecutor(type);
            executors.put(type, executor);
            executorRegistry.register(executor);
        }
        eventBus.subscribe(events::add);
        admission = new TaskAdmission(maxConcurrentTasks);
        pipeline = new TaskPipeline(tasks, playlets, executorRegistry, gateway, registry, eventBus, loop, admission, clock);
        dispatcher = new TriggerDispatcher(playlets, tasks, registry, new ConditionEvaluator(), new SpecificityScorer(),
                ratioFiredSet, manualDrops, pipeline, eventBus, clock);
        service = new AutomationServiceImpl(playlets, tasks, registry, dispatcher, pipeline, eventBus, clock);
    }

    public RecordingActionExecutor executor(ActionType type) {
        return executors.get(type);
    }
}
