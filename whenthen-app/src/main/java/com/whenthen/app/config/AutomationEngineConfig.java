package com.whenthen.app.config;

import com.whenthen.domain.dispatch.TriggerDispatcher;
import com.whenthen.domain.event.TaskEventBus;
import com.whenthen.domain.event.TaskEventListener;
import com.whenthen.domain.executor.ActionExecutor;
import com.whenthen.domain.executor.ActionExecutorRegistry;
import com.whenthen.domain.gateway.TorrentGateway;
import com.whenthen.domain.gateway.TorrentRegistry;
import com.whenthen.domain.guard.InFlightCommandRegistry;
import com.whenthen.domain.guard.ManualDropCounter;
import com.whenthen.domain.guard.RatioFiredSet;
import com.whenthen.domain.matcher.ConditionEvaluator;
import com.whenthen.domain.matcher.SpecificityScorer;
import com.whenthen.domain.pipeline.EngineLoop;
import com.whenthen.domain.pipeline.TaskAdmission;
import com.whenthen.domain.pipeline.TaskPipeline;
import com.whenthen.domain.playlet.repository.PlayletRepository;
import com.whenthen.domain.service.AutomationService;
import com.whenthen.domain.service.impl.AutomationServiceImpl;
import com.whenthen.domain.task.repository.TaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AutomationEngineConfig - 引擎组件装配
 * <p>
 * 领域层不依赖 Spring，所有引擎对象在这里按实例创建并注入，不使用静态单例。
 * </p>
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class AutomationEngineConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public EngineLoop engineLoop(EngineProperties properties) {
        return EngineLoop.singleThread(properties.getLoopThreadName());
    }

    @Bean
    public TaskEventBus taskEventBus(ObjectProvider<TaskEventListener> listeners) {
        TaskEventBus bus = new TaskEventBus();
        listeners.orderedStream().forEach(bus::subscribe);
        return bus;
    }

    @Bean
    public ActionExecutorRegistry actionExecutorRegistry(ObjectProvider<ActionExecutor> executors) {
        List<ActionExecutor> available = executors.orderedStream().collect(Collectors.toList());
        log.info("Registering {} action executors", available.size());
        return new ActionExecutorRegistry(available);
    }

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    public SpecificityScorer specificityScorer() {
        return new SpecificityScorer();
    }

    @Bean
    public RatioFiredSet ratioFiredSet() {
        return new RatioFiredSet();
    }

    @Bean
    public ManualDropCounter manualDropCounter() {
        return new ManualDropCounter();
    }

    @Bean
    public InFlightCommandRegistry inFlightCommandRegistry() {
        return new InFlightCommandRegistry();
    }

    @Bean
    public TaskAdmission taskAdmission(EngineProperties properties) {
        return new TaskAdmission(properties.getMaxConcurrentTasks());
    }

    @Bean
    public TaskPipeline taskPipeline(TaskRepository taskRepository,
                                     PlayletRepository playletRepository,
                                     ActionExecutorRegistry executorRegistry,
                                     TorrentGateway torrentGateway,
                                     TorrentRegistry torrentRegistry,
                                     TaskEventBus taskEventBus,
                                     EngineLoop engineLoop,
                                     TaskAdmission taskAdmission,
                                     Clock engineClock) {
        return new TaskPipeline(taskRepository, playletRepository, executorRegistry, torrentGateway,
                torrentRegistry, taskEventBus, engineLoop, taskAdmission, engineClock);
    }

    @Bean
    public TriggerDispatcher triggerDispatcher(PlayletRepository playletRepository,
                                               TaskRepository taskRepository,
                                               TorrentRegistry torrentRegistry,
                                               ConditionEvaluator conditionEvaluator,
                                               SpecificityScorer specificityScorer,
                                               RatioFiredSet ratioFiredSet,
                                               ManualDropCounter manualDropCounter,
                                               TaskPipeline taskPipeline,
                                               TaskEventBus taskEventBus,
                                               Clock engineClock) {
        return new TriggerDispatcher(playletRepository, taskRepository, torrentRegistry, conditionEvaluator,
                specificityScorer, ratioFiredSet, manualDropCounter, taskPipeline, taskEventBus, engineClock);
    }

    @Bean
    public AutomationService automationService(PlayletRepository playletRepository,
                                               TaskRepository taskRepository,
                                               TorrentRegistry torrentRegistry,
                                               TriggerDispatcher triggerDispatcher,
                                               TaskPipeline taskPipeline,
                                               TaskEventBus taskEventBus,
                                               Clock engineClock) {
        return new AutomationServiceImpl(playletRepository, taskRepository, torrentRegistry,
                triggerDispatcher, taskPipeline, taskEventBus, engineClock);
    }
}
