package com.whenthen.domain.executor;

import com.whenthen.domain.playlet.ActionType;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * ActionExecutorRegistry - 执行器注册表
 * <p>
 * 按行为类型查找执行器；同一类型重复注册时后者覆盖前者。
 * </p>
 */
@Slf4j
public class ActionExecutorRegistry {

    private final Map<ActionType, ActionExecutor> executors = new EnumMap<>(ActionType.class);

    public ActionExecutorRegistry() {
    }

    public ActionExecutorRegistry(Collection<? extends ActionExecutor> initial) {
        initial.forEach(this::register);
    }

    public void register(ActionExecutor executor) {
        ActionExecutor previous = executors.put(executor.type(), executor);
        if (previous != null) {
            log.info("Executor for {} replaced: {} -> {}", executor.type().getCode(),
                    previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        }
    }

    public Optional<ActionExecutor> find(ActionType type) {
        return Optional.ofNullable(executors.get(type));
    }

    public boolean supports(ActionType type) {
        return executors.containsKey(type);
    }
}
