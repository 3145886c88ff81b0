package com.whenthen.infrastructure.executor;

import com.whenthen.domain.executor.ActionContext;
import com.whenthen.domain.executor.ActionExecutor;
import com.whenthen.domain.executor.ActionOutcome;
import com.whenthen.domain.playlet.ActionType;
import com.whenthen.infrastructure.config.InfrastructureProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * DelayActionExecutor - 等待一段时间后成功
 * <p>
 * 时长为 seconds × 单位倍数；months 按 30 天计。未知单位按秒处理。
 * </p>
 */
@Slf4j
@Component
public class DelayActionExecutor implements ActionExecutor {

    private static final Map<String, Long> UNIT_SECONDS = Map.of(
            "seconds", 1L,
            "minutes", 60L,
            "hours", 3600L,
            "days", 86400L,
            "weeks", 604800L,
            "months", 2592000L
    );

    private final InfrastructureProperties properties;

    public DelayActionExecutor(InfrastructureProperties properties) {
        this.properties = properties;
    }

    @Override
    public ActionType type() {
        return ActionType.DELAY;
    }

    @Override
    public CompletableFuture<ActionOutcome> execute(ActionContext context) {
        long totalSeconds = totalSeconds(context.getAction().getConfig().get("seconds"),
                context.getAction().getString("delayUnit"));
        log.info("Task {} waiting {}s", context.getTaskId(), totalSeconds);
        CompletableFuture<ActionOutcome> result = new CompletableFuture<>();
        CompletableFuture.delayedExecutor(totalSeconds, TimeUnit.SECONDS)
                .execute(() -> result.complete(ActionOutcome.success()));
        return result;
    }

    long totalSeconds(Object seconds, String unit) {
        long amount = properties.getDefaultDelaySeconds();
        if (seconds instanceof Number) {
            amount = ((Number) seconds).longValue();
        } else if (seconds instanceof String && !((String) seconds).isBlank()) {
            try {
                amount = Long.parseLong(((String) seconds).trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid delay '{}', using {}s", seconds, amount);
            }
        }
        long multiplier = unit != null ? UNIT_SECONDS.getOrDefault(unit.toLowerCase(Locale.ROOT), 1L) : 1L;
        return Math.max(0L, amount) * multiplier;
    }
}
