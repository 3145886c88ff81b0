package com.whenthen.domain.guard;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * InFlightCommandRegistry - 进行中的种子命令去重
 * <p>
 * 同一 (command, torrentId) 在前一次调用结束前再次发起时，直接返回同一个 future；
 * future 结束（成功或失败）后条目被移除。
 * </p>
 */
@Slf4j
public class InFlightCommandRegistry {

    private final ConcurrentMap<String, CompletableFuture<?>> inFlight = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> dedup(String command, long torrentId, Supplier<CompletableFuture<T>> operation) {
        String key = command + ":" + torrentId;
        CompletableFuture<T> created = new CompletableFuture<>();
        CompletableFuture<?> existing = inFlight.putIfAbsent(key, created);
        if (existing != null) {
            log.debug("Joining in-flight command {}", key);
            return (CompletableFuture<T>) existing;
        }

        CompletableFuture<T> started;
        try {
            started = operation.get();
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        started.whenComplete((value, error) -> {
            inFlight.remove(key, created);
            if (error != null) {
                created.completeExceptionally(error);
            } else {
                created.complete(value);
            }
        });
        return created;
    }

    public boolean isInFlight(String command, long torrentId) {
        return inFlight.containsKey(command + ":" + torrentId);
    }
}
