package com.whenthen.domain.pipeline;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * EngineLoop - 引擎的单消费者串行执行器
 * <p>
 * 事件分发、条件匹配和任务状态修改都只在这里执行；执行器的异步结果也投递回这里处理。
 * 测试中使用 {@link #direct()}，提交的工作在调用线程上立即执行。
 * </p>
 */
@Slf4j
public class EngineLoop implements AutoCloseable {

    private final Executor executor;

    private final ExecutorService owned;

    private EngineLoop(Executor executor, ExecutorService owned) {
        this.executor = executor;
        this.owned = owned;
    }

    public static EngineLoop singleThread(String threadName) {
        ExecutorService service = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        return new EngineLoop(service, service);
    }

    public static EngineLoop direct() {
        return new EngineLoop(Runnable::run, null);
    }

    /**
     * 投递一个工作，异常只记录日志
     */
    public void post(Runnable work) {
        executor.execute(() -> {
            try {
                work.run();
            } catch (RuntimeException e) {
                log.error("Engine loop work failed: {}", e.getMessage(), e);
            }
        });
    }

    /**
     * 投递一个有返回值的工作，异常通过 future 返回给调用方
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        CompletableFuture<T> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(work.get());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @Override
    public void close() {
        if (owned == null) {
            return;
        }
        owned.shutdown();
        try {
            if (!owned.awaitTermination(5, TimeUnit.SECONDS)) {
                owned.shutdownNow();
            }
        } catch (InterruptedException e) {
            owned.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
