package com.whenthen.domain.guard;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InFlightCommandRegistryTest {

    private final InFlightCommandRegistry registry = new InFlightCommandRegistry();

    @Test
    void testConcurrentCallsShareOneOperation() {
        AtomicInteger calls = new AtomicInteger();
        CompletableFuture<String> pending = new CompletableFuture<>();

        CompletableFuture<String> first = registry.dedup("pause", 7, () -> {
            calls.incrementAndGet();
            return pending;
        });
        CompletableFuture<String> second = registry.dedup("pause", 7, () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture("other");
        });

        assertSame(first, second);
        assertEquals(1, calls.get());
        assertTrue(registry.isInFlight("pause", 7));

        pending.complete("done");
        assertEquals("done", second.join());
        assertFalse(registry.isInFlight("pause", 7));
    }

    @Test
    void testEntryRemovedAfterFailureSoNextCallRunsAgain() {
        CompletableFuture<Void> failing = registry.dedup("delete", 3,
                () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        assertTrue(failing.isCompletedExceptionally());
        assertFalse(registry.isInFlight("delete", 3));

        AtomicInteger calls = new AtomicInteger();
        registry.dedup("delete", 3, () -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        }).join();
        assertEquals(1, calls.get());
    }

    @Test
    void testDifferentCommandsOrTorrentsDoNotShare() {
        CompletableFuture<Void> pause = registry.dedup("pause", 1, CompletableFuture::new);
        CompletableFuture<Void> resume = registry.dedup("resume", 1, CompletableFuture::new);
        CompletableFuture<Void> pauseOther = registry.dedup("pause", 2, CompletableFuture::new);

        assertNotSame(pause, resume);
        assertNotSame(pause, pauseOther);
    }

    @Test
    void testThrowingSupplierCompletesExceptionally() {
        CompletableFuture<Void> result = registry.dedup("resume", 9, () -> {
            throw new IllegalArgumentException("bad id");
        });
        assertTrue(result.isCompletedExceptionally());
        assertFalse(registry.isInFlight("resume", 9));
    }
}
