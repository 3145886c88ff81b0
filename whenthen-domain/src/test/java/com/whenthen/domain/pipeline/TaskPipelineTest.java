package com.whenthen.domain.pipeline;

import com.whenthen.domain.event.TaskEventType;
import com.whenthen.domain.event.TorrentEvent;
import com.whenthen.domain.executor.ActionContext;
import com.whenthen.domain.executor.ActionOutcome;
import com.whenthen.domain.gateway.TorrentFile;
import com.whenthen.domain.playlet.ActionType;
import com.whenthen.domain.playlet.ConditionOperator;
import com.whenthen.domain.playlet.FileFilter;
import com.whenthen.domain.playlet.FileFilterCategory;
import com.whenthen.domain.playlet.Playlet;
import com.whenthen.domain.playlet.TriggerType;
import com.whenthen.domain.support.TestEngine;
import com.whenthen.domain.task.ActionResult;
import com.whenthen.domain.task.ActionStatus;
import com.whenthen.domain.task.Task;
import com.whenthen.domain.task.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static com.whenthen.domain.support.Playlets.nameCondition;
import static com.whenthen.domain.support.Playlets.playlet;
import static org.junit.jupiter.api.Assertions.*;

class TaskPipelineTest {

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        engine.service.start();
    }

    private Task createRunnable(Playlet playlet, long torrentId) {
        engine.playlets.save(playlet);
        Task task = Task.create(torrentId, "Torrent " + torrentId, playlet, false, TestEngine.NOW);
        engine.tasks.save(task);
        return task;
    }

    private Task reload(Task task) {
        return engine.tasks.findById(task.getId()).orElseThrow();
    }

    /**
     * DONE 结果构成前缀，第一个非 DONE 的结果是 RUNNING、PENDING，或 FAILED 且其后全部 SKIPPED
     */
    private void assertDonePrefix(Task task) {
        List<ActionResult> results = task.getActionResults();
        int first = 0;
        while (first < results.size() && results.get(first).getStatus() == ActionStatus.DONE) {
            first++;
        }
        for (int i = first; i < results.size(); i++) {
            assertNotEquals(ActionStatus.DONE, results.get(i).getStatus(), "done after a non-done result at " + i);
        }
        if (first < results.size() && results.get(first).getStatus() == ActionStatus.FAILED) {
            for (int i = first + 1; i < results.size(); i++) {
                assertEquals(ActionStatus.SKIPPED, results.get(i).getStatus());
            }
        }
    }

    @Test
    void testScenarioA_addedTorrentRunsCastAfterDownloadCompletes() {
        Playlet p = playlet("p1", TriggerType.TORRENT_ADDED, ActionType.CAST);
        p.getActions().get(0).getConfig().put("deviceId", "D1");
        p.getConditions().add(nameCondition(ConditionOperator.CONTAINS, "1080p"));
        engine.playlets.save(p);

        List<Task> created = engine.service.onTorrentEvent(TorrentEvent.added(7, "Movie.1080p.mkv", "abc", 1));
        assertEquals(1, created.size());
        Task task = created.get(0);
        assertEquals(TaskStatus.WAITING, reload(task).getStatus(), "waits for the download");
        assertEquals(0, engine.executor(ActionType.CAST).invocationCount());

        engine.service.onTorrentEvent(TorrentEvent.completed(7));

        Task done = reload(task);
        assertEquals(TaskStatus.COMPLETED, done.getStatus());
        assertEquals(ActionStatus.DONE, done.getActionResults().get(0).getStatus());
        assertEquals(TestEngine.NOW, done.getCompletedAt());
        ActionContext context = engine.executor(ActionType.CAST).getInvocations().get(0);
        assertEquals("D1", context.getAction().getString("deviceId"));
        assertEquals(7, context.getTorrentId());
    }

    @Test
    void testScenarioC_failureSkipsLaterActions() {
        engine.executor(ActionType.MOVE).thenFail("disk full");
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.SUBTITLE), 7);

        engine.pipeline.attemptResume(task);

        Task failed = reload(task);
        assertEquals(TaskStatus.FAILED, failed.getStatus());
        assertEquals(ActionStatus.FAILED, failed.getActionResults().get(0).getStatus());
        assertEquals("disk full", failed.getActionResults().get(0).getError());
        assertEquals(ActionStatus.SKIPPED, failed.getActionResults().get(1).getStatus());
        assertEquals(0, engine.executor(ActionType.SUBTITLE).invocationCount());
        assertDonePrefix(failed);
    }

    @Test
    void testScenarioD_retryRerunsFromFailedAction() {
        engine.executor(ActionType.MOVE).thenFail("disk full");
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.SUBTITLE), 7);
        engine.pipeline.attemptResume(task);

        CompletableFuture<ActionOutcome> held = engine.executor(ActionType.MOVE).thenHold();
        assertTrue(engine.pipeline.retry(reload(task)));

        Task retrying = reload(task);
        assertEquals(TaskStatus.EXECUTING, retrying.getStatus());
        assertEquals(ActionStatus.RUNNING, retrying.getActionResults().get(0).getStatus());
        assertEquals(ActionStatus.PENDING, retrying.getActionResults().get(1).getStatus());
        assertNull(retrying.getActionResults().get(0).getError());
        assertEquals(2, engine.executor(ActionType.MOVE).invocationCount());

        held.complete(ActionOutcome.success());

        Task completed = reload(task);
        assertEquals(TaskStatus.COMPLETED, completed.getStatus());
        assertEquals(1, engine.executor(ActionType.SUBTITLE).invocationCount());
    }

    @Test
    void testRetryKeepsDoneActions() {
        engine.executor(ActionType.SUBTITLE).thenFail("no match");
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.SUBTITLE), 7);
        engine.pipeline.attemptResume(task);

        engine.pipeline.retry(reload(task));

        assertEquals(1, engine.executor(ActionType.MOVE).invocationCount());
        assertEquals(2, engine.executor(ActionType.SUBTITLE).invocationCount());
        assertEquals(TaskStatus.COMPLETED, reload(task).getStatus());
    }

    @Test
    void testRetryRejectedForNonFailedTask() {
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE), 7);
        engine.pipeline.attemptResume(task);

        assertFalse(engine.pipeline.retry(reload(task)));
        assertEquals(1, engine.executor(ActionType.MOVE).invocationCount());
    }

    @Test
    void testExecutorExceptionsBecomeFailures() {
        engine.executor(ActionType.WEBHOOK).thenThrow(new IllegalStateException("connection refused"));
        engine.executor(ActionType.NOTIFY).thenFailExceptionally(new RuntimeException());
        Task thrown = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.WEBHOOK), 1);
        Task exceptional = createRunnable(playlet("p2", TriggerType.DOWNLOAD_COMPLETE, ActionType.NOTIFY), 2);

        engine.pipeline.attemptResume(thrown);
        engine.pipeline.attemptResume(exceptional);

        assertEquals("connection refused", reload(thrown).getActionResults().get(0).getError());
        assertEquals(TaskStatus.FAILED, reload(exceptional).getStatus());
        assertEquals("RuntimeException", reload(exceptional).getActionResults().get(0).getError());
    }

    @Test
    void testMissingExecutorFailsTheAction() {
        TestEngine bare = new TestEngine();
        Playlet p = playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.PLAY);
        bare.playlets.save(p);
        Task task = Task.create(1, "x", p, false, TestEngine.NOW);
        bare.tasks.save(task);
        // registry without a play executor
        TaskPipeline pipeline = new TaskPipeline(bare.tasks, bare.playlets,
                new com.whenthen.domain.executor.ActionExecutorRegistry(), bare.gateway, bare.registry,
                bare.eventBus, EngineLoop.direct(), new TaskAdmission(0), java.time.Clock.systemUTC());

        pipeline.attemptResume(task);

        Task failed = bare.tasks.findById(task.getId()).orElseThrow();
        assertEquals(TaskStatus.FAILED, failed.getStatus());
        assertEquals("No executor for action type: play", failed.getActionResults().get(0).getError());
    }

    @Test
    void testContextCarriesFilesAndFileFilter() {
        engine.gateway.putFiles(7, List.of(TorrentFile.builder().name("a.mkv").path("/d/a.mkv").size(10).mimeType("video/x-matroska").build()));
        Playlet p = playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE);
        p.setFileFilter(FileFilter.builder().category(FileFilterCategory.VIDEO).selectLargest(true).build());
        Task task = createRunnable(p, 7);

        engine.pipeline.attemptResume(task);

        ActionContext context = engine.executor(ActionType.MOVE).getInvocations().get(0);
        assertEquals(1, context.getFiles().size());
        assertEquals("/d/a.mkv", context.getFiles().get(0).getPath());
        assertEquals(FileFilterCategory.VIDEO, context.getFileFilter().getCategory());
        assertEquals(task.getId(), context.getTaskId());
    }

    @Test
    void testFileListingFailureRunsWithEmptyList() {
        engine.gateway.setFailListing(true);
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.NOTIFY), 7);

        engine.pipeline.attemptResume(task);

        assertTrue(engine.executor(ActionType.NOTIFY).getInvocations().get(0).getFiles().isEmpty());
        assertEquals(TaskStatus.COMPLETED, reload(task).getStatus());
    }

    @Test
    void testAwaitingTaskStaysWaitingUntilComplete() {
        Playlet p = playlet("p1", TriggerType.TORRENT_ADDED, ActionType.MOVE);
        engine.playlets.save(p);
        Task task = Task.create(7, "x", p, true, TestEngine.NOW);
        engine.tasks.save(task);

        engine.pipeline.attemptResume(task);
        assertEquals(TaskStatus.WAITING, reload(task).getStatus());

        engine.registry.markComplete(7);
        engine.pipeline.attemptResume(task);
        assertEquals(TaskStatus.COMPLETED, reload(task).getStatus());
    }

    @Test
    void testDonePrefixHoldsWhileRunning() {
        CompletableFuture<ActionOutcome> held = engine.executor(ActionType.SUBTITLE).thenHold();
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE,
                ActionType.MOVE, ActionType.SUBTITLE, ActionType.NOTIFY), 7);

        engine.pipeline.attemptResume(task);

        Task running = reload(task);
        assertEquals(ActionStatus.DONE, running.getActionResults().get(0).getStatus());
        assertEquals(ActionStatus.RUNNING, running.getActionResults().get(1).getStatus());
        assertEquals(ActionStatus.PENDING, running.getActionResults().get(2).getStatus());
        assertDonePrefix(running);

        held.complete(ActionOutcome.success());
        assertDonePrefix(reload(task));
        assertEquals(TaskStatus.COMPLETED, reload(task).getStatus());
    }

    @Test
    void testConcurrencyCapKeepsExtraTasksWaiting() {
        engine = new TestEngine(1);
        engine.service.start();
        CompletableFuture<ActionOutcome> held = engine.executor(ActionType.DELAY).thenHold();
        Task first = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.DELAY), 1);
        Task second = createRunnable(playlet("p2", TriggerType.DOWNLOAD_COMPLETE, ActionType.NOTIFY), 2);

        engine.pipeline.attemptResume(first);
        engine.pipeline.attemptResume(second);

        assertEquals(TaskStatus.EXECUTING, reload(first).getStatus());
        assertEquals(TaskStatus.WAITING, reload(second).getStatus());
        assertEquals(0, engine.executor(ActionType.NOTIFY).invocationCount());

        held.complete(ActionOutcome.success());

        assertEquals(TaskStatus.COMPLETED, reload(first).getStatus());
        assertEquals(TaskStatus.COMPLETED, reload(second).getStatus());
    }

    @Test
    void testRemovalDuringActionDiscardsResultAndFreesSlot() {
        engine = new TestEngine(1);
        engine.service.start();
        CompletableFuture<ActionOutcome> held = engine.executor(ActionType.DELAY).thenHold();
        Task first = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.DELAY, ActionType.MOVE), 1);
        Task second = createRunnable(playlet("p2", TriggerType.DOWNLOAD_COMPLETE, ActionType.NOTIFY), 2);
        engine.pipeline.attemptResume(first);
        engine.pipeline.attemptResume(second);

        engine.pipeline.remove(reload(first));

        assertTrue(engine.tasks.findById(first.getId()).isEmpty());
        assertEquals(TaskStatus.COMPLETED, reload(second).getStatus(), "slot released on removal");
        assertTrue(engine.events.stream().anyMatch(e -> e.getType() == TaskEventType.TASK_REMOVED));

        held.complete(ActionOutcome.success());
        assertEquals(0, engine.executor(ActionType.MOVE).invocationCount(), "removed task does not continue");
    }

    @Test
    void testDisablingPlayletPausesAtNextBoundary() {
        CompletableFuture<ActionOutcome> held = engine.executor(ActionType.MOVE).thenHold();
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.NOTIFY), 7);
        engine.pipeline.attemptResume(task);

        engine.service.setPlayletEnabled("p1", false);
        held.complete(ActionOutcome.success());

        Task paused = reload(task);
        assertEquals(TaskStatus.WAITING, paused.getStatus());
        assertEquals(ActionStatus.DONE, paused.getActionResults().get(0).getStatus());
        assertEquals(ActionStatus.PENDING, paused.getActionResults().get(1).getStatus());
        assertEquals(0, engine.executor(ActionType.NOTIFY).invocationCount());

        engine.service.setPlayletEnabled("p1", true);

        assertEquals(TaskStatus.COMPLETED, reload(task).getStatus());
        assertEquals(1, engine.executor(ActionType.MOVE).invocationCount(), "done action is not re-run");
    }

    @Test
    void testActionsSharingAnIdStillRunInOrder() {
        engine = new TestEngine(1);
        engine.service.start();
        Playlet p = playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE, ActionType.NOTIFY);
        p.getActions().get(0).setId("a1");
        p.getActions().get(1).setId("a1");
        Task task = createRunnable(p, 1);

        engine.pipeline.attemptResume(task);

        Task done = reload(task);
        assertEquals(TaskStatus.COMPLETED, done.getStatus());
        assertTrue(done.getActionResults().stream().allMatch(r -> r.getStatus() == ActionStatus.DONE));
        assertEquals(1, engine.executor(ActionType.NOTIFY).invocationCount());
        assertEquals(0, engine.admission.runningCount(), "slot released");
    }

    @Test
    void testTaskWithoutActionsCompletesImmediately() {
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE), 7);
        engine.pipeline.attemptResume(task);
        assertEquals(TaskStatus.COMPLETED, reload(task).getStatus());
    }

    @Test
    void testEditingPlayletDoesNotAffectCreatedTask() {
        Playlet p = playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE);
        Task task = createRunnable(p, 7);
        p.getActions().add(com.whenthen.domain.playlet.PlayletAction.create(ActionType.WEBHOOK));
        engine.playlets.save(p);

        engine.pipeline.attemptResume(task);

        assertEquals(1, reload(task).getActionResults().size());
        assertEquals(0, engine.executor(ActionType.WEBHOOK).invocationCount());
    }

    @Test
    void testStatusEventsPublished() {
        Task task = createRunnable(playlet("p1", TriggerType.DOWNLOAD_COMPLETE, ActionType.MOVE), 7);
        engine.pipeline.attemptResume(task);

        List<TaskStatus> statuses = engine.events.stream()
                .filter(e -> e.getType() == TaskEventType.TASK_STATUS_CHANGED)
                .map(e -> e.getTaskStatus())
                .collect(java.util.stream.Collectors.toList());
        assertEquals(List.of(TaskStatus.EXECUTING, TaskStatus.COMPLETED), statuses);
        assertEquals(2, engine.events.stream().filter(e -> e.getType() == TaskEventType.ACTION_STATUS_CHANGED).count());
    }
}
