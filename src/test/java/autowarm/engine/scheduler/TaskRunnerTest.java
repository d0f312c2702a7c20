package autowarm.engine.scheduler;

import autowarm.engine.MutableClock;
import autowarm.engine.executor.ExecutorRegistry;
import autowarm.engine.health.HealthGate;
import autowarm.engine.model.Task;
import autowarm.engine.model.TaskSettings;
import autowarm.engine.model.TaskStatus;
import autowarm.engine.retry.BackoffWindow;
import autowarm.engine.retry.MidpointRetryPolicy;
import autowarm.engine.store.DurableStore;
import autowarm.engine.store.Endpoint;
import autowarm.engine.store.EndpointProbe;
import autowarm.engine.store.EndpointRole;
import autowarm.engine.store.JdbcTaskRepository;
import autowarm.engine.store.TestStores;
import autowarm.engine.store.ToggleDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskRunnerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private static final MutableClock storeClock = new MutableClock(T0);

    private static ToggleDataSource dataSource;
    private static DurableStore store;
    private static JdbcTaskRepository repo;

    private MutableClock clock;
    private RecordingExecutor executor;
    private RecordingLogSink tenantLog;
    private double risk;

    @BeforeAll
    static void setup() {
        dataSource = new ToggleDataSource(TestStores.h2("test-runner"));
        store = new DurableStore(Endpoint.of("primary", EndpointRole.PRIMARY, "mem:test-runner", dataSource),
                List.of(), Duration.ofSeconds(30), EndpointProbe.selectOne(), storeClock);
        store.initSchema();
        repo = new JdbcTaskRepository(store);
    }

    @AfterAll
    static void teardown() {
        if (store != null)
            store.close();
    }

    @BeforeEach
    void reset() {
        // a previous test may have left the endpoint marked unhealthy
        dataSource.up();
        storeClock.advance(Duration.ofMinutes(1));
        store.healthCheck();
        TestStores.clean(store);
        clock = new MutableClock(T0);
        executor = new RecordingExecutor();
        tenantLog = new RecordingLogSink();
        risk = 10;
    }

    private TaskRunner runner() {
        HealthGate gate = new HealthGate(id -> risk, id -> 90, 60, 40);
        ExecutorRegistry registry = new ExecutorRegistry().register(executor);
        return new TaskRunner(repo, gate, registry, new MidpointRetryPolicy(), BackoffWindow.DEFAULT, tenantLog,
                clock);
    }

    private Task saved(long owner, long resource) {
        Task task = Task.pending(owner, resource, TaskSettings.of("normal"));
        repo.save(task);
        return task;
    }

    @Test
    void successfulRunIsPersistedAsCompleted() {
        Task task = saved(7, 42);

        TaskOutcome outcome = runner().run(task);

        assertEquals(TaskOutcome.Result.COMPLETED, outcome.result());
        assertTrue(outcome.persisted());
        assertFalse(outcome.requeue());

        Task stored = repo.findForOwner(7, task.id()).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stored.status());
        assertEquals(1, stored.progress().sessionsCount());
        assertEquals(1, stored.progress().lastSessionResults().totalActions());
        assertEquals(List.of(42L), executor.invocations);

        List<String> lines = tenantLog.forOwner(7);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("started"));
        assertTrue(lines.get(1).contains("completed"));
    }

    @Test
    void completionOfTaskChangedElsewhereIsNotReported() {
        Task task = saved(7, 42);
        executor.onExecute(() -> repo.markCompleted(task.id(), task.progress(), T0));

        TaskOutcome outcome = runner().run(task);

        assertEquals(TaskOutcome.Result.SKIPPED, outcome.result());
        assertFalse(outcome.requeue());
        assertEquals(0, repo.findForOwner(7, task.id()).orElseThrow().progress().sessionsCount());

        List<String> lines = tenantLog.forOwner(7);
        assertEquals(2, lines.size());
        assertTrue(lines.get(1).startsWith("WARN"), lines.get(1));
        assertFalse(lines.get(1).contains("completed"));
    }

    @Test
    void failureSchedulesRetryAtMidpointOfWindow() {
        Task task = saved(7, 42);
        executor.failWith("rate limited");

        TaskOutcome outcome = runner().run(task);

        assertEquals(TaskOutcome.Result.FAILED, outcome.result());
        assertTrue(outcome.persisted());

        Task stored = repo.findForOwner(7, task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals("rate limited", stored.error());
        assertEquals(T0.plus(Duration.ofMinutes(60)), stored.nextAttemptAt());
        assertFalse(stored.isEligibleAt(T0.plus(Duration.ofMinutes(59))));
        assertTrue(tenantLog.forOwner(7).stream().anyMatch(l -> l.startsWith("ERROR") && l.contains("rate limited")));
    }

    @Test
    void riskyResourceRunsInPassiveMode() {
        risk = 75;
        Task task = saved(7, 42);

        runner().run(task);

        assertTrue(executor.settingsSeen.get(0).forcePassive());
        assertEquals("normal", executor.settingsSeen.get(0).speed());
        assertTrue(tenantLog.forOwner(7).stream().anyMatch(l -> l.startsWith("WARN") && l.contains("passive")));
        // the decision applies to this run only
        assertFalse(repo.findForOwner(7, task.id()).orElseThrow().settings().forcePassive());
    }

    @Test
    void unknownKindFails() {
        Task task = Task.pending(7, 42, TaskSettings.empty()).toBuilder().kind("unfollow").build();
        repo.save(task);

        TaskOutcome outcome = runner().run(task);

        assertEquals(TaskOutcome.Result.FAILED, outcome.result());
        assertTrue(executor.invocations.isEmpty());
        assertEquals("No executor for task kind: unfollow", repo.findForOwner(7, task.id()).orElseThrow().error());
    }

    @Test
    void completedTaskIsSkipped() {
        Task task = saved(7, 42);
        repo.markRunning(task.id(), T0);
        repo.markCompleted(task.id(), task.progress(), T0);

        TaskOutcome outcome = runner().run(task);

        assertEquals(TaskOutcome.Result.SKIPPED, outcome.result());
        assertFalse(outcome.requeue());
        assertTrue(executor.invocations.isEmpty());
    }

    @Test
    void unpersistedFailureIsHeldInMemory() {
        Task task = saved(7, 42);
        executor.failWith("boom");
        executor.onExecute(dataSource::down);

        TaskOutcome outcome = runner().run(task);

        assertEquals(TaskOutcome.Result.FAILED, outcome.result());
        assertFalse(outcome.persisted());
        assertTrue(outcome.requeue());
        assertEquals(T0.plus(Duration.ofMinutes(60)), outcome.task().nextAttemptAt());
        assertEquals(TaskStatus.FAILED, outcome.task().status());
    }

    @Test
    void storageDownBeforeStartIsHeldInMemory() {
        Task task = saved(7, 42);
        dataSource.down();

        TaskOutcome outcome = runner().run(task);

        assertTrue(outcome.requeue());
        assertTrue(executor.invocations.isEmpty());
        assertNotNull(outcome.task().nextAttemptAt());
    }
}
