package io.jobs4j;

import io.jobs4j.config.JobManagerProperties;
import io.jobs4j.core.JobArguments;
import io.jobs4j.core.JobConflictException;
import io.jobs4j.core.JobIsDoneException;
import io.jobs4j.core.JobIsGuardedException;
import io.jobs4j.core.JobOp;
import io.jobs4j.core.JobPermissionException;
import io.jobs4j.core.JobPermissionLevel;
import io.jobs4j.core.JobSchedulingException;
import io.jobs4j.core.JobStateException;
import io.jobs4j.core.JobStatus;
import io.jobs4j.core.JobStopReason;
import io.jobs4j.events.CustomJobEvent;
import io.jobs4j.mixins.EventSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobManagerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private JobManager manager;

    @BeforeEach
    void setUp() {
        JobManagerProperties props = new JobManagerProperties();
        props.setSchedulingInterval(Duration.ofMillis(20));
        manager = new JobManager(props);
        manager.initialize();
        ScheduledCounterJob.CREATED.set(0);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    /* ==== test jobs ==== */

    @JobMetadata(outputFields = {"echo"}, outputQueues = {"lines"})
    static class EchoJob extends IntervalJob {
        private final String text;

        EchoJob(JobArguments args) {
            this.text = args.get("text", String.class);
        }

        @Override
        protected void onRun() {
            setOutputField("echo", text);
            pushOutputQueue("lines", text);
            complete();
        }
    }

    static class IdleJob extends IntervalJob {
        final AtomicInteger runs = new AtomicInteger();

        IdleJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onRun() {
            runs.incrementAndGet();
        }
    }

    @JobMetadata(singleton = true)
    static class SingletonJob extends IntervalJob {
        SingletonJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onRun() {
        }
    }

    static class SlowStartJob extends IntervalJob {
        final CountDownLatch starting = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger runs = new AtomicInteger();

        SlowStartJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onStart() throws Exception {
            starting.countDown();
            release.await();
        }

        @Override
        protected void onRun() {
            runs.incrementAndGet();
        }
    }

    static class HookRecordingJob extends IntervalJob {
        volatile boolean started;
        volatile boolean stopped;

        HookRecordingJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onStart() {
            started = true;
        }

        @Override
        protected void onRun() {
        }

        @Override
        protected void onStop() {
            stopped = true;
        }
    }

    @JobMetadata(outputFields = {"result"}, outputQueues = {"values"})
    static class OutputJob extends IntervalJob {
        OutputJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onRun() {
        }
    }

    static class ControllerJob extends IntervalJob {
        ControllerJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onRun() {
        }

        @PublicJobMethod
        public JobProxy spawn() {
            return manager().createAndRegisterJob(IdleJob.class);
        }

        @PublicJobMethod
        public boolean stopOther(JobProxy target) {
            return manager().stopJob(target, null, true);
        }

        @PublicJobMethod
        public void guard(JobProxy target) {
            manager().guardJob(target);
        }

        @PublicJobMethod
        public void unguard(JobProxy target) {
            manager().unguardJob(target);
        }

        @PublicJobMethod
        public boolean mayKill(JobProxy target) {
            return manager().verifyPermissions(JobOp.KILL, target);
        }
    }

    @JobMetadata(uuid = "2f0c6a51-3d8e-4d6b-9a43-6b1f3f0b7e21")
    static class ScheduledCounterJob extends IntervalJob {
        static final AtomicInteger CREATED = new AtomicInteger();

        ScheduledCounterJob() {
            CREATED.incrementAndGet();
        }

        @Override
        protected void onRun() {
            complete();
        }
    }

    static class PingEvent extends CustomJobEvent {
        final int value;

        PingEvent(int value) {
            this.value = value;
        }
    }

    static class PingJob extends EventJob<PingEvent> {
        final List<Integer> received = new CopyOnWriteArrayList<>();

        PingJob() {
            super(Set.of(PingEvent.class));
        }

        @Override
        protected void onEvent(PingEvent event) {
            received.add(event.value);
        }
    }

    static class PingSessionJob extends MultiEventJob<PingEvent> {
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger active = new AtomicInteger();
        final AtomicInteger maxActive = new AtomicInteger();
        final AtomicInteger handled = new AtomicInteger();

        PingSessionJob() {
            super(Set.of(PingEvent.class));
        }

        @Override
        protected void onEventSession(EventSession<PingEvent> session) throws Exception {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                release.await();
                session.data().put("value", session.event().value);
            } finally {
                active.decrementAndGet();
                handled.incrementAndGet();
            }
        }
    }

    static class SelfRestartingJob extends IntervalJob {
        final AtomicInteger starts = new AtomicInteger();
        final AtomicInteger runs = new AtomicInteger();

        SelfRestartingJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onStart() {
            starts.incrementAndGet();
        }

        @Override
        protected void onRun() {
            if (runs.incrementAndGet() == 1) {
                restart();
            }
        }
    }

    static class FailingRunJob extends IntervalJob {
        @Override
        protected void onRun() {
            throw new IllegalStateException("run failed");
        }
    }

    static class FailingStartJob extends IntervalJob {
        final AtomicInteger runs = new AtomicInteger();

        @Override
        protected void onStart() {
            throw new IllegalStateException("start failed");
        }

        @Override
        protected void onRun() {
            runs.incrementAndGet();
        }
    }

    static class SlowStopJob extends IntervalJob {
        final List<Exception> stopErrors = new CopyOnWriteArrayList<>();

        SlowStopJob() {
            super(Duration.ofSeconds(30));
        }

        @Override
        protected void onRun() {
        }

        @Override
        protected void onStop() throws Exception {
            Thread.sleep(10_000);
        }

        @Override
        protected void onStopError(Exception error) {
            stopErrors.add(error);
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within " + WAIT);
            }
            Thread.sleep(5);
        }
    }

    /* ==== lifecycle ==== */

    @Test
    void echoJobShouldWalkThroughLifecycleAndComplete() throws Exception {
        JobProxy proxy = manager.createJob(EchoJob.class, JobArguments.named(Map.of("text", "hello")));
        assertEquals(JobStatus.FRESH, proxy.status());

        manager.initializeJob(proxy);
        assertEquals(JobStatus.INITIALIZED, proxy.status());

        manager.registerJob(proxy, null, false);
        assertEquals(JobStatus.INITIALIZED, proxy.status());
        assertEquals(JobPermissionLevel.MEDIUM, manager.getJobPermissionLevel(proxy));

        CompletableFuture<JobStatus> done = proxy.awaitDone(WAIT);
        assertTrue(manager.startJob(proxy));

        assertEquals(JobStatus.COMPLETED, done.get(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.COMPLETED, proxy.awaitDone(WAIT).get(1, TimeUnit.SECONDS));
        assertEquals("hello", proxy.getOutputField("echo"));
        assertEquals(List.of("hello"), proxy.getOutputQueueContents("lines"));
        assertFalse(manager.hasJob(proxy));
    }

    @Test
    void proxyShouldServeSnapshotOnceJobIsDone() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(EchoJob.class, JobArguments.named(Map.of("text", "bye")));
        proxy.awaitDone(WAIT).get(5, TimeUnit.SECONDS);

        assertTrue(proxy.isCached());
        assertTrue(proxy.isDone());
        assertEquals(JobStatus.COMPLETED, proxy.status());
        assertEquals("bye", proxy.snapshot().outputFields().get("echo"));
        assertEquals(List.of("bye"), proxy.getOutputQueueProxy().popAllOutputQueue("lines"));
        assertThrows(JobIsDoneException.class, proxy::job);
        assertThrows(JobIsDoneException.class, () -> manager.startJob(proxy));
    }

    @Test
    void singletonClassShouldRejectSecondLiveInstance() throws Exception {
        JobProxy first = manager.createAndRegisterJob(SingletonJob.class);

        assertThrows(JobConflictException.class, () -> manager.createAndRegisterJob(SingletonJob.class));

        manager.killJob(first, null);
        first.awaitDone(WAIT).get(5, TimeUnit.SECONDS);
        JobProxy second = manager.createAndRegisterJob(SingletonJob.class);
        assertTrue(manager.hasJob(second));
    }

    @Test
    void forcedStopShouldLeaveJobStoppedAndRestartable() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(IdleJob.class);
        IdleJob job = (IdleJob) proxy.job();
        waitUntil(() -> job.runs.get() == 1);

        CompletableFuture<JobStatus> stopped = proxy.awaitStop(WAIT);
        assertTrue(manager.stopJob(proxy, null, true));
        assertEquals(JobStatus.STOPPED, stopped.get(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.STOPPED, proxy.status());
        assertTrue(proxy.isAlive());

        assertTrue(manager.startJob(proxy));
        waitUntil(() -> job.runs.get() == 2);
        assertTrue(proxy.isRunning());
    }

    @Test
    void externalRestartShouldRunStartAgainAndRecordRestartReason() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(IdleJob.class);
        IdleJob job = (IdleJob) proxy.job();
        waitUntil(proxy::isIdling);

        assertTrue(manager.restartJob(proxy, null));

        waitUntil(() -> job.runs.get() == 2);
        assertEquals(JobStopReason.External.RESTART, proxy.getLastStoppingReason());
        assertTrue(proxy.isRunning());
        assertNull(proxy.getStoppingReason());
    }

    @Test
    void selfRestartShouldRecordInternalRestartReason() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(SelfRestartingJob.class);
        SelfRestartingJob job = (SelfRestartingJob) proxy.job();

        waitUntil(() -> job.runs.get() == 2);

        assertEquals(2, job.starts.get());
        assertEquals(JobStopReason.Internal.RESTART, proxy.getLastStoppingReason());
    }

    @Test
    void failingRunShouldStopJobWithErrorReason() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(FailingRunJob.class);

        waitUntil(() -> proxy.status() == JobStatus.STOPPED && proxy.getLastStoppingReason() != null);
        assertEquals(JobStopReason.Internal.ERROR, proxy.getLastStoppingReason());
        assertInstanceOf(IllegalStateException.class, proxy.job().getRunException());
        assertTrue(proxy.isAlive());
    }

    @Test
    void failingStartShouldSkipRunAndStopWithErrorReason() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(FailingStartJob.class, JobArguments.empty(), null, false);
        FailingStartJob job = (FailingStartJob) proxy.job();
        assertTrue(manager.startJob(proxy));

        waitUntil(() -> proxy.status() == JobStatus.STOPPED && proxy.getLastStoppingReason() != null);
        assertEquals(JobStopReason.Internal.ERROR, proxy.getLastStoppingReason());
        assertInstanceOf(IllegalStateException.class, job.getStartException());
        assertEquals(0, job.runs.get());
    }

    @Test
    void overrunningStopHookShouldBeReportedOnceAndNotPropagate() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(SlowStopJob.class);
        SlowStopJob job = (SlowStopJob) proxy.job();
        waitUntil(proxy::isIdling);

        CompletableFuture<JobStatus> stopped = proxy.awaitStop(WAIT);
        assertTrue(manager.stopJob(proxy, Duration.ofMillis(100), false));

        assertEquals(JobStatus.STOPPED, stopped.get(5, TimeUnit.SECONDS));
        assertEquals(1, job.stopErrors.size());
        assertInstanceOf(TimeoutException.class, job.stopErrors.get(0));
        assertEquals(JobStopReason.Internal.ERROR, proxy.getLastStoppingReason());
    }

    @Test
    void gracefulStopDuringStartShouldStillRunOnce() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(SlowStartJob.class);
        SlowStartJob job = (SlowStartJob) proxy.job();
        assertTrue(job.starting.await(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.STARTING, proxy.status());

        CompletableFuture<JobStatus> stopped = proxy.awaitStop(WAIT);
        assertTrue(manager.stopJob(proxy, null, false));
        job.release.countDown();

        assertEquals(JobStatus.STOPPED, stopped.get(5, TimeUnit.SECONDS));
        assertEquals(1, job.runs.get());
    }

    @Test
    void gracefulStopWhileIdlingShouldNotRunAgain() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(IdleJob.class);
        IdleJob job = (IdleJob) proxy.job();
        waitUntil(proxy::isIdling);

        CompletableFuture<JobStatus> stopped = proxy.awaitStop(WAIT);
        assertTrue(manager.stopJob(proxy, null, false));

        assertEquals(JobStatus.STOPPED, stopped.get(5, TimeUnit.SECONDS));
        assertEquals(1, job.runs.get());
    }

    @Test
    void killOfNotRunningJobShouldSkipStartHookButRunStopHook() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(HookRecordingJob.class, JobArguments.empty(), null, false);
        HookRecordingJob job = (HookRecordingJob) proxy.job();

        assertTrue(manager.killJob(proxy, null));

        assertEquals(JobStatus.KILLED, proxy.awaitDone(WAIT).get(5, TimeUnit.SECONDS));
        assertFalse(job.started);
        assertTrue(job.stopped);
        assertNull(manager.findJob(proxy.identifier()));
    }

    /* ==== outputs ==== */

    @Test
    void outputFieldShouldBeWriteOnceAndResolveWaiters() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(OutputJob.class, JobArguments.empty(), null, false);
        OutputJob job = (OutputJob) proxy.job();

        assertThrows(JobStateException.class, () -> proxy.getOutputField("result"));
        assertEquals("none", proxy.getOutputField("result", "none"));
        CompletableFuture<Object> waiter = proxy.awaitOutputField("result", WAIT);

        job.setOutputField("result", 42);

        assertEquals(42, waiter.get(5, TimeUnit.SECONDS));
        assertEquals(42, proxy.getOutputField("result"));
        assertThrows(JobStateException.class, () -> job.setOutputField("result", 43));
        assertEquals(42, proxy.getOutputField("result"));
        assertThrows(IllegalArgumentException.class, () -> job.setOutputField("undeclared", 1));
    }

    @Test
    void pendingOutputWaitersShouldResolveWithTerminalStatus() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(OutputJob.class);
        CompletableFuture<Object> field = proxy.awaitOutputField("result", WAIT);
        CompletableFuture<Object> queue = proxy.awaitOutputQueueAdd("values", WAIT, false);

        manager.killJob(proxy, null);

        assertEquals(JobStatus.KILLED, field.get(5, TimeUnit.SECONDS));
        assertEquals(JobStatus.KILLED, queue.get(5, TimeUnit.SECONDS));
    }

    @Test
    void clearShouldMoveUnreadValuesOnlyIntoRescueBuffers() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(OutputJob.class, JobArguments.empty(), null, false);
        OutputJob job = (OutputJob) proxy.job();
        JobOutputQueueProxy rescuing = proxy.getOutputQueueProxy();
        rescuing.configOutputQueue("values", true);
        JobOutputQueueProxy plain = proxy.getOutputQueueProxy();

        job.pushOutputQueue("values", "a");
        job.pushOutputQueue("values", "b");
        job.pushOutputQueue("values", "c");
        assertEquals("a", rescuing.popOutputQueue("values"));
        assertEquals("a", plain.popOutputQueue("values"));

        CompletableFuture<Object> cancelled = proxy.awaitOutputQueueAdd("values", WAIT, true);
        CompletableFuture<Object> notified = proxy.awaitOutputQueueAdd("values", WAIT, false);
        job.clearOutputQueue("values");

        assertTrue(cancelled.isCancelled());
        assertEquals(JobStatus.OUTPUT_QUEUE_CLEARED, notified.get(5, TimeUnit.SECONDS));
        assertEquals(2, rescuing.rescuedCount("values"));
        assertEquals(List.of("b", "c"), rescuing.popOutputQueue("values", 5));
        assertTrue(plain.outputQueueIsEmpty("values"));
        assertThrows(NoSuchElementException.class, () -> plain.popOutputQueue("values"));

        job.pushOutputQueue("values", "d");
        assertEquals("d", rescuing.popOutputQueue("values"));
        assertEquals("d", plain.popOutputQueue("values"));
        assertTrue(plain.outputQueueIsExhausted("values"));
    }

    @Test
    void rescuingConsumerShouldReadEveryValueOnceWhileQueueIsClearedConcurrently() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(OutputJob.class, JobArguments.empty(), null, false);
        OutputJob job = (OutputJob) proxy.job();
        JobOutputQueueProxy consumer = proxy.getOutputQueueProxy();
        consumer.configOutputQueue("values", true);

        int total = 2000;
        List<Object> expected = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            expected.add(i);
        }
        Thread producer = new Thread(() -> {
            for (int i = 0; i < total; i++) {
                job.pushOutputQueue("values", i);
                if (i % 7 == 6) {
                    job.clearOutputQueue("values");
                }
            }
        });

        List<Object> read = new ArrayList<>();
        producer.start();
        while (producer.isAlive()) {
            read.addAll(consumer.popOutputQueue("values", 3));
        }
        producer.join();
        read.addAll(consumer.popAllOutputQueue("values"));

        assertEquals(expected, read);
    }

    /* ==== permissions and guards ==== */

    @Test
    void mediumJobShouldOnlyStopJobsItCreated() {
        JobProxy controller = manager.createAndRegisterJob(ControllerJob.class);
        JobProxy high = manager.createAndRegisterJob(IdleJob.class, JobArguments.empty(), JobPermissionLevel.HIGH, true);
        JobProxy foreign = manager.createAndRegisterJob(IdleJob.class);

        assertThrows(JobPermissionException.class, () -> controller.runPublicMethod("stopOther", high));
        assertThrows(JobPermissionException.class, () -> controller.runPublicMethod("stopOther", foreign));
        assertFalse((Boolean) controller.runPublicMethod("mayKill", foreign));

        JobProxy own = (JobProxy) controller.runPublicMethod("spawn");
        assertEquals(controller, own.creator());
        assertTrue((Boolean) controller.runPublicMethod("mayKill", own));
        assertEquals(Boolean.TRUE, controller.runPublicMethod("stopOther", own));
    }

    @Test
    void systemLevelShouldNeverBeAssignable() {
        JobProxy proxy = manager.createJob(IdleJob.class);

        assertThrows(IllegalArgumentException.class,
                () -> manager.registerJob(proxy, JobPermissionLevel.SYSTEM, false));
        assertThrows(IllegalArgumentException.class,
                () -> manager.registerJobClass(IdleJob.class, JobPermissionLevel.SYSTEM));
    }

    @Test
    void guardedJobShouldOnlyBeOperatedOnByItsGuardian() throws Exception {
        JobProxy guardian = manager.createAndRegisterJob(ControllerJob.class);
        JobProxy other = manager.createAndRegisterJob(ControllerJob.class, JobArguments.empty(), JobPermissionLevel.HIGH, true);
        JobProxy worker = (JobProxy) guardian.runPublicMethod("spawn");

        guardian.runPublicMethod("guard", worker);
        assertTrue(worker.isBeingGuarded());
        assertEquals(guardian, worker.guardian());

        assertThrows(JobIsGuardedException.class, () -> manager.stopJob(worker, null, true));
        assertThrows(JobIsGuardedException.class, () -> other.runPublicMethod("unguard", worker));
        assertThrows(JobIsGuardedException.class, () -> other.runPublicMethod("guard", worker));

        CompletableFuture<Void> unguarded = worker.awaitUnguard(WAIT);
        guardian.runPublicMethod("unguard", worker);
        unguarded.get(5, TimeUnit.SECONDS);
        assertFalse(worker.isBeingGuarded());
        assertTrue(manager.stopJob(worker, null, true));
    }

    @Test
    void guardedJobShouldBeReleasedWhenItsGuardianIsKilled() throws Exception {
        JobProxy guardian = manager.createAndRegisterJob(ControllerJob.class);
        JobProxy worker = (JobProxy) guardian.runPublicMethod("spawn");
        guardian.runPublicMethod("guard", worker);
        CompletableFuture<Void> unguarded = worker.awaitUnguard(WAIT);

        manager.killJob(guardian, null);

        assertEquals(JobStatus.KILLED, guardian.awaitDone(WAIT).get(5, TimeUnit.SECONDS));
        unguarded.get(5, TimeUnit.SECONDS);
        assertFalse(worker.isBeingGuarded());
        assertNull(worker.guardian());
        assertTrue(manager.stopJob(worker, null, true));
    }

    @Test
    void lowerLevelJobShouldNotUnguardAnotherGuardiansJob() {
        JobProxy guardian = manager.createAndRegisterJob(ControllerJob.class, JobArguments.empty(), JobPermissionLevel.HIGH, true);
        JobProxy lower = manager.createAndRegisterJob(ControllerJob.class);
        JobProxy worker = (JobProxy) guardian.runPublicMethod("spawn");
        guardian.runPublicMethod("guard", worker);

        assertThrows(JobPermissionException.class, () -> lower.runPublicMethod("unguard", worker));

        assertTrue(worker.isBeingGuarded());
        assertEquals(guardian, worker.guardian());
    }

    @Test
    void guardingHandleShouldReleaseGuardOnClose() {
        JobProxy proxy = manager.createAndRegisterJob(IdleJob.class);

        try (JobManager.JobGuard guard = manager.guardingJob(proxy)) {
            assertEquals(proxy, guard.target());
            assertTrue(proxy.isBeingGuarded());
        }
        assertFalse(proxy.isBeingGuarded());
    }

    /* ==== lookup ==== */

    @Test
    void findJobsShouldFilterAndNeverReturnManagerJob() {
        JobProxy controller = manager.createAndRegisterJob(ControllerJob.class);
        JobProxy idle = manager.createAndRegisterJob(IdleJob.class);
        JobProxy spawned = (JobProxy) controller.runPublicMethod("spawn");

        assertEquals(List.of(controller, idle, spawned), manager.findJobs(JobQuery.all()));
        assertEquals(List.of(idle, spawned), manager.findJobs(JobQuery.builder().classes(IdleJob.class).build()));
        assertEquals(List.of(spawned), manager.findJobs(JobQuery.builder().creator(controller).build()));
        assertEquals(List.of(controller), manager.findJobs(JobQuery.builder().limit(1).build()));
        assertEquals(idle, manager.findJob(idle.identifier()));
    }

    /* ==== events ==== */

    @Test
    void dispatchedEventsShouldReachEventJobsAndWaiters() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(PingJob.class);
        PingJob job = (PingJob) proxy.job();
        waitUntil(proxy::isIdling);

        CompletableFuture<PingEvent> second = manager.waitForEvent(PingEvent.class, e -> e.value == 2, WAIT);
        manager.dispatchEvent(new PingEvent(1));
        assertFalse(second.isDone());
        manager.dispatchEvent(new PingEvent(2));

        assertEquals(2, second.get(5, TimeUnit.SECONDS).value);
        waitUntil(() -> job.received.size() == 2);
        assertEquals(List.of(1, 2), job.received);
    }

    @Test
    void multiEventJobShouldCapConcurrentSessions() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(PingSessionJob.class);
        PingSessionJob job = (PingSessionJob) proxy.job();
        waitUntil(proxy::isIdling);

        for (int i = 1; i <= 3; i++) {
            manager.dispatchEvent(new PingEvent(i));
        }
        waitUntil(() -> job.getActiveSessionCount() == 2);
        job.release.countDown();

        List<EventSession<PingEvent>> finished = new ArrayList<>();
        waitUntil(() -> {
            EventSession<PingEvent> session = job.pollFinishedSession();
            if (session != null) {
                finished.add(session);
            }
            return finished.size() == 3;
        });
        assertEquals(3, job.handled.get());
        assertEquals(2, job.maxActive.get());
        for (EventSession<PingEvent> session : finished) {
            assertNull(session.error());
            assertEquals(session.event().value, session.data().get("value"));
        }
    }

    @Test
    void managerStopShouldKillJobsAndCancelEventWaits() throws Exception {
        JobProxy proxy = manager.createAndRegisterJob(IdleJob.class);
        CompletableFuture<PingEvent> waiter = manager.waitForEvent(PingEvent.class, null, null);

        manager.stop(JobOp.KILL);

        assertEquals(JobStatus.KILLED, proxy.awaitDone(WAIT).get(5, TimeUnit.SECONDS));
        assertNull(proxy.getStoppingReason());
        assertEquals(JobStopReason.External.KILLING, proxy.getLastStoppingReason());
        assertTrue(waiter.isCancelled());
        assertFalse(manager.isRunning());
        assertThrows(IllegalStateException.class, () -> manager.createJob(IdleJob.class));
    }

    /* ==== scheduling ==== */

    @Test
    void oneShotScheduleShouldCreateExactlyOneJob() throws Exception {
        manager.registerJobClass(ScheduledCounterJob.class, JobPermissionLevel.MEDIUM);

        String id = manager.createJobSchedule(ScheduledCounterJob.class, Instant.now(), Duration.ZERO, 0, null);
        assertTrue(manager.hasJobSchedule(id));

        waitUntil(() -> !manager.hasJobSchedule(id));
        Thread.sleep(100);
        assertEquals(1, ScheduledCounterJob.CREATED.get());
        assertFalse(manager.jobScheduleHasFailed(id));
    }

    @Test
    void recurringScheduleShouldStopAfterMaxRecurrences() throws Exception {
        manager.registerJobClass(ScheduledCounterJob.class, JobPermissionLevel.MEDIUM);

        String id = manager.createJobSchedule(ScheduledCounterJob.class, Instant.now(), Duration.ofMillis(30), 3, null);

        waitUntil(() -> !manager.hasJobSchedule(id));
        Thread.sleep(100);
        assertEquals(3, ScheduledCounterJob.CREATED.get());
    }

    @Test
    void scheduleShouldRequireRegisteredUuidAndValidArguments() {
        assertThrows(JobSchedulingException.class, () -> manager.createJobSchedule(ScheduledCounterJob.class,
                Instant.now(), null, 0, null));

        manager.registerJobClass(ScheduledCounterJob.class, JobPermissionLevel.MEDIUM);
        assertThrows(JobSchedulingException.class, () -> manager.createJobSchedule(ScheduledCounterJob.class,
                Instant.now(), Duration.ofSeconds(-1), 0, null));
        assertThrows(JobSchedulingException.class, () -> manager.createJobSchedule(ScheduledCounterJob.class,
                Instant.now(), Duration.ofSeconds(1), 0, null));
        assertThrows(JobSchedulingException.class, () -> manager.removeJobSchedule("missing"));
    }

    @Test
    void scheduleOutsideNanosecondRangeShouldBeRejected() {
        manager.registerJobClass(ScheduledCounterJob.class, JobPermissionLevel.MEDIUM);

        assertThrows(JobSchedulingException.class, () -> manager.createJobSchedule(ScheduledCounterJob.class,
                Instant.parse("2300-01-01T00:00:00Z"), null, 0, null));
        assertThrows(JobSchedulingException.class, () -> manager.createJobSchedule(ScheduledCounterJob.class,
                Instant.now(), Duration.ofDays(365L * 400), -1, null));
        assertTrue(manager.getJobScheduleIdentifiers().isEmpty());
    }

    @Test
    void exportedSchedulesShouldImportIntoAnotherManager() {
        manager.registerJobClass(ScheduledCounterJob.class, JobPermissionLevel.MEDIUM);
        Instant later = Instant.now().plusSeconds(3600);
        String first = manager.createJobSchedule(ScheduledCounterJob.class, later, null, 0, null);
        String second = manager.createJobSchedule(ScheduledCounterJob.class, later.plusSeconds(60),
                Duration.ofMinutes(5), -1, JobArguments.of("x"));

        byte[] data = manager.exportSchedulesBytes();
        JobManager other = new JobManager();
        try {
            other.importSchedules(data, false, true);
            assertEquals(Set.of(first, second), Set.copyOf(other.getJobScheduleIdentifiers()));
            assertThrows(JobSchedulingException.class, () -> other.importSchedules(data, false, true));
        } finally {
            other.shutdown();
        }

        manager.removeJobSchedule(first);
        assertEquals(List.of(second), manager.getJobScheduleIdentifiers());
    }
}
