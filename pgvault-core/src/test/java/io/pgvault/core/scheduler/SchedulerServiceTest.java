package io.pgvault.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pgvault.core.schedule.ExecutionOutcome;
import io.pgvault.core.schedule.JobRegistry;
import io.pgvault.core.schedule.JobSnapshot;
import io.pgvault.core.schedule.OutcomeStatus;
import io.pgvault.core.schedule.RecurrenceKind;
import io.pgvault.core.store.NoopJobStore;
import io.pgvault.core.store.SqliteJobStore;
import io.pgvault.core.support.MutableClock;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SchedulerServiceTest {

    private static final LocalDateTime START = LocalDateTime.of(2025, 6, 1, 2, 0, 0);

    @TempDir
    Path tempDir;

    private SchedulerService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    @Test
    void shouldRejectStartAndSubmitBeforeInitialize() {
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));

        assertThat(service.state()).isEqualTo(SchedulerState.UNINITIALIZED);
        assertThatThrownBy(() -> service.start()).isInstanceOf(NotInitializedException.class);
        assertThatThrownBy(() -> service.submit(1, Map.of(), RecurrenceKind.DAILY, START))
            .isInstanceOf(NotInitializedException.class);
        assertThat(service.status().initialized()).isFalse();
        assertThat(service.status().jobCount()).isZero();
    }

    @Test
    void shouldIgnoreRepeatedInitializeAndStart() {
        List<String> calls = new CopyOnWriteArrayList<>();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> ExecutionOutcome.succeeded(), MutableClock.at(START));
        service.initialize((ownerId, payload) -> {
            calls.add("second");
            return ExecutionOutcome.succeeded();
        }, MutableClock.at(START));

        service.submit(1, Map.of(), RecurrenceKind.ONE_TIME, START);
        service.runDueJobs();
        assertThat(calls).isEmpty();

        service.start();
        service.start();
        assertThat(service.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(service.status().running()).isTrue();

        service.stop();
        service.stop();
        assertThat(service.state()).isEqualTo(SchedulerState.STOPPED);
    }

    @Test
    void shouldRunDailyJobOnceItIsDueAndAdvanceToTomorrow() {
        MutableClock clock = MutableClock.at(START.minusMinutes(1));
        List<Map<String, Object>> payloads = new CopyOnWriteArrayList<>();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            payloads.add(payload);
            return ExecutionOutcome.succeeded();
        }, clock);

        String jobId = service.submit(4, Map.of("file", "/backups/app.dump"), RecurrenceKind.DAILY, START);

        assertThat(service.runDueJobs()).isZero();

        clock.set(START.plusSeconds(1));
        assertThat(service.runDueJobs()).isEqualTo(1);
        assertThat(service.runDueJobs()).isZero();

        JobSnapshot snapshot = service.job(jobId).orElseThrow();
        assertThat(snapshot.runCount()).isEqualTo(1);
        assertThat(snapshot.lastOutcome()).isEqualTo(OutcomeStatus.SUCCESS);
        assertThat(snapshot.lastRun()).isEqualTo(START.plusSeconds(1));
        assertThat(snapshot.nextRun()).isEqualTo(LocalDateTime.of(2025, 6, 2, 2, 0, 0));
        assertThat(payloads).containsExactly(Map.of("file", "/backups/app.dump"));
    }

    @Test
    void shouldKeepRunningOtherJobsWhenOneFails() {
        MutableClock clock = MutableClock.at(START);
        List<String> files = new CopyOnWriteArrayList<>();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            files.add(String.valueOf(payload.get("file")));
            if ("a.dump".equals(payload.get("file"))) {
                throw new IllegalStateException("disk full");
            }
            return ExecutionOutcome.succeeded();
        }, clock);

        String failing = service.submit(9, Map.of("file", "a.dump"), RecurrenceKind.DAILY, START);
        String healthy = service.submit(9, Map.of("file", "b.dump"), RecurrenceKind.DAILY, START);

        assertThat(service.runDueJobs()).isEqualTo(2);

        assertThat(files).containsExactly("a.dump", "b.dump");
        JobSnapshot failed = service.job(failing).orElseThrow();
        assertThat(failed.lastOutcome()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(failed.lastFailureReason()).isEqualTo("disk full");
        assertThat(failed.runCount()).isEqualTo(1);
        assertThat(failed.nextRun()).isEqualTo(START.plusDays(1));
        assertThat(service.job(healthy).orElseThrow().lastOutcome()).isEqualTo(OutcomeStatus.SUCCESS);
    }

    @Test
    void shouldRunJobSubmittedDuringAPassExactlyOnceAfterwards() {
        MutableClock clock = MutableClock.at(START);
        List<String> files = new CopyOnWriteArrayList<>();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            String file = String.valueOf(payload.get("file"));
            files.add(file);
            if ("a.dump".equals(file)) {
                service.submit(ownerId, Map.of("file", "late.dump"), RecurrenceKind.ONE_TIME, START);
            }
            return ExecutionOutcome.succeeded();
        }, clock);
        service.submit(1, Map.of("file", "a.dump"), RecurrenceKind.ONE_TIME, START);

        assertThat(service.runDueJobs()).isEqualTo(1);
        assertThat(files).containsExactly("a.dump");

        assertThat(service.runDueJobs()).isEqualTo(1);
        assertThat(service.runDueJobs()).isZero();
        assertThat(files).containsExactly("a.dump", "late.dump");
        assertThat(service.jobs()).extracting(JobSnapshot::runCount).containsExactly(1, 1);
    }

    @Test
    void shouldLeaveRemainingJobsForNextPassAfterInterrupt() {
        List<Integer> owners = new CopyOnWriteArrayList<>();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            owners.add(ownerId);
            if (ownerId == 1 && owners.size() == 1) {
                throw new InterruptedException("shutting down");
            }
            return ExecutionOutcome.succeeded();
        }, MutableClock.at(START));
        String interrupted = service.submit(1, Map.of(), RecurrenceKind.DAILY, START);
        String waiting = service.submit(2, Map.of(), RecurrenceKind.DAILY, START);

        assertThat(service.runDueJobs()).isEqualTo(1);
        assertThat(Thread.interrupted()).isTrue();

        assertThat(owners).containsExactly(1);
        assertThat(service.job(interrupted).orElseThrow().lastFailureReason()).isEqualTo("interrupted");
        JobSnapshot untouched = service.job(waiting).orElseThrow();
        assertThat(untouched.runCount()).isZero();
        assertThat(untouched.nextRun()).isEqualTo(START);

        assertThat(service.runDueJobs()).isEqualTo(1);
        assertThat(owners).containsExactly(1, 2);
        assertThat(service.job(waiting).orElseThrow().lastOutcome()).isEqualTo(OutcomeStatus.SUCCESS);
    }

    @Test
    void shouldNotRunJobWhoseStartIsInTheFuture() {
        AtomicInteger executions = new AtomicInteger();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            executions.incrementAndGet();
            return ExecutionOutcome.succeeded();
        }, MutableClock.at(START));

        service.submit(2, Map.of(), RecurrenceKind.ONE_TIME, START.plusHours(1));
        service.runDueJobs();

        assertThat(executions).hasValue(0);
        assertThat(service.jobs()).singleElement()
            .satisfies(job -> assertThat(job.runCount()).isZero());
    }

    @Test
    void shouldReportTheSameStatusWhenNothingChanges() {
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> ExecutionOutcome.succeeded(), MutableClock.at(START));
        service.submit(3, Map.of(), RecurrenceKind.WEEKLY, START);
        service.submit(1, Map.of(), RecurrenceKind.MONTHLY, START);

        SchedulerStatus first = service.status();
        SchedulerStatus second = service.status();

        assertThat(second).isEqualTo(first);
        assertThat(first.jobCount()).isEqualTo(2);
        assertThat(first.owners()).extracting(OwnerJobSummary::ownerId).containsExactly(3, 1);
        assertThat(first.initialized()).isTrue();
        assertThat(first.running()).isFalse();
    }

    @Test
    void shouldExecuteDueJobsFromBackgroundLoop() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            ran.countDown();
            return ExecutionOutcome.succeeded();
        }, MutableClock.at(START));
        service.submit(5, Map.of(), RecurrenceKind.ONE_TIME, START);

        service.start();

        assertThat(ran.await(5, TimeUnit.SECONDS)).isTrue();
        awaitCondition(() -> service.status().lastIterationAt() != null);
        assertThat(service.jobsFor(5)).singleElement()
            .satisfies(job -> assertThat(job.nextRun()).isNull());
    }

    @Test
    void shouldStartAutomaticallyOnFirstSubmitWhenConfigured() {
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(true, false));
        service.initialize((ownerId, payload) -> ExecutionOutcome.succeeded(), MutableClock.at(START));

        service.submit(1, Map.of(), RecurrenceKind.DAILY, START.plusDays(1));
        assertThat(service.state()).isEqualTo(SchedulerState.RUNNING);

        service.stop();
        service.submit(1, Map.of(), RecurrenceKind.DAILY, START.plusDays(1));
        assertThat(service.state()).isEqualTo(SchedulerState.STOPPED);
        assertThat(service.jobs()).hasSize(2);
    }

    @Test
    void shouldNeverRunTwoPassesConcurrentlyAcrossRestarts() throws Exception {
        MutableClock clock = MutableClock.at(START);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger executions = new AtomicInteger();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(5);
                clock.advance(Duration.ofDays(1));
                executions.incrementAndGet();
                return ExecutionOutcome.succeeded();
            } finally {
                active.decrementAndGet();
            }
        }, clock);
        service.submit(1, Map.of(), RecurrenceKind.DAILY, START);

        for (int i = 0; i < 5; i++) {
            service.start();
            Thread.sleep(30);
            service.stop();
        }
        service.start();
        int before = executions.get();
        awaitCondition(() -> executions.get() >= before + 3);

        assertThat(maxActive).hasValue(1);
        assertThat(service.state()).isEqualTo(SchedulerState.RUNNING);
    }

    @Test
    void shouldStopItselfAfterRepeatedLoopFailures() {
        FailingClock clock = new FailingClock(START);
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> ExecutionOutcome.succeeded(), clock);
        service.submit(1, Map.of(), RecurrenceKind.DAILY, START.plusDays(1));

        clock.failing = true;
        service.start();

        awaitCondition(() -> service.state() == SchedulerState.STOPPED);
        SchedulerStatus status = service.status();
        assertThat(status.running()).isFalse();
        assertThat(status.consecutiveLoopFailures()).isEqualTo(3);
        assertThat(status.lastLoopError()).isEqualTo("clock unavailable");
        assertThat(status.jobCount()).isEqualTo(1);

        clock.failing = false;
        service.start();
        assertThat(service.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(service.status().lastLoopError()).isEmpty();
    }

    @Test
    void shouldHoldOtherJobsWhileAnExecutorCallBlocks() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<Integer> owners = new CopyOnWriteArrayList<>();
        service = new SchedulerService(new JobRegistry(), new NoopJobStore(), settings(false, false));
        service.initialize((ownerId, payload) -> {
            owners.add(ownerId);
            if (ownerId == 1) {
                entered.countDown();
                release.await();
            }
            return ExecutionOutcome.succeeded();
        }, MutableClock.at(START));
        service.submit(1, Map.of(), RecurrenceKind.ONE_TIME, START);
        service.submit(2, Map.of(), RecurrenceKind.ONE_TIME, START);

        Thread pass = new Thread(service::runDueJobs, "manual-pass");
        pass.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(owners).containsExactly(1);

        release.countDown();
        pass.join(5_000);
        assertThat(owners).containsExactly(1, 2);
    }

    @Test
    void shouldRestoreJobsAndRunHistoryFromStore() throws Exception {
        Path db = tempDir.resolve("jobs.db");
        MutableClock clock = MutableClock.at(START);
        SchedulerService first = new SchedulerService(new JobRegistry(), new SqliteJobStore(db), settings(false, false));
        first.initialize((ownerId, payload) -> ExecutionOutcome.failure("exit status 1"), clock);
        String jobId = first.submit(6, Map.of("file", "/backups/six.dump"), RecurrenceKind.WEEKLY, START);
        first.runDueJobs();
        first.close();

        service = new SchedulerService(new JobRegistry(), new SqliteJobStore(db), settings(false, true));
        service.initialize((ownerId, payload) -> ExecutionOutcome.succeeded(), clock);

        JobSnapshot restored = service.job(jobId).orElseThrow();
        assertThat(restored.ownerId()).isEqualTo(6);
        assertThat(restored.runCount()).isEqualTo(1);
        assertThat(restored.lastOutcome()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(restored.lastRun()).isEqualTo(START);
        assertThat(restored.nextRun()).isEqualTo(START.plusWeeks(1));
    }

    private static SchedulerSettings settings(boolean autoStart, boolean restore) {
        return new SchedulerSettings(Duration.ofMillis(20), Duration.ZERO, Duration.ofSeconds(2), 3, autoStart, restore);
    }

    private static void awaitCondition(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted", e);
            }
        }
    }

    private static final class FailingClock extends Clock {
        private final MutableClock delegate;
        private volatile boolean failing;

        private FailingClock(LocalDateTime start) {
            this.delegate = MutableClock.at(start);
        }

        @Override
        public ZoneId getZone() {
            return delegate.getZone();
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            if (failing) {
                throw new IllegalStateException("clock unavailable");
            }
            return delegate.instant();
        }
    }
}
