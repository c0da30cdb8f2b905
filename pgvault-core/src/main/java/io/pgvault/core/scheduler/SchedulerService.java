package io.pgvault.core.scheduler;

import io.pgvault.core.schedule.AnchorTime;
import io.pgvault.core.schedule.ExecutionOutcome;
import io.pgvault.core.schedule.JobRegistry;
import io.pgvault.core.schedule.JobSnapshot;
import io.pgvault.core.schedule.RecurrenceKind;
import io.pgvault.core.schedule.RegisteredJob;
import io.pgvault.core.schedule.ScheduledJob;
import io.pgvault.core.store.JobStore;
import io.pgvault.core.store.StoredJob;
import io.pgvault.core.submission.ScheduleRequest;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs due backup jobs on a single background thread.
 *
 * <p>Lifecycle: {@code UNINITIALIZED -> INITIALIZED -> RUNNING <-> STOPPED}. The loop wakes every
 * poll interval, takes one time snapshot, walks the registry in owner then insertion order and
 * hands every due job to the {@link ActionExecutor}. A failing job is recorded as
 * {@code FAILED} and the walk continues. A failure of the walk itself is counted; after
 * {@link SchedulerSettings#maxConsecutiveLoopFailures()} in a row the service stops itself.
 *
 * <p>Jobs run synchronously and there is no per-job timeout: an executor call that never returns
 * holds up every other due job until it does.
 */
public final class SchedulerService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerService.class);

    private final JobRegistry registry;
    private final JobStore store;
    private final SchedulerSettings settings;
    private final Object lifecycleLock = new Object();
    private final ReentrantLock iterationLock = new ReentrantLock();
    private final AtomicInteger consecutiveLoopFailures = new AtomicInteger();

    private volatile SchedulerState state = SchedulerState.UNINITIALIZED;
    private volatile ActionExecutor executor;
    private volatile Clock clock;
    private volatile long generation;
    private volatile LocalDateTime lastIterationAt;
    private volatile String lastLoopError = "";
    private ScheduledExecutorService loop;

    public SchedulerService(JobRegistry registry, JobStore store, SchedulerSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public void initialize(ActionExecutor actionExecutor, Clock schedulerClock) {
        Objects.requireNonNull(actionExecutor, "actionExecutor must not be null");
        Objects.requireNonNull(schedulerClock, "schedulerClock must not be null");
        synchronized (lifecycleLock) {
            if (state != SchedulerState.UNINITIALIZED) {
                LOG.debug("Scheduler already initialized, ignoring");
                return;
            }
            this.executor = actionExecutor;
            this.clock = schedulerClock;
            state = SchedulerState.INITIALIZED;
        }
        LOG.info("Scheduler initialized (poll interval {})", settings.pollInterval());
        if (settings.restoreOnStartup()) {
            restoreJobs();
        }
    }

    public void start() {
        synchronized (lifecycleLock) {
            switch (state) {
                case UNINITIALIZED -> throw new NotInitializedException("scheduler must be initialized before start");
                case RUNNING -> {
                    return;
                }
                default -> {
                }
            }
            long current = ++generation;
            loop = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "pgvault-scheduler-" + current);
                thread.setDaemon(true);
                return thread;
            });
            consecutiveLoopFailures.set(0);
            lastLoopError = "";
            state = SchedulerState.RUNNING;
            loop.scheduleWithFixedDelay(
                () -> tick(current),
                settings.initialDelay().toMillis(),
                settings.pollInterval().toMillis(),
                TimeUnit.MILLISECONDS
            );
        }
        LOG.info("Scheduler started");
    }

    public void stop() {
        ScheduledExecutorService stopping;
        synchronized (lifecycleLock) {
            if (state != SchedulerState.RUNNING) {
                return;
            }
            state = SchedulerState.STOPPED;
            generation++;
            stopping = loop;
            loop = null;
        }
        stopping.shutdown();
        try {
            if (!stopping.awaitTermination(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Scheduler loop did not exit within {}; it will stop after the current job", settings.stopTimeout());
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the scheduler loop to exit");
            return;
        }
        LOG.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public String submit(int ownerId, Map<String, Object> payload, RecurrenceKind recurrence, LocalDateTime startAt) {
        return submit(ScheduleRequest.of(ownerId, payload, recurrence, startAt));
    }

    public String submit(ScheduleRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        requireInitialized();
        ScheduledJob job = new ScheduledJob(
            request.ownerId(),
            request.payload(),
            request.recurrence(),
            AnchorTime.of(request.startAt()),
            LocalDateTime.now(clock)
        );
        String jobId = registry.add(request.ownerId(), job);
        LOG.info(
            "Scheduled {} backup job {} for owner {} starting {}",
            request.recurrence().wireName(),
            jobId,
            request.ownerId(),
            job.anchor().start()
        );
        persist(() -> store.insert(StoredJob.of(job, request)), jobId);

        if (settings.autoStart() && state == SchedulerState.INITIALIZED) {
            start();
        }
        return jobId;
    }

    /**
     * Runs one pass over the registry on the calling thread. Shares the loop's iteration lock, so
     * it never overlaps a background pass.
     *
     * @return number of jobs executed
     */
    public int runDueJobs() {
        requireInitialized();
        iterationLock.lock();
        try {
            return executeDueJobs(() -> true);
        } finally {
            iterationLock.unlock();
        }
    }

    public SchedulerStatus status() {
        List<OwnerJobSummary> owners = new ArrayList<>();
        int jobCount = 0;
        for (Integer ownerId : registry.owners()) {
            List<JobSnapshot> jobs = registry.jobsFor(ownerId).stream()
                .map(ScheduledJob::snapshot)
                .toList();
            jobCount += jobs.size();
            owners.add(new OwnerJobSummary(ownerId, jobs));
        }
        SchedulerState current = state;
        return new SchedulerStatus(
            current,
            current == SchedulerState.RUNNING,
            current != SchedulerState.UNINITIALIZED,
            jobCount,
            consecutiveLoopFailures.get(),
            lastIterationAt,
            lastLoopError,
            List.copyOf(owners)
        );
    }

    public List<JobSnapshot> jobs() {
        return registry.allJobs().stream()
            .map(entry -> entry.job().snapshot())
            .toList();
    }

    public List<JobSnapshot> jobsFor(int ownerId) {
        return registry.jobsFor(ownerId).stream()
            .map(ScheduledJob::snapshot)
            .toList();
    }

    public Optional<JobSnapshot> job(String jobId) {
        return registry.find(jobId).map(ScheduledJob::snapshot);
    }

    public SchedulerState state() {
        return state;
    }

    private void tick(long tickGeneration) {
        if (!isCurrent(tickGeneration)) {
            return;
        }
        iterationLock.lock();
        try {
            if (!isCurrent(tickGeneration)) {
                return;
            }
            int executed = executeDueJobs(() -> isCurrent(tickGeneration));
            consecutiveLoopFailures.set(0);
            if (executed > 0) {
                LOG.debug("Scheduler pass executed {} job(s)", executed);
            }
        } catch (RuntimeException e) {
            onLoopFailure(tickGeneration, e);
        } catch (Error e) {
            // the executor suppresses further runs once a task throws
            failStop(tickGeneration, e);
            throw e;
        } finally {
            iterationLock.unlock();
        }
    }

    private int executeDueJobs(BooleanSupplier keepGoing) {
        LocalDateTime now = LocalDateTime.now(clock);
        int executed = 0;
        for (RegisteredJob entry : registry.allJobs()) {
            if (!keepGoing.getAsBoolean()) {
                LOG.info("Stop requested, leaving scheduler pass early");
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                LOG.warn("Scheduler thread interrupted, remaining due jobs wait for the next pass");
                break;
            }
            if (entry.job().isDue(now)) {
                runJob(entry, now);
                executed++;
            }
        }
        lastIterationAt = now;
        return executed;
    }

    private void runJob(RegisteredJob entry, LocalDateTime now) {
        ScheduledJob job = entry.job();
        LOG.info("Running scheduled backup job {} for owner {}", job.id(), entry.ownerId());
        ExecutionOutcome outcome;
        try {
            outcome = executor.execute(entry.ownerId(), job.payload());
            if (outcome == null) {
                outcome = ExecutionOutcome.failure("executor returned no outcome");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = ExecutionOutcome.failure("interrupted");
        } catch (Exception e) {
            LOG.warn("Scheduled backup job {} for owner {} raised an error", job.id(), entry.ownerId(), e);
            outcome = ExecutionOutcome.failure(describe(e));
        }

        job.recordOutcome(outcome, now);
        if (outcome.success()) {
            LOG.info("Scheduled backup job {} succeeded, next run {}", job.id(), job.nextRun().orElse(null));
        } else {
            LOG.warn(
                "Scheduled backup job {} failed: {}; next run {}",
                job.id(),
                outcome.reason(),
                job.nextRun().orElse(null)
            );
        }
        persist(
            () -> store.updateRunHistory(
                job.id(),
                job.lastRun().orElse(null),
                job.nextRun().orElse(null),
                job.runCount(),
                job.lastOutcome()
            ),
            job.id()
        );
    }

    private void onLoopFailure(long tickGeneration, RuntimeException error) {
        int failures = consecutiveLoopFailures.incrementAndGet();
        lastLoopError = describe(error);
        LOG.error(
            "Scheduler pass failed ({} of {} consecutive failures allowed)",
            failures,
            settings.maxConsecutiveLoopFailures(),
            error
        );
        if (failures >= settings.maxConsecutiveLoopFailures()) {
            failStop(tickGeneration, error);
        }
    }

    private void failStop(long tickGeneration, Throwable error) {
        ScheduledExecutorService stopping;
        synchronized (lifecycleLock) {
            if (generation != tickGeneration || state != SchedulerState.RUNNING) {
                return;
            }
            state = SchedulerState.STOPPED;
            generation++;
            stopping = loop;
            loop = null;
            lastLoopError = describe(error);
        }
        stopping.shutdown();
        LOG.error("Scheduler stopped after repeated loop failures: {}", lastLoopError);
    }

    private void restoreJobs() {
        try {
            List<StoredJob> stored = store.loadEnabled();
            int restored = 0;
            for (StoredJob entry : stored) {
                if (registry.find(entry.jobId()).isPresent()) {
                    continue;
                }
                registry.add(entry.ownerId(), entry.toScheduledJob());
                restored++;
            }
            if (restored > 0) {
                LOG.info("Restored {} scheduled backup job(s) from storage", restored);
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not restore scheduled jobs from storage", e);
        }
    }

    private void persist(StoreAction action, String jobId) {
        try {
            action.run();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Could not persist state of scheduled job {}", jobId, e);
        }
    }

    private boolean isCurrent(long tickGeneration) {
        return state == SchedulerState.RUNNING && generation == tickGeneration;
    }

    private void requireInitialized() {
        if (state == SchedulerState.UNINITIALIZED) {
            throw new NotInitializedException("scheduler is not initialized");
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    @FunctionalInterface
    private interface StoreAction {
        void run() throws IOException;
    }
}
