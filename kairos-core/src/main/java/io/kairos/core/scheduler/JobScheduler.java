package io.kairos.core.scheduler;

import io.kairos.core.calendar.CalendarSyncResult;
import io.kairos.core.calendar.CalendarSyncService;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the job map, the timers that fire jobs, and the reconciliation of calendar events after
 * each firing. State changes and store writes happen under this instance's monitor; the execution
 * callback and calendar calls run outside it.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);
    private static final int DEFAULT_WORKER_THREADS = 4;
    private static final Duration DEFAULT_STORE_RETRY = Duration.ofSeconds(30);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final Comparator<ScheduledJob> BY_NEXT_RUN = Comparator
        .comparingLong((ScheduledJob job) -> job.nextRun() == null ? 0L : job.nextRun())
        .thenComparingLong(ScheduledJob::createdAt);

    private final JobStore store;
    private final CalendarSyncService calendar;
    private final JobExecutor executor;
    private final Clock clock;
    private final ZoneId zone;
    private final Duration storeRetry;
    private final ScheduledThreadPoolExecutor timers;
    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, Timer> handles = new ConcurrentHashMap<>();
    private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong generations = new AtomicLong();

    private boolean storeDirty;
    private ScheduledFuture<?> storeRetryHandle;

    public JobScheduler(JobStore store, CalendarSyncService calendar, JobExecutor executor, Clock clock) {
        this(store, calendar, executor, clock, ZoneId.systemDefault(), DEFAULT_WORKER_THREADS, DEFAULT_STORE_RETRY);
    }

    public JobScheduler(
        JobStore store,
        CalendarSyncService calendar,
        JobExecutor executor,
        Clock clock,
        ZoneId zone,
        int workerThreads,
        Duration storeRetry
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.calendar = calendar;
        this.executor = executor == null ? JobExecutor.NOOP : executor;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = zone == null ? ZoneId.systemDefault() : zone;
        this.storeRetry = storeRetry == null ? DEFAULT_STORE_RETRY : storeRetry;
        this.timers = new ScheduledThreadPoolExecutor(Math.max(1, workerThreads), new TimerThreadFactory());
        this.timers.setRemoveOnCancelPolicy(true);
    }

    /**
     * Registers a listener for job events. Running the returned handle unsubscribes it.
     */
    public Runnable subscribe(JobEventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public synchronized void load() throws IOException {
        List<ScheduledJob> loaded = store.load();
        stopAll();
        jobs.clear();
        for (ScheduledJob job : loaded) {
            jobs.put(job.id(), job);
        }
        for (ScheduledJob job : loaded) {
            if (job.enabled()) {
                startJob(job);
            }
        }
        LOG.info("Loaded {} scheduled jobs, {} armed", loaded.size(), handles.size());
    }

    public ScheduledJob addJob(JobRequest request) throws IOException {
        validate(request);
        long now = now();
        boolean oneShot = request.executeAt() != null;
        ScheduledJob job = new ScheduledJob(
            newId(now),
            request.name().trim(),
            request.description(),
            oneShot ? null : request.cronExpression().trim(),
            request.executeAt(),
            oneShot,
            oneShot && request.deleteAfterRun() == null ? Boolean.TRUE : request.deleteAfterRun(),
            request.type(),
            request.enabled(),
            request.payload(),
            null,
            null,
            0,
            now,
            now,
            request.calendarSync(),
            request.timezone()
        );

        synchronized (this) {
            jobs.put(job.id(), job);
            if (job.enabled()) {
                startJob(job);
            }
            persist();
            job = jobs.getOrDefault(job.id(), job);
        }
        LOG.info("Added job {} ({}, {})", job.id(), job.name(), describeSchedule(job));

        if (calendar != null && job.enabled() && job.nextRun() != null
            && calendar.shouldSyncToCalendar(job) && calendar.isConnected()) {
            CalendarSyncResult result = calendar.createEvent(job);
            ScheduledJob synced = applyCalendarResult(job, result, false);
            if (synced != null) {
                synchronized (this) {
                    persist();
                }
                job = synced;
            }
        }
        return job;
    }

    public Optional<ScheduledJob> updateJob(String id, JobPatch patch) throws IOException {
        Objects.requireNonNull(patch, "patch must not be null");
        ScheduledJob updated;
        synchronized (this) {
            ScheduledJob current = jobs.get(id);
            if (current == null) {
                return Optional.empty();
            }
            updated = current.apply(patch, now());
            jobs.put(id, updated);
            if (patch.touchesSchedule()) {
                cancelTimer(id);
                if (updated.enabled()) {
                    startJob(updated);
                } else {
                    jobs.put(id, updated.withNextRun(null));
                }
            }
            persist();
            updated = jobs.get(id);
        }

        if (calendar != null && patch.touchesSchedule()) {
            boolean keepEvent = updated.enabled() && updated.nextRun() != null && calendar.shouldSyncToCalendar(updated);
            CalendarSyncResult result = null;
            if (keepEvent && (updated.eventId() != null || calendar.isConnected())) {
                result = calendar.updateEvent(updated);
            } else if (!keepEvent && updated.eventId() != null) {
                result = calendar.deleteEvent(updated);
            }
            ScheduledJob synced = result == null ? null : applyCalendarResult(updated, result, false);
            if (synced != null) {
                synchronized (this) {
                    persist();
                }
                updated = synced;
            }
        }
        return Optional.of(updated);
    }

    public boolean removeJob(String id) throws IOException {
        ScheduledJob removed;
        synchronized (this) {
            removed = jobs.remove(id);
            if (removed == null) {
                return false;
            }
            cancelTimer(id);
        }
        if (calendar != null && removed.eventId() != null) {
            calendar.deleteEvent(removed);
        }
        synchronized (this) {
            persist();
        }
        LOG.info("Removed job {} ({})", id, removed.name());
        return true;
    }

    public boolean enableJob(String id) throws IOException {
        return updateJob(id, JobPatch.toggle(true)).isPresent();
    }

    public boolean disableJob(String id) throws IOException {
        return updateJob(id, JobPatch.toggle(false)).isPresent();
    }

    public Optional<ScheduledJob> getJob(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(jobs.get(id));
    }

    public List<ScheduledJob> listJobs(JobFilter filter) {
        JobFilter effective = filter == null ? JobFilter.all() : filter;
        return jobs.values().stream()
            .filter(effective::matches)
            .sorted(BY_NEXT_RUN)
            .toList();
    }

    public boolean isArmed(String id) {
        return handles.containsKey(id);
    }

    /**
     * Fires a job immediately, outside its schedule. Unlike timer firings, a failing callback is
     * rethrown to the caller, and no calendar reconciliation happens.
     */
    public boolean runNow(String id) throws IOException, JobExecutionException {
        ScheduledJob fired;
        synchronized (this) {
            ScheduledJob current = jobs.get(id);
            if (current == null) {
                return false;
            }
            fired = current.fired(now());
            jobs.put(id, fired);
        }
        emit(JobEvent.execute(fired, now()));

        Exception failure = null;
        try {
            executor.execute(fired);
        } catch (Exception e) {
            failure = e;
        }

        synchronized (this) {
            persist();
        }
        if (failure != null) {
            LOG.warn("Manual run of job {} failed: {}", id, failure.getMessage());
            throw new JobExecutionException(id, failure);
        }
        return true;
    }

    public synchronized void stopAll() {
        for (Timer timer : handles.values()) {
            timer.future().cancel(false);
        }
        handles.clear();
    }

    @Override
    public void close() {
        synchronized (this) {
            stopAll();
            if (storeRetryHandle != null) {
                storeRetryHandle.cancel(false);
                storeRetryHandle = null;
            }
        }
        timers.shutdownNow();
    }

    // Timer-driven firing path, also used by tests to simulate a firing.
    void executeJob(String id) {
        ScheduledJob fired;
        synchronized (this) {
            ScheduledJob current = jobs.get(id);
            if (current == null) {
                return;
            }
            fired = current.fired(now());
            if (fired.recurring() && fired.enabled()) {
                jobs.put(id, fired);
                startJob(fired);
                fired = jobs.get(id);
            } else {
                cancelTimer(id);
                if (fired.oneShot()) {
                    fired = fired.withNextRun(null);
                }
                jobs.put(id, fired);
            }
        }
        LOG.debug("Executing job {} (run {})", id, fired.runCount());
        emit(JobEvent.execute(fired, now()));

        try {
            executor.execute(fired);
        } catch (Exception e) {
            LOG.error("Error executing job {}: {}", id, e.getMessage(), e);
            emit(JobEvent.error(fired, e, now()));
        }

        if (calendar != null && calendar.shouldSyncToCalendar(fired)) {
            CalendarSyncResult result = calendar.syncAfterRun(fired);
            ScheduledJob synced = applyCalendarResult(fired, result, true);
            if (synced != null) {
                emit(JobEvent.calendarSynced(synced, result, now()));
            }
        }

        ScheduledJob purged = null;
        synchronized (this) {
            ScheduledJob current = jobs.get(id);
            if (current != null && current.oneShot()) {
                if (current.purgesAfterRun()) {
                    jobs.remove(id);
                    cancelTimer(id);
                    purged = current;
                } else {
                    jobs.put(id, current.withEnabled(false, now()).withNextRun(null));
                }
            }
            persistQuietly();
        }
        if (purged != null) {
            LOG.info("One-shot job {} completed and was removed", id);
            if (calendar != null && purged.eventId() != null) {
                calendar.deleteEvent(purged);
            }
        }
    }

    private void onTimer(String id, long generation) {
        synchronized (this) {
            Timer timer = handles.get(id);
            if (timer == null || timer.generation() != generation) {
                return;
            }
            handles.remove(id);
            ScheduledJob current = jobs.get(id);
            if (current == null || !current.enabled()) {
                return;
            }
        }
        try {
            executeJob(id);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while firing job {}", id, e);
        }
    }

    // Caller holds the monitor.
    private void startJob(ScheduledJob job) {
        cancelTimer(job.id());
        long now = now();

        if (job.oneShot()) {
            if (job.executeAt() == null) {
                LOG.warn("One-shot job {} has no executeAt, leaving it unscheduled", job.id());
                jobs.put(job.id(), job.withNextRun(null));
                return;
            }
            jobs.put(job.id(), job.withNextRun(job.executeAt()));
            arm(job.id(), Math.max(0L, job.executeAt() - now));
            return;
        }

        CronSchedule schedule;
        try {
            schedule = CronSchedule.parse(job.cronExpression());
        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid cron expression for job {}: {} ({})", job.id(), job.cronExpression(), e.getMessage());
            jobs.put(job.id(), job.withNextRun(null));
            return;
        }

        Optional<Instant> next = schedule.nextAfter(Instant.ofEpochMilli(now), zone);
        if (next.isEmpty()) {
            LOG.warn("Cron expression for job {} has no upcoming execution: {}", job.id(), job.cronExpression());
            jobs.put(job.id(), job.withNextRun(null));
            return;
        }
        long nextRun = next.get().toEpochMilli();
        jobs.put(job.id(), job.withNextRun(nextRun));
        arm(job.id(), Math.max(0L, nextRun - now));
    }

    private void arm(String id, long delayMs) {
        long generation = generations.incrementAndGet();
        ScheduledFuture<?> future = timers.schedule(() -> onTimer(id, generation), delayMs, TimeUnit.MILLISECONDS);
        handles.put(id, new Timer(generation, future));
    }

    private void cancelTimer(String id) {
        Timer timer = handles.remove(id);
        if (timer != null) {
            timer.future().cancel(false);
        }
    }

    private ScheduledJob applyCalendarResult(ScheduledJob job, CalendarSyncResult result, boolean staleDeleted) {
        ScheduledJob synced;
        synchronized (this) {
            ScheduledJob current = jobs.get(job.id());
            if (current != null) {
                CalendarSync base = current.calendarSync() == null ? CalendarSync.enabledByDefault() : current.calendarSync();
                long now = now();
                CalendarSync updated;
                if (result.success()) {
                    updated = result.eventId() == null ? base.cleared(now) : base.synced(result.eventId(), result.calendarId(), now);
                } else {
                    updated = (staleDeleted ? base.cleared(now) : base).failed(result.error(), now);
                }
                synced = current.withCalendarSync(updated);
                jobs.put(synced.id(), synced);
                return synced;
            }
        }
        if (result.eventId() != null && calendar != null) {
            LOG.info("Job {} was removed while its calendar event was being created, deleting event {}", job.id(), result.eventId());
            CalendarSync orphan = CalendarSync.enabledByDefault().synced(result.eventId(), result.calendarId(), now());
            calendar.deleteEvent(job.withCalendarSync(orphan));
        }
        return null;
    }

    // Caller holds the monitor.
    private void persist() throws IOException {
        List<ScheduledJob> snapshot = new ArrayList<>(jobs.values());
        snapshot.sort(Comparator.comparingLong(ScheduledJob::createdAt).thenComparing(ScheduledJob::id));
        try {
            store.save(snapshot);
            storeDirty = false;
        } catch (IOException e) {
            markStoreDirty();
            throw e;
        }
    }

    // Caller holds the monitor.
    private void persistQuietly() {
        try {
            persist();
        } catch (IOException e) {
            LOG.error("Failed to persist scheduled jobs, will retry in {}s: {}", storeRetry.toSeconds(), e.getMessage());
        }
    }

    private void markStoreDirty() {
        storeDirty = true;
        if (storeRetryHandle == null && !timers.isShutdown()) {
            long delay = Math.max(1L, storeRetry.toMillis());
            storeRetryHandle = timers.scheduleWithFixedDelay(this::retryPersist, delay, delay, TimeUnit.MILLISECONDS);
        }
    }

    private synchronized void retryPersist() {
        if (storeDirty) {
            persistQuietly();
        }
        if (!storeDirty && storeRetryHandle != null) {
            storeRetryHandle.cancel(false);
            storeRetryHandle = null;
            LOG.info("Scheduled jobs persisted after earlier failure");
        }
    }

    private static void validate(JobRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("job name is required");
        }
        boolean hasCron = request.cronExpression() != null && !request.cronExpression().isBlank();
        boolean hasExecuteAt = request.executeAt() != null;
        if (hasCron == hasExecuteAt) {
            throw new IllegalArgumentException("exactly one of cronExpression or executeAt is required");
        }
        if (request.oneShot() != hasExecuteAt) {
            throw new IllegalArgumentException(request.oneShot()
                ? "one-shot jobs require executeAt"
                : "recurring jobs require cronExpression");
        }
    }

    private void emit(JobEvent event) {
        for (JobEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Listener failed on {} for job {}: {}", event.type().topic(), event.jobId(), e.getMessage());
            }
        }
    }

    private static String describeSchedule(ScheduledJob job) {
        return job.oneShot() ? "once at " + Instant.ofEpochMilli(job.executeAt()) : "cron " + job.cronExpression();
    }

    private static String newId(long now) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "job_" + now + "_" + suffix;
    }

    private long now() {
        return clock.millis();
    }

    private record Timer(long generation, ScheduledFuture<?> future) {
    }

    private static final class TimerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "kairos-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
