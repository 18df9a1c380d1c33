package me.golemcore.courier.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.courier.domain.exception.JobNotFoundException;
import me.golemcore.courier.domain.model.JobId;
import me.golemcore.courier.domain.model.JobState;
import me.golemcore.courier.infrastructure.config.BotProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory registry of periodic timers keyed by {@link JobId}.
 *
 * <p>
 * Each job fires every {@code intervalSeconds}. Timer threads only hand the
 * callback to the delivery executor, so a slow callback never holds a timer
 * thread. A job has at most one callback in flight: a fire that finds the
 * previous run still going is skipped. The first fire happens one interval
 * after the job is armed; resuming a paused job restarts the interval without
 * catching up missed fires.
 *
 * <p>
 * Mutations of one job are serialized through
 * {@link ConcurrentHashMap#compute}; jobs with different ids never block each
 * other. The scheduler owns only live timers, never durable status.
 *
 * @see ScheduleReconciliationService
 * @see ScheduleCommandDispatcher
 */
@Component
@Slf4j
public class RecurringJobScheduler {

    private final ScheduledExecutorService executor;
    private final Executor deliveryExecutor;
    private final int shutdownTimeoutSeconds;
    private final Map<JobId, ScheduledJob> jobs = new ConcurrentHashMap<>();

    public RecurringJobScheduler(@Qualifier("timerExecutor") ScheduledExecutorService timerExecutor,
            @Qualifier("deliveryExecutor") Executor deliveryExecutor, BotProperties properties) {
        this.executor = timerExecutor;
        this.deliveryExecutor = deliveryExecutor;
        this.shutdownTimeoutSeconds = properties.getScheduler().getShutdownTimeoutSeconds();
    }

    /**
     * Register and arm a periodic job. An existing job with the same id is
     * cancelled and replaced.
     */
    public void schedule(JobId jobId, int intervalSeconds, Runnable callback) {
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(callback, "callback");
        requirePositive(intervalSeconds);

        jobs.compute(jobId, (id, existing) -> {
            if (existing != null) {
                existing.disarm();
                log.warn("[Scheduler] Replacing existing job {}", id);
            }
            ScheduledJob job = new ScheduledJob(id, callback, intervalSeconds);
            job.arm();
            return job;
        });
        log.info("[Scheduler] Scheduled {} every {}s", jobId, intervalSeconds);
    }

    /**
     * Change the firing period, keeping the armed/paused state. An armed job
     * restarts its interval from now.
     *
     * @throws JobNotFoundException
     *             if no job is registered under the id
     */
    public void reschedule(JobId jobId, int newIntervalSeconds) {
        requirePositive(newIntervalSeconds);
        jobs.compute(jobId, (id, job) -> {
            if (job == null) {
                throw new JobNotFoundException(id);
            }
            if (job.intervalSeconds == newIntervalSeconds) {
                log.debug("[Scheduler] {} already fires every {}s", id, newIntervalSeconds);
                return job;
            }
            job.intervalSeconds = newIntervalSeconds;
            if (job.state == JobState.ARMED) {
                job.disarm();
                job.arm();
            }
            log.info("[Scheduler] Rescheduled {} to every {}s ({})", id, newIntervalSeconds, job.state);
            return job;
        });
    }

    /**
     * Suspend firing without unregistering. Pausing a paused job is a no-op.
     *
     * @throws JobNotFoundException
     *             if no job is registered under the id
     */
    public void pause(JobId jobId) {
        jobs.compute(jobId, (id, job) -> {
            if (job == null) {
                throw new JobNotFoundException(id);
            }
            if (job.state == JobState.PAUSED) {
                log.debug("[Scheduler] {} already paused", id);
                return job;
            }
            job.disarm();
            job.state = JobState.PAUSED;
            log.info("[Scheduler] Paused {}", id);
            return job;
        });
    }

    /**
     * Re-arm a paused job. Resuming an armed job is a no-op.
     *
     * @throws JobNotFoundException
     *             if no job is registered under the id
     */
    public void resume(JobId jobId) {
        jobs.compute(jobId, (id, job) -> {
            if (job == null) {
                throw new JobNotFoundException(id);
            }
            if (job.state == JobState.ARMED) {
                log.debug("[Scheduler] {} already armed", id);
                return job;
            }
            job.arm();
            log.info("[Scheduler] Resumed {} every {}s", id, job.intervalSeconds);
            return job;
        });
    }

    /**
     * Unregister and stop a job. A fire already in progress is allowed to finish.
     * Removing an unknown job is a no-op.
     */
    public void remove(JobId jobId) {
        ScheduledJob removed = jobs.remove(jobId);
        if (removed == null) {
            log.debug("[Scheduler] Nothing to remove for {}", jobId);
            return;
        }
        removed.disarm();
        log.info("[Scheduler] Removed {}", jobId);
    }

    public Optional<JobState> getState(JobId jobId) {
        ScheduledJob job = jobs.get(jobId);
        return job != null ? Optional.of(job.state) : Optional.empty();
    }

    public Optional<Integer> getIntervalSeconds(JobId jobId) {
        ScheduledJob job = jobs.get(jobId);
        return job != null ? Optional.of(job.intervalSeconds) : Optional.empty();
    }

    public boolean contains(JobId jobId) {
        return jobs.containsKey(jobId);
    }

    public int size() {
        return jobs.size();
    }

    public long count(JobState state) {
        return jobs.values().stream()
                .filter(job -> job.state == state)
                .count();
    }

    @PreDestroy
    public void shutdown() {
        jobs.values().forEach(ScheduledJob::disarm);
        jobs.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Scheduler] Shut down");
    }

    private static void requirePositive(int intervalSeconds) {
        if (intervalSeconds < 1) {
            throw new IllegalArgumentException("Interval must be at least 1 second: " + intervalSeconds);
        }
    }

    /**
     * Mutable timer state. Only touched inside {@code jobs.compute} for its id,
     * or after it has been removed from the map.
     */
    private final class ScheduledJob {

        private final JobId id;
        private final Runnable callback;
        private final AtomicBoolean inFlight = new AtomicBoolean(false);
        private volatile int intervalSeconds;
        private volatile JobState state = JobState.PAUSED;
        private ScheduledFuture<?> future;

        private ScheduledJob(JobId id, Runnable callback, int intervalSeconds) {
            this.id = id;
            this.callback = callback;
            this.intervalSeconds = intervalSeconds;
        }

        private void arm() {
            future = executor.scheduleWithFixedDelay(this::fire, intervalSeconds, intervalSeconds,
                    TimeUnit.SECONDS);
            state = JobState.ARMED;
        }

        private void disarm() {
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }

        private void fire() {
            if (!inFlight.compareAndSet(false, true)) {
                log.warn("[Scheduler] Job {} is still running, skipping this fire", id);
                return;
            }
            try {
                deliveryExecutor.execute(this::runCallback);
            } catch (RejectedExecutionException e) {
                inFlight.set(false);
                log.error("[Scheduler] Job {} could not be started: {}", id, e.getMessage());
            }
        }

        private void runCallback() {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("[Scheduler] Job {} failed: {}", id, e.getMessage(), e);
            } finally {
                inFlight.set(false);
            }
        }
    }
}
