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

import me.golemcore.courier.domain.model.JobId;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-job mutual exclusion for operations that touch both the schedule store
 * and the scheduler. Different jobs never contend.
 *
 * <p>
 * An entry lives only while some thread holds or waits for its lock, so ids
 * that are never used again do not accumulate.
 */
@Component
public class JobLocks {

    private final Map<JobId, LockEntry> locks = new ConcurrentHashMap<>();

    public <T> T withLock(JobId jobId, Supplier<T> action) {
        LockEntry entry = acquire(jobId);
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            release(jobId);
        }
    }

    public void withLock(JobId jobId, Runnable action) {
        withLock(jobId, () -> {
            action.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }

    private LockEntry acquire(JobId jobId) {
        return locks.compute(jobId, (id, entry) -> {
            LockEntry current = entry != null ? entry : new LockEntry();
            current.users++;
            return current;
        });
    }

    private void release(JobId jobId) {
        locks.computeIfPresent(jobId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    // users is only read and written inside compute for its id.
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
