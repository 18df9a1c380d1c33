package me.golemcore.courier.domain.model;

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

import java.util.Objects;

/**
 * Identity of a live timer registration. Joins a {@link ScheduleRecord} to its
 * entry in the recurring job scheduler.
 *
 * <p>
 * Equality is on the structured key, so {@code ("U1", "2")} and
 * {@code ("U", "12")} are different jobs even though their legacy string forms
 * coincide.
 */
public final class JobId {

    private final RecordKey key;

    public JobId(RecordKey key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public static JobId of(String owner, String createdAt) {
        return new JobId(new RecordKey(owner, createdAt));
    }

    public RecordKey key() {
        return key;
    }

    /**
     * Legacy concatenated form ({@code owner + createdAt}), used in logs.
     */
    public String asLegacyString() {
        return key.owner() + key.createdAt();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobId other)) {
            return false;
        }
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return asLegacyString();
    }
}
