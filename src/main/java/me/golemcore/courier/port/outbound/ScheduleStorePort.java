package me.golemcore.courier.port.outbound;

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

import me.golemcore.courier.domain.model.RecordKey;
import me.golemcore.courier.domain.model.ScheduleField;
import me.golemcore.courier.domain.model.ScheduleRecord;
import me.golemcore.courier.domain.model.ScheduleStatus;

import java.util.List;

/**
 * Durable repository of {@link ScheduleRecord}s keyed by
 * {@code (owner, createdAt)}. The store is the only writer of durable schedule
 * state.
 *
 * <p>
 * Records are never physically removed: deletion sets their status to
 * {@link ScheduleStatus#DELETED}, and deleted records are invisible to every
 * read. Implementations must be safe for concurrent use; writes to the same key
 * are serialized.
 *
 * <p>
 * Any operation may throw
 * {@link me.golemcore.courier.domain.exception.StorageUnavailableException} when
 * the backing store cannot be reached.
 */
public interface ScheduleStorePort {

    /**
     * Persist a new record with status {@link ScheduleStatus#ACTIVE}.
     *
     * @throws me.golemcore.courier.domain.exception.DuplicateKeyException
     *             if a record with the same key already exists, deleted or not
     */
    void create(ScheduleRecord record);

    /**
     * Conditionally set a single attribute. Applies only if a non-deleted record
     * exists at {@code key} and the attribute's current value differs from
     * {@code value}.
     *
     * @return {@code true} if the record changed; {@code false} if it was
     *         missing, deleted, or already held the value
     * @throws IllegalArgumentException
     *             if {@code value} is not valid for {@code field}
     */
    boolean setField(RecordKey key, ScheduleField field, String value);

    /**
     * Mark a record deleted.
     *
     * @return {@code true} if a live record was deleted, {@code false} if it was
     *         missing or already deleted
     */
    default boolean softDelete(RecordKey key) {
        return setField(key, ScheduleField.STATUS, ScheduleStatus.DELETED.getValue());
    }

    /**
     * All non-deleted records of one owner, ordered by {@code createdAt}.
     */
    List<ScheduleRecord> lookupByOwner(String owner);

    /**
     * All non-deleted records across all owners, read lazily page by page. Every
     * call to {@link Iterable#iterator()} starts a fresh scan from the
     * beginning; no resume cursor is exposed.
     */
    Iterable<ScheduleRecord> scanAll();
}
