package me.golemcore.courier.adapter.outbound.storage;

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

import me.golemcore.courier.domain.exception.DuplicateKeyException;
import me.golemcore.courier.domain.exception.StorageUnavailableException;
import me.golemcore.courier.domain.model.RecordKey;
import me.golemcore.courier.domain.model.ScheduleField;
import me.golemcore.courier.domain.model.ScheduleRecord;
import me.golemcore.courier.domain.model.ScheduleStatus;
import me.golemcore.courier.infrastructure.config.BotProperties;
import me.golemcore.courier.port.outbound.ScheduleStorePort;
import me.golemcore.courier.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schedule table persisted as JSON through {@link StoragePort}.
 *
 * <p>
 * Each owner is a partition stored as one file,
 * {@code <table>/<owner>.json}, holding that owner's rows ordered by
 * {@code createdAt}. Writes to a partition are serialized by a per-owner lock
 * and replace the file atomically, so conditional updates see a consistent
 * row.
 *
 * <p>
 * Rows are never removed; a deleted row keeps its key so that the key cannot
 * be reused.
 */
@Component
@Slf4j
public class JsonScheduleStoreAdapter implements ScheduleStorePort {

    private static final String PARTITION_SUFFIX = ".json";
    private static final TypeReference<List<ScheduleRecord>> RECORD_LIST_TYPE_REF = new TypeReference<>() {
    };
    // Rows without a key sort last instead of failing the whole partition.
    private static final Comparator<ScheduleRecord> BY_CREATED_AT = Comparator.comparing(
            ScheduleRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final String tableName;
    private final int scanPageSize;
    private final Map<String, Object> partitionLocks = new ConcurrentHashMap<>();

    public JsonScheduleStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper, BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.tableName = properties.getStorage().getTableName();
        this.scanPageSize = Math.max(1, properties.getStorage().getScanPageSize());
    }

    @PostConstruct
    public void init() {
        try {
            storagePort.ensureDirectory(tableName).join();
            log.info("[Store] Schedule table ready: {}", tableName);
        } catch (CompletionException e) {
            throw new StorageUnavailableException("Failed to provision table " + tableName, e);
        }
    }

    @Override
    public void create(ScheduleRecord record) {
        Objects.requireNonNull(record, "record");
        RecordKey key = record.getKey();
        if (record.getIntervalSeconds() < 1) {
            throw new IllegalArgumentException("Interval must be at least 1 second: " + record.getIntervalSeconds());
        }

        synchronized (lockFor(key.owner())) {
            List<ScheduleRecord> rows = loadPartition(key.owner());
            if (findRow(rows, key.createdAt()).isPresent()) {
                throw new DuplicateKeyException(key.owner(), key.createdAt());
            }
            ScheduleRecord row = record.toBuilder().status(ScheduleStatus.ACTIVE).build();
            rows.add(row);
            savePartition(key.owner(), rows);
        }
        log.info("[Store] Created {} -> {} every {}s", key, record.getRecipientName(), record.getIntervalSeconds());
    }

    @Override
    public boolean setField(RecordKey key, ScheduleField field, String value) {
        String normalized = field.normalize(value);

        synchronized (lockFor(key.owner())) {
            List<ScheduleRecord> rows = loadPartition(key.owner());
            Optional<ScheduleRecord> row = findRow(rows, key.createdAt());
            if (row.isEmpty() || row.get().isDeleted()) {
                log.debug("[Store] No live row at {}, {} not set", key, field.getAttributeName());
                return false;
            }
            ScheduleRecord current = row.get();
            if (normalized.equals(field.read(current))) {
                log.debug("[Store] {} of {} already {}", field.getAttributeName(), key, normalized);
                return false;
            }
            field.write(current, normalized);
            savePartition(key.owner(), rows);
        }
        log.info("[Store] Set {} of {} to {}", field.getAttributeName(), key, normalized);
        return true;
    }

    @Override
    public List<ScheduleRecord> lookupByOwner(String owner) {
        return loadPartition(owner).stream()
                .filter(r -> !r.isDeleted() && r.getCreatedAt() != null)
                .sorted(BY_CREATED_AT)
                .toList();
    }

    @Override
    public Iterable<ScheduleRecord> scanAll() {
        return PagedScan::new;
    }

    private Object lockFor(String owner) {
        return partitionLocks.computeIfAbsent(owner, o -> new Object());
    }

    private static Optional<ScheduleRecord> findRow(List<ScheduleRecord> rows, String createdAt) {
        return rows.stream()
                .filter(r -> createdAt.equals(r.getCreatedAt()))
                .findFirst();
    }

    private List<ScheduleRecord> loadPartition(String owner) {
        return readPartitionFile(partitionFile(owner));
    }

    private List<ScheduleRecord> readPartitionFile(String fileName) {
        String json;
        try {
            json = storagePort.getText(tableName, fileName).join();
        } catch (CompletionException e) {
            throw new StorageUnavailableException("Failed to read " + tableName + "/" + fileName, e);
        }
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, RECORD_LIST_TYPE_REF));
        } catch (JsonProcessingException e) {
            throw new StorageUnavailableException("Corrupt partition " + tableName + "/" + fileName, e);
        }
    }

    private void savePartition(String owner, List<ScheduleRecord> rows) {
        rows.sort(BY_CREATED_AT);
        try {
            String json = objectMapper.writeValueAsString(rows);
            storagePort.putTextAtomic(tableName, partitionFile(owner), json).join();
        } catch (JsonProcessingException | CompletionException e) {
            throw new StorageUnavailableException("Failed to write partition of " + owner, e);
        }
    }

    private static String partitionFile(String owner) {
        return URLEncoder.encode(owner, StandardCharsets.UTF_8) + PARTITION_SUFFIX;
    }

    /**
     * One pass over the table. Partition names are listed when the scan starts;
     * partitions are then read {@code scanPageSize} at a time as the caller
     * advances.
     */
    private final class PagedScan implements Iterator<ScheduleRecord> {

        private final Deque<ScheduleRecord> buffer = new ArrayDeque<>();
        private List<String> partitions;
        private int nextPartition;

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && hasMorePartitions()) {
                readPage();
            }
            return !buffer.isEmpty();
        }

        @Override
        public ScheduleRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private boolean hasMorePartitions() {
            if (partitions == null) {
                partitions = listPartitions();
                log.debug("[Store] Scan started over {} partitions", partitions.size());
            }
            return nextPartition < partitions.size();
        }

        private void readPage() {
            int end = Math.min(nextPartition + scanPageSize, partitions.size());
            for (; nextPartition < end; nextPartition++) {
                readPartitionFile(partitions.get(nextPartition)).stream()
                        .filter(r -> !r.isDeleted())
                        .sorted(BY_CREATED_AT)
                        .forEach(buffer::add);
            }
        }

        private List<String> listPartitions() {
            try {
                return storagePort.listObjects(tableName, null).join().stream()
                        .filter(name -> name.endsWith(PARTITION_SUFFIX))
                        .toList();
            } catch (CompletionException e) {
                throw new StorageUnavailableException("Failed to list " + tableName, e);
            }
        }
    }
}
