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

import me.golemcore.courier.domain.exception.RecipientUnresolvedException;
import me.golemcore.courier.domain.exception.StorageUnavailableException;
import me.golemcore.courier.domain.model.DeliveryTarget;
import me.golemcore.courier.domain.model.JobId;
import me.golemcore.courier.domain.model.ScheduleRecord;
import me.golemcore.courier.domain.model.ScheduleStatus;
import me.golemcore.courier.domain.model.TransportReadyEvent;
import me.golemcore.courier.port.outbound.ScheduleStorePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rebuilds the in-memory timers from the schedule store once the transport is
 * ready.
 *
 * <p>
 * Every non-deleted record gets a timer with its stored interval; paused
 * records get a paused timer. A record whose recipient or channel can no longer
 * be resolved, or that fails to restore for any other reason, is skipped with a
 * warning and left untouched in the store. A storage failure during the scan
 * aborts reconciliation and is rethrown.
 *
 * <p>
 * Runs at most once per process. A later readiness signal (for example after a
 * transport reconnect) is ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleReconciliationService {

    private final ScheduleStorePort store;
    private final RecurringJobScheduler scheduler;
    private final DeliveryService deliveryService;
    private final JobLocks jobLocks;

    private final AtomicBoolean reconciled = new AtomicBoolean(false);

    @EventListener
    public void onTransportReady(TransportReadyEvent event) {
        if (!reconciled.compareAndSet(false, true)) {
            log.debug("[Reconcile] Already reconciled, ignoring readiness of {}", event.channelType());
            return;
        }
        log.info("[Reconcile] Transport {} ready, restoring schedules", event.channelType());
        try {
            Report report = reconcile();
            log.info("[Reconcile] Restored {} schedules ({} paused), skipped {}",
                    report.armed() + report.paused(), report.paused(), report.skipped());
        } catch (RuntimeException e) {
            reconciled.set(false);
            log.error("[Reconcile] Failed to restore schedules", e);
            throw e;
        }
    }

    public boolean isReconciled() {
        return reconciled.get();
    }

    /**
     * Scan the store and register a timer for every live record.
     *
     * @throws me.golemcore.courier.domain.exception.StorageUnavailableException
     *             if the scan cannot be completed
     */
    Report reconcile() {
        int armed = 0;
        int paused = 0;
        int skipped = 0;
        for (ScheduleRecord record : store.scanAll()) {
            if (record.isDeleted()) {
                continue;
            }
            if (restore(record)) {
                if (record.getStatus() == ScheduleStatus.PAUSED) {
                    paused++;
                } else {
                    armed++;
                }
            } else {
                skipped++;
            }
        }
        return new Report(armed, paused, skipped);
    }

    private boolean restore(ScheduleRecord record) {
        if (record.getOwner() == null || record.getCreatedAt() == null) {
            log.warn("[Reconcile] Skipping record without key: {}", record);
            return false;
        }
        JobId jobId = record.getJobId();
        try {
            DeliveryTarget target = deliveryService.resolveTarget(record);
            jobLocks.withLock(jobId, () -> {
                scheduler.schedule(jobId, record.getIntervalSeconds(),
                        deliveryService.deliveryTask(jobId, target, record.getBody()));
                if (record.getStatus() == ScheduleStatus.PAUSED) {
                    scheduler.pause(jobId);
                }
            });
            log.debug("[Reconcile] Restored {} every {}s ({})", jobId, record.getIntervalSeconds(),
                    record.getStatus());
            return true;
        } catch (RecipientUnresolvedException e) {
            log.warn("[Reconcile] Skipping {}: {}", jobId, e.getMessage());
            return false;
        } catch (IllegalArgumentException e) {
            log.warn("[Reconcile] Skipping {} with invalid data: {}", jobId, e.getMessage());
            return false;
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Reconcile] Skipping {} after unexpected failure: {}", jobId, e.toString());
            return false;
        }
    }

    record Report(int armed, int paused, int skipped) {
    }
}
