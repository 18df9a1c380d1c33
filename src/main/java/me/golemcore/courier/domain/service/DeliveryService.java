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

import me.golemcore.courier.domain.model.DeliveryTarget;
import me.golemcore.courier.domain.model.JobId;
import me.golemcore.courier.domain.model.ScheduleRecord;
import me.golemcore.courier.domain.model.TransportTarget;
import me.golemcore.courier.port.outbound.TransportPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletionException;

/**
 * Invoked by fired timers on the delivery executor: hands the message body to
 * the transport and waits for the send. A failed send is logged and the timer
 * keeps running.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeliveryService {

    private final TransportPort transportPort;

    /**
     * Timer callback delivering {@code body} to {@code target}.
     */
    public Runnable deliveryTask(JobId jobId, DeliveryTarget target, String body) {
        return () -> deliver(jobId, target, body);
    }

    public void deliver(JobId jobId, DeliveryTarget target, String body) {
        String via = target.isDirect() ? "direct message" : "channel " + target.channel().name();
        log.info("[Delivery] Sending {} to {} via {}", jobId, target.recipient().name(), via);
        try {
            transportPort.send(target, body).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Delivery] Failed to deliver {}: {}", jobId, cause.getMessage(), cause);
        } catch (RuntimeException e) {
            log.error("[Delivery] Failed to deliver {}: {}", jobId, e.getMessage(), e);
        }
    }

    /**
     * Resolve a stored record's recipient and, for channel deliveries, its
     * channel.
     *
     * @throws me.golemcore.courier.domain.exception.RecipientUnresolvedException
     *             if either cannot be resolved
     */
    public DeliveryTarget resolveTarget(ScheduleRecord record) {
        TransportTarget recipient = transportPort.resolveUser(record.getRecipientId());
        if (!record.hasSharedChannel()) {
            return DeliveryTarget.direct(recipient);
        }
        TransportTarget channel = transportPort.resolveChannel(record.getChannelId());
        return new DeliveryTarget(recipient, channel);
    }
}
