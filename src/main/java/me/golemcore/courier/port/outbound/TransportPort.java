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

import me.golemcore.courier.domain.model.DeliveryTarget;
import me.golemcore.courier.domain.model.TransportTarget;

import java.util.concurrent.CompletableFuture;

/**
 * Port to the chat platform that carries scheduled messages. Readiness is
 * signalled by publishing a
 * {@link me.golemcore.courier.domain.model.TransportReadyEvent}.
 */
public interface TransportPort {

    /**
     * Returns the transport type identifier (e.g., "telegram").
     */
    String getChannelType();

    /**
     * Connects to the platform, publishes readiness, then starts listening for
     * commands.
     */
    void start();

    /**
     * Stops listening and disconnects.
     */
    void stop();

    /**
     * Checks if the transport is currently connected and listening.
     */
    boolean isRunning();

    /**
     * Resolve a user by id.
     *
     * @throws me.golemcore.courier.domain.exception.RecipientUnresolvedException
     *             if the user cannot be found
     */
    TransportTarget resolveUser(String userId);

    /**
     * Resolve a chat or channel by id.
     *
     * @throws me.golemcore.courier.domain.exception.RecipientUnresolvedException
     *             if the channel cannot be found
     */
    TransportTarget resolveChannel(String channelId);

    /**
     * Send text to a target: privately to the recipient, or into the target's
     * channel prefixed with the recipient's mention.
     */
    CompletableFuture<Void> send(DeliveryTarget target, String text);
}
