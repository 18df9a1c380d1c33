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

import java.util.List;
import java.util.Objects;

/**
 * Who issued a command and from where.
 *
 * @param owner
 *            issuing user; owner of the records the command touches
 * @param chat
 *            chat the command was sent in
 * @param mentions
 *            users the transport resolved from mentions in the command text
 */
public record CommandContext(TransportTarget owner, TransportTarget chat, List<TransportTarget> mentions) {

    public CommandContext {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(chat, "chat");
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
    }

    public String ownerId() {
        return owner.id();
    }

    /**
     * The shared channel the command came from, or {@code null} for a private
     * chat.
     */
    public TransportTarget sharedChannel() {
        return chat.direct() ? null : chat;
    }

    /**
     * Replies go back to the originating chat, mentioning the issuer when that
     * chat is shared.
     */
    public DeliveryTarget replyTarget() {
        return new DeliveryTarget(owner, sharedChannel());
    }
}
