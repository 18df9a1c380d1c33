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
 * Where a message goes: privately to the recipient, or into a shared channel
 * with the recipient mentioned inline.
 */
public record DeliveryTarget(TransportTarget recipient, TransportTarget channel) {

    public DeliveryTarget {
        Objects.requireNonNull(recipient, "recipient");
    }

    public static DeliveryTarget direct(TransportTarget recipient) {
        return new DeliveryTarget(recipient, null);
    }

    public boolean isDirect() {
        return channel == null || channel.direct() || channel.id().equals(recipient.id());
    }
}
