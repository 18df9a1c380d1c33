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

/**
 * A user or channel resolved by the transport.
 *
 * @param id
 *            transport identifier
 * @param name
 *            display name
 * @param mention
 *            inline mention markup for this target, used when it is mentioned
 *            in a shared channel
 * @param direct
 *            whether this target is a private (one-to-one) conversation
 */
public record TransportTarget(String id, String name, String mention, boolean direct) {

    public static TransportTarget user(String id, String name, String mention) {
        return new TransportTarget(id, name, mention, true);
    }

    public static TransportTarget channel(String id, String name) {
        return new TransportTarget(id, name, name, false);
    }
}
