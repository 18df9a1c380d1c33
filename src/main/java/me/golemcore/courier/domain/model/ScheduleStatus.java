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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a scheduled message. {@link #DELETED} is terminal and
 * excluded from every read.
 */
public enum ScheduleStatus {

    ACTIVE("Active"), PAUSED("Paused"), DELETED("Deleted");

    private static final String LEGACY_PAUSED = "Pause";

    private final String value;

    ScheduleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a persisted status value.
     *
     * @throws IllegalArgumentException
     *             if the value is unknown
     */
    @JsonCreator
    public static ScheduleStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (LEGACY_PAUSED.equalsIgnoreCase(value)) {
            return PAUSED;
        }
        for (ScheduleStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown schedule status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
