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
 * Attributes of a {@link ScheduleRecord} that a conditional update may target.
 * Values are exchanged in their persisted string form.
 */
public enum ScheduleField {

    INTERVAL("interval") {
        @Override
        public String read(ScheduleRecord record) {
            return Integer.toString(record.getIntervalSeconds());
        }

        @Override
        public void write(ScheduleRecord record, String value) {
            record.setIntervalSeconds(parseInterval(value));
        }

        @Override
        public String normalize(String value) {
            return Integer.toString(parseInterval(value));
        }
    },

    STATUS("status") {
        @Override
        public String read(ScheduleRecord record) {
            return record.getStatus().getValue();
        }

        @Override
        public void write(ScheduleRecord record, String value) {
            record.setStatus(ScheduleStatus.fromValue(value));
        }

        @Override
        public String normalize(String value) {
            return ScheduleStatus.fromValue(value).getValue();
        }
    };

    private final String attributeName;

    ScheduleField(String attributeName) {
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }

    public abstract String read(ScheduleRecord record);

    public abstract void write(ScheduleRecord record, String value);

    /**
     * Canonical persisted form of a value, used to compare against the current
     * one.
     *
     * @throws IllegalArgumentException
     *             if the value is not valid for this field
     */
    public abstract String normalize(String value);

    static int parseInterval(String value) {
        int interval;
        try {
            interval = Integer.parseInt(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Invalid interval: " + value, e);
        }
        if (interval < 1) {
            throw new IllegalArgumentException("Interval must be at least 1 second: " + value);
        }
        return interval;
    }
}
