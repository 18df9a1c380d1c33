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

import me.golemcore.courier.domain.model.ScheduleRecord;

import java.util.List;

/**
 * Renders an owner's records as a monospace block.
 */
final class ScheduleListFormatter {

    private static final String FENCE = "```";
    private static final String RULE = "------------------------------";

    private ScheduleListFormatter() {
    }

    static String format(String title, List<ScheduleRecord> records) {
        StringBuilder sb = new StringBuilder();
        sb.append(FENCE).append('\n');
        sb.append(title).append('\n');
        sb.append(RULE).append('\n');
        for (ScheduleRecord record : records) {
            sb.append(record.getCreatedAt()).append(' ')
                    .append(record.getStatus().getValue()).append(' ')
                    .append(record.getRecipientName())
                    .append(" (").append(record.getIntervalSeconds()).append("s): ")
                    .append(record.getBody()).append('\n');
        }
        sb.append(FENCE);
        return sb.toString();
    }
}
