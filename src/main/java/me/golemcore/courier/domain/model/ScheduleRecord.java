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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One scheduled message: who created it, who receives it, how often, and
 * whether it is still live. Persisted as a row keyed by
 * {@code (owner, createdAt)}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRecord {

    private String owner;
    private String createdAt;
    private String recipientId;
    private String recipientName;
    private String channelId;

    @JsonProperty("interval")
    private int intervalSeconds;

    @JsonProperty("message")
    private String body;

    @Builder.Default
    private ScheduleStatus status = ScheduleStatus.ACTIVE;

    @JsonIgnore
    public RecordKey getKey() {
        return new RecordKey(owner, createdAt);
    }

    @JsonIgnore
    public JobId getJobId() {
        return getKey().jobId();
    }

    @JsonIgnore
    public boolean isDeleted() {
        return status == ScheduleStatus.DELETED;
    }

    /**
     * Whether delivery goes to a shared channel with a mention rather than a
     * private message.
     */
    @JsonIgnore
    public boolean hasSharedChannel() {
        return channelId != null && !channelId.isBlank() && !channelId.equals(recipientId);
    }
}
