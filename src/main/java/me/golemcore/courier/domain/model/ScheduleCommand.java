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
 * A parsed user command. Each variant carries exactly the arguments its
 * operation needs.
 */
public sealed interface ScheduleCommand {

    /**
     * Register a recurring message to the single mentioned user.
     */
    record Add(String mention, int intervalSeconds, String body) implements ScheduleCommand {
    }

    /**
     * Change the interval of an existing message.
     */
    record Update(String timestamp, int intervalSeconds) implements ScheduleCommand {
    }

    record Delete(String timestamp) implements ScheduleCommand {
    }

    record Pause(String timestamp) implements ScheduleCommand {
    }

    record Unpause(String timestamp) implements ScheduleCommand {
    }

    record ListSchedules() implements ScheduleCommand {
    }

    record Help() implements ScheduleCommand {
    }
}
