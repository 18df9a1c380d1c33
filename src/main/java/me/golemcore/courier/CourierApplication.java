package me.golemcore.courier;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Courier.
 *
 * <p>
 * GolemCore Courier is a chat bot that delivers user-registered messages on a
 * fixed interval, either privately or by mentioning the recipient in a shared
 * channel.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → TelegramAdapter, CommandParser
 * Domain Layer       → ScheduleCommandDispatcher, RecurringJobScheduler,
 *                      ScheduleReconciliationService
 * Infrastructure     → JsonScheduleStoreAdapter, LocalStorageAdapter
 * </pre>
 *
 * <p>
 * Schedules live in a durable store and are mirrored by in-memory timers. On
 * startup the timers are rebuilt from the store once the transport reports
 * readiness.
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CourierApplication {

    public static void main(String[] args) {
        SpringApplication.run(CourierApplication.class, args);
    }

}
