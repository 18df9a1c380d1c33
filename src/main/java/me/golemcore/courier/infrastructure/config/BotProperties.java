package me.golemcore.courier.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link ChannelProperties} - transports (Telegram)</li>
 * <li>{@link StorageProperties} - schedule table location and scan paging</li>
 * <li>{@link SchedulerProperties} - timer thread pool</li>
 * <li>{@link CommandsProperties} - command reply behavior</li>
 * <li>{@link HelpProperties} - help text payload</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private Map<String, ChannelProperties> channels = new HashMap<>();
    private StorageProperties storage = new StorageProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private CommandsProperties commands = new CommandsProperties();
    private HelpProperties help = new HelpProperties();

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
        private String token;
        private List<String> allowFrom = new ArrayList<>();
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String tableName = "schedules";
        private int scanPageSize = 25;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/courier";
    }

    @Data
    public static class SchedulerProperties {
        private int poolSize = 4;
        private int shutdownTimeoutSeconds = 5;
    }

    @Data
    public static class CommandsProperties {
        /**
         * Reply to the issuer when add/update/pause/unpause fail. Delete always
         * replies.
         */
        private boolean reportFailures = false;
        private String language = "en";
    }

    @Data
    public static class HelpProperties {
        private String path = "classpath:help_text.txt";
    }
}
