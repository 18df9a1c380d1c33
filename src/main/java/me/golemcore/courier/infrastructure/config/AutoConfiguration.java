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

import me.golemcore.courier.infrastructure.i18n.MessageService;
import me.golemcore.courier.port.outbound.TransportPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration that wires shared infrastructure and starts the bot once
 * the application context is ready.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock}, {@link ObjectMapper}, timer and delivery
 * executor beans</li>
 * <li>Logs startup information (storage location, table name)</li>
 * <li>Starts all enabled transports (Telegram, etc.)</li>
 * </ul>
 *
 * <p>
 * Transports are started after context refresh so that readiness listeners,
 * including schedule reconciliation, are registered. A transport whose start
 * fails aborts application startup.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<TransportPort> transports;
    private final MessageService messageService;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Timer threads. Shut down by
     * {@link me.golemcore.courier.domain.service.RecurringJobScheduler}.
     */
    @Bean(destroyMethod = "")
    public ScheduledExecutorService timerExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(
                Math.max(1, properties.getScheduler().getPoolSize()), daemonThreads("courier-timer-"));
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Runs deliveries handed over by the timers. Each job has at most one
     * delivery in flight, so the pool never holds more threads than there are
     * jobs.
     */
    @Bean
    public ExecutorService deliveryExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("courier-delivery-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startTransports() {
        log.info("GolemCore Courier starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Schedule Table: {}", properties.getStorage().getTableName());
        messageService.setLanguage(properties.getCommands().getLanguage());

        for (TransportPort transport : transports) {
            String channelType = transport.getChannelType();
            if (isChannelEnabled(channelType)) {
                log.info("Starting channel: {}", channelType);
                transport.start();
            } else {
                log.info("Channel disabled: {}", channelType);
            }
        }

        log.info("GolemCore Courier started successfully");
    }

    private boolean isChannelEnabled(String channelType) {
        BotProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        return channelProps != null && channelProps.isEnabled();
    }
}
