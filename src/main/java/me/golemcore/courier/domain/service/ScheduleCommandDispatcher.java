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

import me.golemcore.courier.domain.exception.DuplicateKeyException;
import me.golemcore.courier.domain.exception.JobNotFoundException;
import me.golemcore.courier.domain.exception.StorageUnavailableException;
import me.golemcore.courier.domain.model.CommandContext;
import me.golemcore.courier.domain.model.DeliveryTarget;
import me.golemcore.courier.domain.model.JobId;
import me.golemcore.courier.domain.model.RecordKey;
import me.golemcore.courier.domain.model.ScheduleCommand;
import me.golemcore.courier.domain.model.ScheduleField;
import me.golemcore.courier.domain.model.ScheduleRecord;
import me.golemcore.courier.domain.model.ScheduleStatus;
import me.golemcore.courier.domain.model.TransportTarget;
import me.golemcore.courier.infrastructure.config.BotProperties;
import me.golemcore.courier.infrastructure.config.HelpTextProvider;
import me.golemcore.courier.infrastructure.i18n.MessageService;
import me.golemcore.courier.port.inbound.CommandPort;
import me.golemcore.courier.port.outbound.ScheduleStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Applies parsed commands to the schedule store and the recurring job scheduler
 * so that both stay consistent.
 *
 * <p>
 * Ordering per command:
 * <ul>
 * <li>add - create the record, then arm the timer; a failed create arms
 * nothing</li>
 * <li>update/pause/unpause - conditional store update, then the scheduler
 * mutation, issued even when the store reports no change</li>
 * <li>delete - soft-delete, then remove the timer whatever the store said; the
 * reply reflects the store only</li>
 * </ul>
 * Both steps of a command run under the job's lock from {@link JobLocks}.
 *
 * <p>
 * Failures of add/update/pause/unpause are silent unless
 * {@code bot.commands.report-failures} is set. Storage outages are always
 * reported.
 */
@Service
@Slf4j
public class ScheduleCommandDispatcher implements CommandPort {

    static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ScheduleStorePort store;
    private final RecurringJobScheduler scheduler;
    private final DeliveryService deliveryService;
    private final JobLocks jobLocks;
    private final MessageService messageService;
    private final HelpTextProvider helpTextProvider;
    private final BotProperties properties;
    private final Clock clock;

    public ScheduleCommandDispatcher(ScheduleStorePort store, RecurringJobScheduler scheduler,
            DeliveryService deliveryService, JobLocks jobLocks, MessageService messageService,
            HelpTextProvider helpTextProvider, BotProperties properties, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.deliveryService = deliveryService;
        this.jobLocks = jobLocks;
        this.messageService = messageService;
        this.helpTextProvider = helpTextProvider;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public CommandResult execute(ScheduleCommand command, CommandContext context) {
        try {
            if (command instanceof ScheduleCommand.Add add) {
                return handleAdd(add, context);
            } else if (command instanceof ScheduleCommand.Update update) {
                return handleUpdate(update, context);
            } else if (command instanceof ScheduleCommand.Delete delete) {
                return handleDelete(delete, context);
            } else if (command instanceof ScheduleCommand.Pause pause) {
                return handleStatus(pause.timestamp(), ScheduleStatus.PAUSED, context);
            } else if (command instanceof ScheduleCommand.Unpause unpause) {
                return handleStatus(unpause.timestamp(), ScheduleStatus.ACTIVE, context);
            } else if (command instanceof ScheduleCommand.ListSchedules) {
                return handleList(context);
            } else if (command instanceof ScheduleCommand.Help) {
                return handleHelp(context);
            }
            return CommandResult.silentFailure();
        } catch (StorageUnavailableException e) {
            log.error("[Command] Storage unavailable while handling {} for {}", command, context.ownerId(), e);
            return CommandResult.failure(msg("command.storage.unavailable"));
        }
    }

    private CommandResult handleAdd(ScheduleCommand.Add add, CommandContext context) {
        if (context.mentions().size() != 1) {
            log.info("[Command] Invalid recipients for add from {}: {}", context.ownerId(), context.mentions().size());
            return failed(msg("command.add.invalid-recipients"));
        }
        TransportTarget recipient = context.mentions().get(0);
        TransportTarget channel = context.sharedChannel();
        String createdAt = LocalDateTime.now(clock).format(CREATED_AT_FORMAT);

        ScheduleRecord record = ScheduleRecord.builder()
                .owner(context.ownerId())
                .createdAt(createdAt)
                .recipientId(recipient.id())
                .recipientName(recipient.name())
                .channelId(channel != null ? channel.id() : null)
                .intervalSeconds(add.intervalSeconds())
                .body(add.body())
                .status(ScheduleStatus.ACTIVE)
                .build();
        JobId jobId = record.getJobId();
        DeliveryTarget target = new DeliveryTarget(recipient, channel);

        log.info("[Command] {} is now sending {} ({}): |{}| every {} seconds",
                context.owner().name(), recipient.name(), recipient.id(), add.body(), add.intervalSeconds());
        try {
            jobLocks.withLock(jobId, () -> {
                store.create(record);
                scheduler.schedule(jobId, add.intervalSeconds(),
                        deliveryService.deliveryTask(jobId, target, add.body()));
            });
        } catch (DuplicateKeyException e) {
            log.warn("[Command] {}", e.getMessage());
            return failed(msg("command.add.duplicate"));
        } catch (IllegalArgumentException e) {
            log.warn("[Command] Rejected add from {}: {}", context.ownerId(), e.getMessage());
            return failed(msg("command.add.failed"));
        }
        return CommandResult.silent();
    }

    private CommandResult handleUpdate(ScheduleCommand.Update update, CommandContext context) {
        RecordKey key = new RecordKey(context.ownerId(), update.timestamp());
        JobId jobId = key.jobId();
        log.info("[Command] {} is updating {} to send every {} seconds",
                context.owner().name(), update.timestamp(), update.intervalSeconds());

        boolean applied = jobLocks.withLock(jobId, () -> {
            boolean changed = store.setField(key, ScheduleField.INTERVAL,
                    Integer.toString(update.intervalSeconds()));
            return applyToScheduler(jobId, () -> scheduler.reschedule(jobId, update.intervalSeconds()))
                    || changed;
        });
        return applied ? CommandResult.silent() : failed(msg("command.update.failed", update.timestamp()));
    }

    private CommandResult handleDelete(ScheduleCommand.Delete delete, CommandContext context) {
        RecordKey key = new RecordKey(context.ownerId(), delete.timestamp());
        JobId jobId = key.jobId();
        log.info("[Command] {} is marking {} as deleted", context.owner().name(), delete.timestamp());

        boolean deleted = jobLocks.withLock(jobId, () -> {
            try {
                return store.softDelete(key);
            } finally {
                scheduler.remove(jobId);
            }
        });
        return deleted
                ? CommandResult.success(msg("command.delete.done"))
                : CommandResult.failure(msg("command.delete.not-found"));
    }

    private CommandResult handleStatus(String timestamp, ScheduleStatus status, CommandContext context) {
        RecordKey key = new RecordKey(context.ownerId(), timestamp);
        JobId jobId = key.jobId();
        boolean pausing = status == ScheduleStatus.PAUSED;
        log.info("[Command] {} is {} {}", context.owner().name(), pausing ? "deactivating" : "reactivating",
                timestamp);

        boolean applied = jobLocks.withLock(jobId, () -> {
            boolean changed = store.setField(key, ScheduleField.STATUS, status.getValue());
            return applyToScheduler(jobId, () -> {
                if (pausing) {
                    scheduler.pause(jobId);
                } else {
                    scheduler.resume(jobId);
                }
            }) || changed;
        });
        if (applied) {
            return CommandResult.silent();
        }
        return failed(msg(pausing ? "command.pause.failed" : "command.unpause.failed", timestamp));
    }

    private CommandResult handleList(CommandContext context) {
        log.info("[Command] Listed {} ({})'s saved data in {}", context.owner().name(), context.ownerId(),
                context.chat().name());
        List<ScheduleRecord> records = store.lookupByOwner(context.ownerId());
        return CommandResult.success(ScheduleListFormatter.format(msg("command.list.title"), records));
    }

    private CommandResult handleHelp(CommandContext context) {
        log.info("[Command] {} is requesting bot information in {}", context.owner().name(), context.chat().name());
        return CommandResult.success(helpTextProvider.getHelpText());
    }

    private boolean applyToScheduler(JobId jobId, Runnable mutation) {
        try {
            mutation.run();
            return true;
        } catch (JobNotFoundException e) {
            log.warn("[Command] {}", e.getMessage());
            return false;
        }
    }

    private CommandResult failed(String message) {
        return properties.getCommands().isReportFailures()
                ? CommandResult.failure(message)
                : CommandResult.silentFailure();
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
