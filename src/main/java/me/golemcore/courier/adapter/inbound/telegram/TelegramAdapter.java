package me.golemcore.courier.adapter.inbound.telegram;

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

import me.golemcore.courier.adapter.inbound.command.CommandParser;
import me.golemcore.courier.domain.exception.RecipientUnresolvedException;
import me.golemcore.courier.domain.model.CommandContext;
import me.golemcore.courier.domain.model.DeliveryTarget;
import me.golemcore.courier.domain.model.ScheduleCommand;
import me.golemcore.courier.domain.model.TransportReadyEvent;
import me.golemcore.courier.domain.model.TransportTarget;
import me.golemcore.courier.infrastructure.config.BotProperties;
import me.golemcore.courier.infrastructure.i18n.MessageService;
import me.golemcore.courier.port.inbound.CommandPort;
import me.golemcore.courier.port.outbound.TransportPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChat;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Telegram transport using long polling.
 *
 * <p>
 * This adapter implements both {@link TransportPort} for delivery and
 * {@link LongPollingSingleThreadUpdateConsumer} for inbound commands.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Credential check via {@code getMe} before anything else
 * <li>Readiness signal published before polling starts, so stored schedules
 * are restored before the first command is handled
 * <li>User authorization via an optional allowlist
 * <li>Mention resolution for {@code text_mention} entities and for
 * {@code @username} mentions of users the bot has already seen
 * <li>Message splitting for Telegram's 4096 character limit
 * <li>HTML rendering via {@link TelegramHtmlFormatter}
 * </ul>
 *
 * <p>
 * The adapter is always available as a Spring bean but only starts polling if
 * {@code bot.channels.telegram.enabled=true} and a token is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements TransportPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String PRIVATE_CHAT = "private";
    private static final String ENTITY_MENTION = "mention";
    private static final String ENTITY_TEXT_MENTION = "text_mention";
    private static final String PARSE_MODE_HTML = "HTML";
    private static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    private static final int SPLIT_LENGTH = 3800;

    private final BotProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;
    private final ObjectProvider<CommandPort> commandRouter;
    private final CommandParser commandParser;

    private final Map<String, TransportTarget> usersByUsername = new ConcurrentHashMap<>();
    private final Map<String, TransportTarget> usersById = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    private TelegramClient telegramClient;
    private volatile User botUser;
    private volatile boolean running = false;

    /**
     * Package-private setter for testing. Allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    /**
     * Package-private setter for testing.
     */
    void setBotUser(User user) {
        this.botUser = user;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            String token = getToken();
            if (token == null || token.isBlank()) {
                log.warn("[Telegram] Token not configured, adapter will not start");
                return;
            }
            if (telegramClient == null) {
                telegramClient = new OkHttpTelegramClient(token);
            }

            try {
                botUser = telegramClient.execute(new GetMe());
                log.info("[Telegram] Logged in as @{} ({})", botUser.getUserName(), botUser.getId());
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to verify bot credentials", e);
                return;
            }

            // Listeners run synchronously; a storage failure here aborts startup.
            eventPublisher.publishEvent(new TransportReadyEvent(CHANNEL_TYPE));

            try {
                botsApplication.registerBot(token, this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                if (e.getMessage() != null && e.getMessage().contains("already registered")) {
                    running = true;
                    log.warn("[Telegram] Bot already registered; keeping existing polling session active");
                    return;
                }
                log.error("[Telegram] Failed to start polling", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage()) {
            return;
        }
        try {
            handleMessage(update.getMessage());
        } catch (Exception e) {
            log.error("[Telegram] Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    private void handleMessage(Message telegramMessage) {
        User from = telegramMessage.getFrom();
        if (from == null || !telegramMessage.hasText() || telegramMessage.getText().isBlank()) {
            return;
        }
        if (isSelf(from)) {
            return;
        }
        TransportTarget owner = rememberUser(from);
        TransportTarget chat = toChatTarget(telegramMessage, owner);

        if (!isAuthorized(owner.id())) {
            log.warn("[Telegram] Unauthorized user: {} in chat: {}", owner.id(), chat.id());
            sendText(chat.id(), messageService.getMessage("security.unauthorized"));
            return;
        }

        String text = telegramMessage.getText();
        Optional<ScheduleCommand> command = commandParser.parse(text, botUsername());
        if (command.isEmpty()) {
            log.debug("[Telegram] Ignoring unrecognized input from {}", owner.id());
            return;
        }

        CommandPort router = commandRouter.getIfAvailable();
        if (router == null) {
            log.warn("[Telegram] No command handler available");
            return;
        }
        CommandContext context = new CommandContext(owner, chat, extractMentions(telegramMessage));
        CommandPort.CommandResult result = router.execute(command.get(), context);
        if (result.hasOutput()) {
            send(context.replyTarget(), result.output()).join();
        }
    }

    private TransportTarget toChatTarget(Message telegramMessage, TransportTarget owner) {
        Chat chat = telegramMessage.getChat();
        if (chat == null || PRIVATE_CHAT.equals(chat.getType())) {
            return owner;
        }
        String title = chat.getTitle() != null ? chat.getTitle() : chat.getId().toString();
        return TransportTarget.channel(chat.getId().toString(), title);
    }

    /**
     * Users mentioned in the message, in order, excluding the bot itself.
     * {@code @username} mentions resolve only for users the bot has seen.
     */
    List<TransportTarget> extractMentions(Message telegramMessage) {
        List<MessageEntity> entities = telegramMessage.getEntities();
        if (entities == null || entities.isEmpty()) {
            return List.of();
        }
        String text = telegramMessage.getText();
        List<TransportTarget> mentions = new ArrayList<>();
        for (MessageEntity entity : entities) {
            if (ENTITY_TEXT_MENTION.equals(entity.getType()) && entity.getUser() != null) {
                if (!isSelf(entity.getUser())) {
                    mentions.add(rememberUser(entity.getUser()));
                }
            } else if (ENTITY_MENTION.equals(entity.getType())) {
                String username = entityText(text, entity);
                if (username.startsWith("@")) {
                    username = username.substring(1);
                }
                if (username.equalsIgnoreCase(botUsername())) {
                    continue;
                }
                TransportTarget known = usersByUsername.get(username.toLowerCase(Locale.ROOT));
                if (known != null) {
                    mentions.add(known);
                } else {
                    log.warn("[Telegram] Cannot resolve mention of unseen user @{}", username);
                }
            }
        }
        return mentions;
    }

    private static String entityText(String text, MessageEntity entity) {
        int start = Math.max(0, entity.getOffset());
        int end = Math.min(text.length(), start + entity.getLength());
        return text.substring(start, end);
    }

    private TransportTarget rememberUser(User user) {
        TransportTarget target = toUserTarget(user);
        usersById.put(target.id(), target);
        if (user.getUserName() != null) {
            usersByUsername.put(user.getUserName().toLowerCase(Locale.ROOT), target);
        }
        return target;
    }

    private static TransportTarget toUserTarget(User user) {
        String id = user.getId().toString();
        String name = displayName(user.getFirstName(), user.getLastName(), user.getUserName(), id);
        return TransportTarget.user(id, name, TelegramHtmlFormatter.userMention(id, name));
    }

    private static String displayName(String firstName, String lastName, String username, String fallback) {
        if (firstName != null && !firstName.isBlank()) {
            return lastName != null && !lastName.isBlank() ? firstName + " " + lastName : firstName;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return fallback;
    }

    @Override
    public TransportTarget resolveUser(String userId) {
        try {
            var chat = telegramClient.execute(GetChat.builder().chatId(userId).build());
            if (chat == null || !PRIVATE_CHAT.equals(chat.getType())) {
                throw new RecipientUnresolvedException("Not a user: " + userId);
            }
            String id = chat.getId().toString();
            String name = displayName(chat.getFirstName(), chat.getLastName(), chat.getUserName(), id);
            TransportTarget target = TransportTarget.user(id, name, TelegramHtmlFormatter.userMention(id, name));
            usersById.put(id, target);
            return target;
        } catch (TelegramApiException e) {
            TransportTarget known = usersById.get(userId);
            if (known != null) {
                log.debug("[Telegram] getChat failed for {}, using last seen profile", userId);
                return known;
            }
            throw new RecipientUnresolvedException("Unknown user: " + userId, e);
        }
    }

    @Override
    public TransportTarget resolveChannel(String channelId) {
        try {
            var chat = telegramClient.execute(GetChat.builder().chatId(channelId).build());
            if (chat == null) {
                throw new RecipientUnresolvedException("Unknown channel: " + channelId);
            }
            String id = chat.getId().toString();
            if (PRIVATE_CHAT.equals(chat.getType())) {
                String name = displayName(chat.getFirstName(), chat.getLastName(), chat.getUserName(), id);
                return TransportTarget.user(id, name, TelegramHtmlFormatter.userMention(id, name));
            }
            return TransportTarget.channel(id, chat.getTitle() != null ? chat.getTitle() : id);
        } catch (TelegramApiException e) {
            throw new RecipientUnresolvedException("Unknown channel: " + channelId, e);
        }
    }

    @Override
    public CompletableFuture<Void> send(DeliveryTarget target, String text) {
        if (target.isDirect()) {
            return CompletableFuture.runAsync(() -> sendText(target.recipient().id(), text));
        }
        String mention = target.recipient().mention();
        return CompletableFuture.runAsync(() -> sendText(target.channel().id(), text, mention));
    }

    private void sendText(String chatId, String content) {
        sendText(chatId, content, null);
    }

    private void sendText(String chatId, String content, String mentionHtml) {
        try {
            List<String> chunks = splitAtNewlines(content != null ? content : "", SPLIT_LENGTH);
            for (int i = 0; i < chunks.size(); i++) {
                String chunk = chunks.get(i);
                String formatted = TelegramHtmlFormatter.format(chunk);
                if (i == 0 && mentionHtml != null) {
                    formatted = mentionHtml + " " + formatted;
                }
                if (formatted.length() > TELEGRAM_MAX_MESSAGE_LENGTH) {
                    formatted = formatted.substring(0, TELEGRAM_MAX_MESSAGE_LENGTH - 3) + "...";
                }

                SendMessage sendMessage = SendMessage.builder()
                        .chatId(chatId)
                        .text(formatted)
                        .parseMode(PARSE_MODE_HTML)
                        .build();
                try {
                    telegramClient.execute(sendMessage);
                } catch (TelegramApiException htmlEx) {
                    log.debug("[Telegram] HTML parse failed, retrying as plain text: {}", htmlEx.getMessage());
                    SendMessage plain = SendMessage.builder()
                            .chatId(chatId)
                            .text(chunk)
                            .build();
                    telegramClient.execute(plain);
                }
            }
        } catch (TelegramApiException e) {
            log.error("[Telegram] Failed to send message to chat: {}", chatId, e);
            throw new IllegalStateException("Failed to send message to " + chatId, e);
        }
    }

    /**
     * Split text at paragraph or line boundaries to keep chunks under
     * {@code maxLength}, so fenced blocks are cut between lines.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }
            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }
            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }
            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }
        return chunks;
    }

    private boolean isAuthorized(String userId) {
        List<String> allowFrom = channelProperties().getAllowFrom();
        return allowFrom == null || allowFrom.isEmpty() || allowFrom.contains(userId);
    }

    private boolean isSelf(User user) {
        User self = botUser;
        return self != null && self.getId() != null && self.getId().equals(user.getId());
    }

    private String botUsername() {
        User self = botUser;
        return self != null ? self.getUserName() : null;
    }

    private String getToken() {
        return channelProperties().getToken();
    }

    private BotProperties.ChannelProperties channelProperties() {
        BotProperties.ChannelProperties props = properties.getChannels().get(CHANNEL_TYPE);
        return props != null ? props : new BotProperties.ChannelProperties();
    }
}
