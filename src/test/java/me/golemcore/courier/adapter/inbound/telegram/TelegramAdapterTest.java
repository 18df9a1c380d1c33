package me.golemcore.courier.adapter.inbound.telegram;

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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.ApplicationEventPublisher;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChat;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.chat.ChatFullInfo;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterTest {

    private static final long ALICE_ID = 123L;
    private static final long BOB_ID = 456L;
    private static final long BOT_ID = 999L;
    private static final long GROUP_ID = -100L;

    private BotProperties.ChannelProperties telegramProps;
    private ApplicationEventPublisher eventPublisher;
    private TelegramBotsLongPollingApplication botsApplication;
    private CommandPort commandPort;
    private TelegramClient telegramClient;
    private TelegramAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        BotProperties properties = new BotProperties();
        telegramProps = new BotProperties.ChannelProperties();
        telegramProps.setEnabled(true);
        telegramProps.setToken("test-token");
        properties.setChannels(Map.of("telegram", telegramProps));

        eventPublisher = mock(ApplicationEventPublisher.class);
        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        commandPort = mock(CommandPort.class);
        ObjectProvider<CommandPort> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(commandPort);
        telegramClient = mock(TelegramClient.class);

        adapter = new TelegramAdapter(properties, eventPublisher, botsApplication, new MessageService(), provider,
                new CommandParser());
        adapter.setTelegramClient(telegramClient);
        adapter.setBotUser(user(BOT_ID, "Courier", "courier_bot"));
    }

    // ===== Lifecycle =====

    @Test
    void startPublishesReadinessBeforePolling() throws Exception {
        User self = user(BOT_ID, "Courier", "courier_bot");
        when(telegramClient.execute(any(GetMe.class))).thenReturn(self);

        adapter.start();

        InOrder order = inOrder(telegramClient, eventPublisher, botsApplication);
        order.verify(telegramClient).execute(any(GetMe.class));
        order.verify(eventPublisher).publishEvent(new TransportReadyEvent("telegram"));
        order.verify(botsApplication).registerBot("test-token", adapter);
        assertTrue(adapter.isRunning());
    }

    @Test
    void startWithoutTokenDoesNothing() throws Exception {
        telegramProps.setToken("");

        adapter.start();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        verify(botsApplication, never()).registerBot(anyString(), any());
        assertFalse(adapter.isRunning());
    }

    @Test
    void startStopsWhenCredentialsAreRejected() throws Exception {
        when(telegramClient.execute(any(GetMe.class))).thenThrow(new TelegramApiException("Unauthorized"));

        adapter.start();

        verify(eventPublisher, never()).publishEvent(any(Object.class));
        assertFalse(adapter.isRunning());
    }

    // ===== Inbound commands =====

    @Test
    void privateAddIsDispatchedWithTextMention() {
        User bob = user(BOB_ID, "Bob", null);
        MessageEntity mention = mock(MessageEntity.class);
        when(mention.getType()).thenReturn("text_mention");
        when(mention.getUser()).thenReturn(bob);
        when(commandPort.execute(any(), any())).thenReturn(CommandPort.CommandResult.silent());

        adapter.consume(textUpdate(privateChat(), "add Bob 60 Hello", List.of(mention)));

        ArgumentCaptor<CommandContext> context = ArgumentCaptor.forClass(CommandContext.class);
        verify(commandPort).execute(eq(new ScheduleCommand.Add("Bob", 60, "Hello")), context.capture());
        assertEquals("123", context.getValue().ownerId());
        assertNull(context.getValue().sharedChannel());
        assertEquals(1, context.getValue().mentions().size());
        assertEquals("456", context.getValue().mentions().get(0).id());
        assertEquals("Bob", context.getValue().mentions().get(0).name());
    }

    @Test
    void usernameMentionResolvesForSeenUsers() throws Exception {
        when(commandPort.execute(any(), any())).thenReturn(CommandPort.CommandResult.silent());
        // Bob talks to the bot first so his username is known.
        adapter.consume(textUpdate(user(BOB_ID, "Bob", "bob"), privateChat(), "hello", List.of()));

        MessageEntity botMention = mentionEntity(0, 12);
        MessageEntity bobMention = mentionEntity(17, 4);
        adapter.consume(textUpdate(groupChat(), "@courier_bot add @bob 60 Hi", List.of(botMention, bobMention)));

        ArgumentCaptor<CommandContext> context = ArgumentCaptor.forClass(CommandContext.class);
        verify(commandPort).execute(eq(new ScheduleCommand.Add("@bob", 60, "Hi")), context.capture());
        assertEquals(List.of("456"), context.getValue().mentions().stream().map(TransportTarget::id).toList());
        assertEquals("-100", context.getValue().sharedChannel().id());
    }

    @Test
    void replyGoesToOriginatingPrivateChat() throws Exception {
        when(commandPort.execute(any(), any())).thenReturn(CommandPort.CommandResult.success("Message deleted"));

        adapter.consume(textUpdate(privateChat(), "delete 2024-01-01 00:00:00", List.of()));

        SendMessage sent = captureSent();
        assertEquals("123", sent.getChatId());
        assertEquals("Message deleted", sent.getText());
        assertEquals("HTML", sent.getParseMode());
    }

    @Test
    void replyInGroupMentionsTheAuthor() throws Exception {
        when(commandPort.execute(any(), any())).thenReturn(CommandPort.CommandResult.success("Message deleted"));

        adapter.consume(textUpdate(groupChat(), "delete 2024-01-01 00:00:00", List.of()));

        SendMessage sent = captureSent();
        assertEquals("-100", sent.getChatId());
        assertEquals("<a href=\"tg://user?id=123\">Alice</a> Message deleted", sent.getText());
    }

    @Test
    void silentResultSendsNothing() throws Exception {
        when(commandPort.execute(any(), any())).thenReturn(CommandPort.CommandResult.silentFailure());

        adapter.consume(textUpdate(privateChat(), "pause 2024-01-01 00:00:00", List.of()));

        verify(telegramClient, never()).execute(any(SendMessage.class));
    }

    @Test
    void unrecognizedTextIsIgnored() {
        adapter.consume(textUpdate(privateChat(), "good morning", List.of()));

        verify(commandPort, never()).execute(any(), any());
    }

    @Test
    void ownMessagesAreIgnored() {
        adapter.consume(textUpdate(user(BOT_ID, "Courier", "courier_bot"), groupChat(), "list", List.of()));

        verify(commandPort, never()).execute(any(), any());
    }

    @Test
    void unauthorizedUserIsRejected() throws Exception {
        telegramProps.setAllowFrom(List.of("777"));

        adapter.consume(textUpdate(privateChat(), "list", List.of()));

        verify(commandPort, never()).execute(any(), any());
        assertEquals("You are not allowed to use this bot", captureSent().getText());
    }

    @Test
    void dispatcherExceptionDoesNotEscape() {
        when(commandPort.execute(any(), any())).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> adapter.consume(textUpdate(privateChat(), "list", List.of())));
    }

    // ===== Outbound =====

    @Test
    void directSendEscapesBody() throws Exception {
        TransportTarget bob = TransportTarget.user("456", "Bob", "<a href=\"tg://user?id=456\">Bob</a>");

        adapter.send(DeliveryTarget.direct(bob), "1 < 2 & done").join();

        SendMessage sent = captureSent();
        assertEquals("456", sent.getChatId());
        assertEquals("1 &lt; 2 &amp; done", sent.getText());
    }

    @Test
    void channelSendPrefixesRecipientMention() throws Exception {
        TransportTarget bob = TransportTarget.user("456", "Bob", "<a href=\"tg://user?id=456\">Bob</a>");
        TransportTarget group = TransportTarget.channel("-100", "team");

        adapter.send(new DeliveryTarget(bob, group), "stand up").join();

        SendMessage sent = captureSent();
        assertEquals("-100", sent.getChatId());
        assertEquals("<a href=\"tg://user?id=456\">Bob</a> stand up", sent.getText());
    }

    @Test
    void resolveUserUsesGetChat() throws Exception {
        ChatFullInfo info = mock(ChatFullInfo.class);
        when(info.getId()).thenReturn(BOB_ID);
        when(info.getType()).thenReturn("private");
        when(info.getFirstName()).thenReturn("Bob");
        when(telegramClient.execute(any(GetChat.class))).thenReturn(info);

        TransportTarget target = adapter.resolveUser("456");

        assertEquals("456", target.id());
        assertEquals("Bob", target.name());
        assertTrue(target.direct());
    }

    @Test
    void resolveUserFailsForUnknownId() throws Exception {
        when(telegramClient.execute(any(GetChat.class))).thenThrow(new TelegramApiException("chat not found"));

        assertThrows(RecipientUnresolvedException.class, () -> adapter.resolveUser("404"));
    }

    @Test
    void resolveChannelReturnsSharedTarget() throws Exception {
        ChatFullInfo info = mock(ChatFullInfo.class);
        when(info.getId()).thenReturn(GROUP_ID);
        when(info.getType()).thenReturn("supergroup");
        when(info.getTitle()).thenReturn("team");
        when(telegramClient.execute(any(GetChat.class))).thenReturn(info);

        TransportTarget target = adapter.resolveChannel("-100");

        assertEquals("team", target.name());
        assertFalse(target.direct());
    }

    @Test
    void splitAtNewlinesKeepsShortTextWhole() {
        assertEquals(List.of("short"), TelegramAdapter.splitAtNewlines("short", 100));

        List<String> chunks = TelegramAdapter.splitAtNewlines("aaaa\nbbbb\ncccc", 10);
        assertEquals(List.of("aaaa\nbbbb", "cccc"), chunks);
    }

    // ===== Helpers =====

    private SendMessage captureSent() throws Exception {
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        return captor.getValue();
    }

    private Update textUpdate(Chat chat, String text, List<MessageEntity> entities) {
        return textUpdate(user(ALICE_ID, "Alice", "alice"), chat, text, entities);
    }

    private Update textUpdate(User from, Chat chat, String text, List<MessageEntity> entities) {
        Message message = mock(Message.class);
        when(message.getFrom()).thenReturn(from);
        when(message.getChat()).thenReturn(chat);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        when(message.getEntities()).thenReturn(entities);

        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }

    private static MessageEntity mentionEntity(int offset, int length) {
        MessageEntity entity = mock(MessageEntity.class);
        when(entity.getType()).thenReturn("mention");
        when(entity.getOffset()).thenReturn(offset);
        when(entity.getLength()).thenReturn(length);
        return entity;
    }

    private static Chat privateChat() {
        Chat chat = mock(Chat.class);
        when(chat.getId()).thenReturn(ALICE_ID);
        when(chat.getType()).thenReturn("private");
        return chat;
    }

    private static Chat groupChat() {
        Chat chat = mock(Chat.class);
        when(chat.getId()).thenReturn(GROUP_ID);
        when(chat.getType()).thenReturn("supergroup");
        when(chat.getTitle()).thenReturn("team");
        return chat;
    }

    private static User user(long id, String firstName, String username) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(id);
        when(user.getFirstName()).thenReturn(firstName);
        when(user.getUserName()).thenReturn(username);
        return user;
    }
}
