package me.relaygate.gateway.adapter.inbound.command;

import me.relaygate.gateway.domain.model.ConversationSession;
import me.relaygate.gateway.domain.model.InboundMessage;
import me.relaygate.gateway.domain.model.SessionStatus;
import me.relaygate.gateway.domain.service.ConversationSessionService;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.infrastructure.i18n.MessageService;
import me.relaygate.gateway.port.outbound.NotifyPort;
import me.relaygate.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class TaskCommandHandlerTest {

    private static final String TELEGRAM = "telegram";
    private static final String CHAT = "chat-1";
    private static final String USER = "u1";

    private MutableClock clock;
    private MessageService messages;
    private ScheduledExecutorService timeouts;
    private List<Runnable> queued;
    private ConversationSessionService sessionService;
    private TaskCommandHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:15:30Z"));
        timeouts = Executors.newSingleThreadScheduledExecutor();
        queued = new ArrayList<>();
        ExecutorService manual = mock(ExecutorService.class);
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(manual).execute(any());
        GatewayProperties properties = new GatewayProperties();
        messages = new MessageService(properties);
        sessionService = new ConversationSessionService(properties, messages, clock, manual, timeouts,
                (handle, task, history) -> "finished: " + task, (NotifyPort) null);
        handler = new TaskCommandHandler(sessionService, messages, clock);
    }

    @AfterEach
    void tearDown() {
        timeouts.shutdownNow();
    }

    @Test
    void shouldShowHelpWithoutArguments() {
        String help = handler.handle(message(), List.of());

        assertTrue(help.startsWith("🔄 *Session/Task Commands*"));
        assertEquals(help, handler.handle(message(), List.of("help")));
    }

    @Test
    void shouldRejectUnknownSubcommand() {
        assertEquals("❌ Unknown command: fly\nUse /task help for available commands.",
                handler.handle(message(), List.of("fly")));
    }

    @Test
    void shouldReplyInConfiguredLanguage() {
        messages.setLanguage(MessageService.LANG_RU);

        assertEquals("📋 Нет активных сессий.", handler.handle(message(), List.of("list")));
        assertEquals("❌ Сессия не найдена: zzz", handler.handle(message(), List.of("status", "zzz")));
    }

    // ====== spawn ======

    @Test
    void spawnShouldStartSubSessionAndReportId() {
        String reply = handler.handle(message(), List.of("spawn", "research", "trends"));

        ConversationSession sub = sessionService.listSubSessions(TELEGRAM + ":" + CHAT).get(0);
        assertEquals("research trends", sub.getTask());
        assertEquals("🚀 *Task Spawned*\n\n📋 research trends\n🔑 ID: " + sub.getId()
                + "\n\nI'll notify you when it's done!", reply);
    }

    @Test
    void spawnAliasesShouldWork() {
        handler.handle(message(), List.of("run", "a"));
        handler.handle(message(), List.of("BG", "b"));

        assertEquals(2, sessionService.listSubSessions(TELEGRAM + ":" + CHAT).size());
    }

    @Test
    void spawnWithoutTaskShouldShowUsage() {
        assertEquals("Usage: /task spawn <task description>", handler.handle(message(), List.of("spawn")));
    }

    // ====== list ======

    @Test
    void listShouldReportNoSessions() {
        assertEquals("📋 No active sessions.", handler.handle(message(), List.of("list")));
    }

    @Test
    void listShouldShowActiveSessions() {
        handler.handle(message(), List.of("spawn", "write", "report"));

        String reply = handler.handle(message(), List.of("ls"));

        assertTrue(reply.startsWith("📋 *Active Sessions* (2)\n\n"));
        assertTrue(reply.contains("🔄 `telegram:chat-1` [main]"));
        assertTrue(reply.contains("⏳ `telegram:chat-1:sub:1` [sub]\n   📋 write report"));
    }

    // ====== status ======

    @Test
    void statusShouldMatchByPrefix() {
        handler.handle(message(), List.of("spawn", "summarize"));
        queued.get(0).run();

        String reply = handler.handle(message(), List.of("status", "telegram:chat-1:sub"));

        assertTrue(reply.startsWith("✅ *Session Status*"));
        assertTrue(reply.contains("ID: `telegram:chat-1:sub:1`"));
        assertTrue(reply.contains("Type: sub"));
        assertTrue(reply.contains("Status: complete"));
        assertTrue(reply.contains("✅ *Result:*\nfinished: summarize"));
        assertTrue(reply.contains("📅 Created: 10:15:30"));
        assertTrue(reply.contains("⏱️ Completed: 10:15:30"));
    }

    @Test
    void statusShouldReportMissingSession() {
        assertEquals("❌ Session not found: zzz", handler.handle(message(), List.of("status", "zzz")));
        assertEquals("Usage: /task status <session_id>", handler.handle(message(), List.of("status")));
    }

    // ====== cancel ======

    @Test
    void cancelShouldCancelPendingTask() {
        handler.handle(message(), List.of("spawn", "long", "job"));
        String id = sessionService.listSubSessions(TELEGRAM + ":" + CHAT).get(0).getId();

        assertEquals("🚫 Canceled session: " + id, handler.handle(message(), List.of("cancel", id)));
        assertEquals(SessionStatus.CANCELED, sessionService.get(id).orElseThrow().getStatus());
    }

    @Test
    void cancelShouldReportAlreadyCanceledTask() {
        handler.handle(message(), List.of("spawn", "job"));
        String id = sessionService.listSubSessions(TELEGRAM + ":" + CHAT).get(0).getId();
        handler.handle(message(), List.of("stop", id));

        String reply = handler.handle(message(), List.of("cancel", id));

        assertTrue(reply.startsWith("❌ Failed to cancel: "));
    }

    @Test
    void cancelShouldNotFindFinishedTask() {
        handler.handle(message(), List.of("spawn", "job"));
        queued.get(0).run();

        assertEquals("❌ Session not found: telegram:chat-1:sub",
                handler.handle(message(), List.of("cancel", "telegram:chat-1:sub")));
    }

    // ====== clear ======

    @Test
    void clearShouldDropOldFinishedTasks() {
        handler.handle(message(), List.of("spawn", "job"));
        queued.get(0).run();
        clock.advance(Duration.ofHours(2));

        assertEquals("🗑️ Cleared 1 completed sessions.", handler.handle(message(), List.of("clear")));
        assertTrue(sessionService.listSubSessions(TELEGRAM + ":" + CHAT).isEmpty());
    }

    private static InboundMessage message() {
        return InboundMessage.builder()
                .platform(TELEGRAM)
                .chatId(CHAT)
                .userId(USER)
                .text("/task")
                .build();
    }
}
