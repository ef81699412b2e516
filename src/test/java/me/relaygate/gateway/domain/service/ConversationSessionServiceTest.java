package me.relaygate.gateway.domain.service;

import me.relaygate.gateway.domain.exception.SessionNotFoundException;
import me.relaygate.gateway.domain.exception.SessionNotRunningException;
import me.relaygate.gateway.domain.model.ConversationSession;
import me.relaygate.gateway.domain.model.HistoryMessage;
import me.relaygate.gateway.domain.model.SessionStatus;
import me.relaygate.gateway.domain.model.SessionType;
import me.relaygate.gateway.domain.model.SubSessionStatus;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.infrastructure.i18n.MessageService;
import me.relaygate.gateway.port.outbound.NotifyPort;
import me.relaygate.gateway.port.outbound.TaskRunnerPort;
import me.relaygate.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class ConversationSessionServiceTest {

    private static final String TELEGRAM = "telegram";
    private static final String CHAT = "chat-1";
    private static final String USER = "u1";
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private GatewayProperties properties;
    private MessageService messages;
    private MutableClock clock;
    private ExecutorService workers;
    private ScheduledExecutorService timeouts;
    private List<String> notifications;
    private CountDownLatch notified;
    private NotifyPort notifier;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getSession().setMaxHistory(5);
        messages = new MessageService(properties);
        clock = new MutableClock(START);
        workers = Executors.newCachedThreadPool();
        timeouts = Executors.newSingleThreadScheduledExecutor();
        notifications = new CopyOnWriteArrayList<>();
        notified = new CountDownLatch(1);
        notifier = (platform, chatId, message) -> {
            notifications.add(platform + "|" + chatId + "|" + message);
            notified.countDown();
            return CompletableFuture.completedFuture(null);
        };
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        timeouts.shutdownNow();
    }

    // ====== main sessions ======

    @Test
    void getOrCreateShouldReturnSameInstanceUnderConcurrency() throws InterruptedException {
        ConversationSessionService service = service(null);
        int callers = 16;
        List<ConversationSession> seen = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        for (int i = 0; i < callers; i++) {
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                seen.add(service.getOrCreate(TELEGRAM, CHAT, USER));
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(callers, seen.size());
        assertEquals(1, seen.stream().distinct().count());
        assertEquals(1, service.list("", true).size());
        assertEquals(TELEGRAM + ":" + CHAT, seen.get(0).getId());
        assertEquals(SessionType.MAIN, seen.get(0).getType());
        assertEquals(SessionStatus.RUNNING, seen.get(0).getStatus());
    }

    @Test
    void addMessageShouldKeepMostRecentEntries() {
        ConversationSessionService service = service(null);
        ConversationSession session = service.getOrCreate(TELEGRAM, CHAT, USER);

        for (int i = 0; i < 8; i++) {
            service.addMessage(session, HistoryMessage.ROLE_USER, "m" + i);
        }

        List<String> contents = service.getHistory(session, 0).stream().map(HistoryMessage::content).toList();
        assertEquals(List.of("m3", "m4", "m5", "m6", "m7"), contents);
    }

    @Test
    void addMessageShouldTouchUpdatedAt() {
        ConversationSessionService service = service(null);
        ConversationSession session = service.getOrCreate(TELEGRAM, CHAT, USER);
        clock.advance(Duration.ofMinutes(3));

        service.addMessage(session, HistoryMessage.ROLE_USER, "hello");

        assertEquals(START, session.getCreatedAt());
        assertEquals(START.plus(Duration.ofMinutes(3)), session.getUpdatedAt());
    }

    @Test
    void addMessageShouldNeverExceedMaxHistoryUnderConcurrency() throws InterruptedException {
        ConversationSessionService service = service(null);
        ConversationSession session = service.getOrCreate(TELEGRAM, CHAT, USER);
        int writers = 8;
        int appendsPerWriter = 2000;
        List<Integer> observedSizes = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        for (int w = 0; w < writers; w++) {
            int writer = w;
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < appendsPerWriter; i++) {
                    service.addMessage(session, HistoryMessage.ROLE_USER, writer + ":" + i);
                }
            });
        }
        pool.execute(() -> {
            for (int i = 0; i < 500; i++) {
                observedSizes.add(service.getHistory(session, 0).size());
            }
        });
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(5, service.getHistory(session, 0).size());
        assertTrue(observedSizes.stream().allMatch(size -> size <= 5), "history grew past max: " + observedSizes);
    }

    @Test
    void getHistoryShouldReturnIndependentCopy() {
        ConversationSessionService service = service(null);
        ConversationSession session = service.getOrCreate(TELEGRAM, CHAT, USER);
        service.addMessage(session, HistoryMessage.ROLE_USER, "hello");

        List<HistoryMessage> history = service.getHistory(session, 0);
        history.clear();

        assertEquals(1, service.getHistory(session, 0).size());
    }

    @Test
    void getHistoryShouldHonorLimit() {
        ConversationSessionService service = service(null);
        ConversationSession session = service.getOrCreate(TELEGRAM, CHAT, USER);
        service.addMessage(session, HistoryMessage.ROLE_USER, "a");
        service.addMessage(session, HistoryMessage.ROLE_ASSISTANT, "b");
        service.addMessage(session, HistoryMessage.ROLE_USER, "c");

        assertEquals(List.of("b", "c"),
                service.getHistory(session, 2).stream().map(HistoryMessage::content).toList());
        assertEquals(3, service.getHistory(session, 10).size());
    }

    @Test
    void contextShouldStoreValues() {
        ConversationSessionService service = service(null);
        ConversationSession session = service.getOrCreate(TELEGRAM, CHAT, USER);

        service.setContext(session, "lang", "en");

        assertEquals("en", service.getContext(session, "lang").orElseThrow());
        assertTrue(service.getContext(session, "missing").isEmpty());
    }

    // ====== spawn and notify ======

    @Test
    void spawnShouldNotifyOnceOnSuccess() throws InterruptedException {
        ConversationSessionService service = service((handle, task, history) -> "result for " + task);
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);

        ConversationSession sub = service.spawn(parent, "summarize");

        assertTrue(notified.await(5, TimeUnit.SECONDS));
        drainWorkers();
        assertEquals(1, notifications.size());
        assertEquals(TELEGRAM + "|" + CHAT + "|✅ *Task Complete*\n\n📋 summarize\n\nresult for summarize",
                notifications.get(0));

        SubSessionStatus status = service.getStatus(sub.getId()).orElseThrow();
        assertEquals(SessionStatus.COMPLETE, status.status());
        assertEquals("result for summarize", status.result());
        assertNotNull(status.completedAt());
    }

    @Test
    void spawnShouldNotifyOnceOnFailure() throws InterruptedException {
        ConversationSessionService service = service((handle, task, history) -> {
            throw new IllegalStateException("model unavailable");
        });
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);

        ConversationSession sub = service.spawn(parent, "summarize");

        assertTrue(notified.await(5, TimeUnit.SECONDS));
        drainWorkers();
        assertEquals(1, notifications.size());
        assertTrue(notifications.get(0).endsWith("❌ *Task Failed*\n\n📋 summarize\n\n⚠️ model unavailable"));
        assertEquals("model unavailable", service.getStatus(sub.getId()).orElseThrow().error());
    }

    @Test
    void spawnWithoutTaskRunnerShouldFailInBackground() throws InterruptedException {
        ConversationSessionService service = service(null);
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);

        ConversationSession sub = service.spawn(parent, "anything");

        SubSessionStatus status = awaitTerminal(service, sub.getId());
        assertEquals(SessionStatus.FAILED, status.status());
        assertEquals("no task runner configured", status.error());
    }

    @Test
    void spawnShouldCopyParentIdentityAndHistory() throws InterruptedException {
        properties.getSession().setHistorySnapshotSize(2);
        AtomicReference<List<HistoryMessage>> received = new AtomicReference<>();
        ConversationSessionService service = service((handle, task, history) -> {
            received.set(history);
            return "ok";
        });
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);
        service.addMessage(parent, HistoryMessage.ROLE_USER, "one");
        service.addMessage(parent, HistoryMessage.ROLE_ASSISTANT, "two");
        service.addMessage(parent, HistoryMessage.ROLE_USER, "three");

        ConversationSession sub = service.spawn(parent, "task");

        awaitTerminal(service, sub.getId());
        assertEquals(SessionType.SUB, sub.getType());
        assertEquals(parent.getId(), sub.getParentId());
        assertEquals(USER, sub.getUserId());
        assertEquals(CHAT, sub.getChatId());
        assertTrue(sub.getId().startsWith(parent.getId() + ":sub:"));
        assertEquals(List.of("two", "three"), received.get().stream().map(HistoryMessage::content).toList());
    }

    @Test
    void spawnShouldRejectMissingParent() {
        ConversationSessionService service = service(null);

        assertThrows(IllegalArgumentException.class, () -> service.spawn(null, "task"));
    }

    @Test
    void subSessionIdsShouldBeUnique() {
        ExecutorService idle = mock(ExecutorService.class);
        ConversationSessionService service = new ConversationSessionService(properties, messages, clock, idle,
                timeouts, (TaskRunnerPort) null, notifier);
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);

        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(service.spawn(parent, "t" + i).getId());
        }

        assertEquals(50, ids.size());
        assertEquals(50, service.listSubSessions(parent.getId()).size());
    }

    @Test
    void notificationFailureShouldNotChangeOutcome() throws InterruptedException {
        ConversationSessionService service = service((handle, task, history) -> "done");
        service.setNotifier((platform, chatId, message) -> CompletableFuture
                .failedFuture(new IllegalStateException("platform down")));
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);

        ConversationSession sub = service.spawn(parent, "task");

        assertEquals(SessionStatus.COMPLETE, awaitTerminal(service, sub.getId()).status());
        drainWorkers();
        assertEquals(SessionStatus.COMPLETE, sub.getStatus());
    }

    @Test
    void stalledNotificationShouldNotPinWorker() throws InterruptedException {
        properties.getSession().setNotifyTimeout(Duration.ofMillis(100));
        ConversationSessionService service = service((handle, task, history) -> "done");
        CountDownLatch attempted = new CountDownLatch(1);
        service.setNotifier((platform, chatId, message) -> {
            attempted.countDown();
            return new CompletableFuture<>();
        });

        ConversationSession sub = service.spawn(service.getOrCreate(TELEGRAM, CHAT, USER), "task");

        assertTrue(attempted.await(5, TimeUnit.SECONDS));
        drainWorkers();
        assertEquals(SessionStatus.COMPLETE, sub.getStatus());
    }

    // ====== cancellation and timeout ======

    @Test
    void cancelShouldInterruptRunningTaskWithoutNotification() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        ConversationSessionService service = service((handle, task, history) -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        });
        ConversationSession sub = service.spawn(service.getOrCreate(TELEGRAM, CHAT, USER), "long job");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        service.cancel(sub.getId());

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        drainWorkers();
        SubSessionStatus status = service.getStatus(sub.getId()).orElseThrow();
        assertEquals(SessionStatus.CANCELED, status.status());
        assertNotNull(status.completedAt());
        assertTrue(notifications.isEmpty());
    }

    @Test
    void cancelShouldStopPendingTaskBeforeItStarts() {
        List<Runnable> queued = new ArrayList<>();
        ExecutorService manual = mock(ExecutorService.class);
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(manual).execute(any());
        List<String> calls = new ArrayList<>();
        ConversationSessionService service = new ConversationSessionService(properties, messages, clock, manual,
                timeouts, (handle, task, history) -> {
                    calls.add(task);
                    return "ran";
                }, notifier);
        ConversationSession sub = service.spawn(service.getOrCreate(TELEGRAM, CHAT, USER), "queued");
        assertEquals(SessionStatus.PENDING, sub.getStatus());

        service.cancel(sub.getId());
        queued.forEach(Runnable::run);

        assertEquals(SessionStatus.CANCELED, sub.getStatus());
        assertNotNull(sub.getCompletedAt());
        assertTrue(calls.isEmpty());
        assertTrue(notifications.isEmpty());
    }

    @Test
    void cancelTerminalSessionShouldFailAndKeepState() throws InterruptedException {
        ConversationSessionService service = service((handle, task, history) -> "done");
        ConversationSession sub = service.spawn(service.getOrCreate(TELEGRAM, CHAT, USER), "task");
        SubSessionStatus before = awaitTerminal(service, sub.getId());

        assertThrows(SessionNotRunningException.class, () -> service.cancel(sub.getId()));

        assertEquals(before, service.getStatus(sub.getId()).orElseThrow());
    }

    @Test
    void cancelUnknownSessionShouldFail() {
        ConversationSessionService service = service(null);

        assertThrows(SessionNotFoundException.class, () -> service.cancel("nope"));
    }

    @Test
    void ceilingTimeoutShouldFailAndNotify() throws InterruptedException {
        properties.getSession().setSubSessionTimeout(Duration.ofMillis(200));
        ConversationSessionService service = service((handle, task, history) -> {
            Thread.sleep(10_000);
            return "late";
        });

        ConversationSession sub = service.spawn(service.getOrCreate(TELEGRAM, CHAT, USER), "slow");

        assertTrue(notified.await(5, TimeUnit.SECONDS));
        SubSessionStatus status = service.getStatus(sub.getId()).orElseThrow();
        assertEquals(SessionStatus.FAILED, status.status());
        assertTrue(status.error().startsWith("task timed out after"));
        assertTrue(notifications.get(0).contains("*Task Failed*"));
    }

    @Test
    void resultReturnedAfterCeilingShouldStillComplete() throws InterruptedException {
        properties.getSession().setSubSessionTimeout(Duration.ofMillis(100));
        ConversationSessionService service = service((handle, task, history) -> {
            while (!handle.isCancelled()) {
                Thread.onSpinWait();
            }
            Thread.interrupted();
            return "finished anyway";
        });

        ConversationSession sub = service.spawn(service.getOrCreate(TELEGRAM, CHAT, USER), "stubborn");

        assertTrue(notified.await(5, TimeUnit.SECONDS));
        SubSessionStatus status = service.getStatus(sub.getId()).orElseThrow();
        assertEquals(SessionStatus.COMPLETE, status.status());
        assertEquals("finished anyway", status.result());
        assertTrue(notifications.get(0).contains("*Task Complete*"));
    }

    // ====== listing and clearing ======

    @Test
    void listShouldHideCompleteAndFailedButKeepCanceled() {
        List<Runnable> queued = new ArrayList<>();
        ExecutorService manual = mock(ExecutorService.class);
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(manual).execute(any());
        ConversationSessionService service = new ConversationSessionService(properties, messages, clock, manual,
                timeouts, (handle, task, history) -> {
                    if (task.equals("bad")) {
                        throw new IllegalStateException("bad");
                    }
                    return "ok";
                }, (NotifyPort) null);
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);
        clock.advance(Duration.ofSeconds(1));
        ConversationSession complete = service.spawn(parent, "good");
        clock.advance(Duration.ofSeconds(1));
        ConversationSession failed = service.spawn(parent, "bad");
        clock.advance(Duration.ofSeconds(1));
        ConversationSession canceled = service.spawn(parent, "dropped");
        clock.advance(Duration.ofSeconds(1));
        ConversationSession pending = service.spawn(parent, "waiting");

        queued.get(0).run();
        queued.get(1).run();
        service.cancel(canceled.getId());

        assertEquals(SessionStatus.COMPLETE, complete.getStatus());
        assertEquals(SessionStatus.FAILED, failed.getStatus());
        assertEquals(List.of(parent, canceled, pending), service.list(USER, false));
        assertEquals(List.of(parent, complete, failed, canceled, pending), service.list("", true));
        assertTrue(service.list("someone-else", true).isEmpty());
    }

    @Test
    void clearShouldRemoveOnlyOldTerminalSessions() {
        List<Runnable> queued = new ArrayList<>();
        ExecutorService manual = mock(ExecutorService.class);
        doAnswer(invocation -> queued.add(invocation.getArgument(0))).when(manual).execute(any());
        ConversationSessionService service = new ConversationSessionService(properties, messages, clock, manual,
                timeouts, (handle, task, history) -> "ok", (NotifyPort) null);
        ConversationSession parent = service.getOrCreate(TELEGRAM, CHAT, USER);
        ConversationSession oldComplete = service.spawn(parent, "old");
        ConversationSession oldCanceled = service.spawn(parent, "old-canceled");
        ConversationSession stillPending = service.spawn(parent, "pending");
        queued.get(0).run();
        service.cancel(oldCanceled.getId());

        clock.advance(Duration.ofHours(2));
        ConversationSession recent = service.spawn(parent, "recent");
        queued.get(3).run();

        int removed = service.clear(Duration.ofHours(1));

        assertEquals(2, removed);
        assertTrue(service.get(oldComplete.getId()).isEmpty());
        assertTrue(service.get(oldCanceled.getId()).isEmpty());
        assertTrue(service.get(stillPending.getId()).isPresent());
        assertTrue(service.get(recent.getId()).isPresent());
        assertTrue(service.get(parent.getId()).isPresent());
    }

    // ====== notification text ======

    @Test
    void formatNotificationShouldTruncateLongFields() {
        String task = "t".repeat(150);
        String result = "r".repeat(1500);

        String message = service(null).formatNotification(task,
                new SubSessionStatus(SessionStatus.COMPLETE, result, null, START));

        assertTrue(message.contains("📋 " + "t".repeat(97) + "...\n\n"));
        assertTrue(message.endsWith("r".repeat(997) + "..."));
    }

    @Test
    void formatNotificationShouldUseConfiguredLanguage() {
        properties.setLanguage(MessageService.LANG_RU);
        messages = new MessageService(properties);

        String message = service(null).formatNotification("report",
                new SubSessionStatus(SessionStatus.FAILED, null, "boom", START));

        assertEquals("❌ *Задача не выполнена*\n\n📋 report\n\n⚠️ boom", message);
    }

    private ConversationSessionService service(TaskRunnerPort runner) {
        return new ConversationSessionService(properties, messages, clock, workers, timeouts, runner, notifier);
    }

    private void drainWorkers() throws InterruptedException {
        workers.shutdown();
        assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS));
    }

    private static SubSessionStatus awaitTerminal(ConversationSessionService service, String id)
            throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            SubSessionStatus status = service.getStatus(id).orElseThrow();
            if (status.isTerminal()) {
                return status;
            }
            Thread.sleep(20);
        }
        return fail("session did not finish: " + id);
    }
}
