package me.relaygate.gateway.domain.service;

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

import me.relaygate.gateway.domain.exception.NoTaskRunnerConfiguredException;
import me.relaygate.gateway.domain.exception.SessionNotFoundException;
import me.relaygate.gateway.domain.exception.SessionNotRunningException;
import me.relaygate.gateway.domain.model.CancellationHandle;
import me.relaygate.gateway.domain.model.ConversationSession;
import me.relaygate.gateway.domain.model.HistoryMessage;
import me.relaygate.gateway.domain.model.SessionStatus;
import me.relaygate.gateway.domain.model.SessionType;
import me.relaygate.gateway.domain.model.SubSessionStatus;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.infrastructure.i18n.MessageService;
import me.relaygate.gateway.port.outbound.NotifyPort;
import me.relaygate.gateway.port.outbound.TaskRunnerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns conversation sessions and the background sub-sessions spawned from
 * them.
 *
 * <p>
 * Main sessions are keyed by {@code platform:chatId} and created on first use.
 * Sub-sessions get the ID {@code <parentId>:sub:<n>} from a counter that never
 * repeats within the service lifetime, run on the sub-session executor, and are
 * bounded by {@code gateway.session.sub-session-timeout}. Both an explicit
 * {@link #cancel(String)} and the ceiling trigger the same
 * {@link CancellationHandle}.
 *
 * <p>
 * A sub-session that completes or fails sends exactly one notification to its
 * chat through {@link NotifyPort}, waiting at most
 * {@code gateway.session.notify-timeout} for delivery. A canceled one stays
 * canceled and sends nothing. Notification failures are logged and otherwise
 * ignored.
 *
 * <p>
 * The session table is a {@link ConcurrentHashMap}; per-session mutations are
 * serialized by the session itself.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class ConversationSessionService {

    static final int NOTIFY_TASK_LIMIT = 100;
    static final int NOTIFY_RESULT_LIMIT = 1000;

    private final GatewayProperties properties;
    private final MessageService messageService;
    private final Clock clock;
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong subCounter = new AtomicLong();

    private volatile TaskRunnerPort taskRunner;
    private volatile NotifyPort notifier;

    @Autowired
    public ConversationSessionService(GatewayProperties properties, MessageService messageService, Clock clock,
            @Qualifier("subSessionExecutor") ExecutorService workerExecutor,
            @Qualifier("subSessionTimeoutScheduler") ScheduledExecutorService timeoutScheduler,
            ObjectProvider<TaskRunnerPort> taskRunner, ObjectProvider<NotifyPort> notifier) {
        this(properties, messageService, clock, workerExecutor, timeoutScheduler, taskRunner.getIfAvailable(),
                notifier.getIfAvailable());
    }

    public ConversationSessionService(GatewayProperties properties, MessageService messageService, Clock clock,
            ExecutorService workerExecutor, ScheduledExecutorService timeoutScheduler, TaskRunnerPort taskRunner,
            NotifyPort notifier) {
        this.properties = properties;
        this.messageService = messageService;
        this.clock = clock;
        this.workerExecutor = workerExecutor;
        this.timeoutScheduler = timeoutScheduler;
        this.taskRunner = taskRunner;
        this.notifier = notifier;
    }

    public void setTaskRunner(TaskRunnerPort taskRunner) {
        this.taskRunner = taskRunner;
    }

    public void setNotifier(NotifyPort notifier) {
        this.notifier = notifier;
    }

    // ==================== SESSIONS ====================

    /**
     * Returns the main session of a chat, creating it on first use. Concurrent
     * callers for the same chat always get the same instance.
     */
    public ConversationSession getOrCreate(String platform, String chatId, String userId) {
        String key = platform + ":" + chatId;
        return sessions.computeIfAbsent(key, id -> {
            log.debug("[Sessions] Created session: id={}", id);
            return ConversationSession.builder()
                    .id(id)
                    .type(SessionType.MAIN)
                    .userId(userId)
                    .platform(platform)
                    .chatId(chatId)
                    .status(SessionStatus.RUNNING)
                    .createdAt(clock.instant())
                    .build();
        });
    }

    public Optional<ConversationSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Appends a history entry, keeping only the most recent
     * {@code gateway.session.max-history} entries.
     */
    public void addMessage(ConversationSession session, String role, String content) {
        session.appendMessage(new HistoryMessage(role, content, clock.instant()), maxHistory());
    }

    /**
     * Most recent {@code limit} history entries as an independent copy; zero or
     * a limit above the stored count returns everything.
     */
    public List<HistoryMessage> getHistory(ConversationSession session, int limit) {
        return session.recentMessages(limit);
    }

    public void setContext(ConversationSession session, String key, Object value) {
        session.putContext(key, value);
    }

    /**
     * Context value for {@code key}, empty when it was never set.
     */
    public Optional<Object> getContext(ConversationSession session, String key) {
        return session.getContextValue(key);
    }

    // ==================== SUB-SESSIONS ====================

    /**
     * Creates a pending sub-session for {@code task} and starts it in the
     * background. Returns immediately.
     *
     * @throws IllegalArgumentException
     *             if {@code parent} is null
     */
    public ConversationSession spawn(ConversationSession parent, String task) {
        if (parent == null) {
            throw new IllegalArgumentException("parent session is required");
        }

        String subId = parent.getId() + ":sub:" + subCounter.incrementAndGet();
        ConversationSession sub = ConversationSession.builder()
                .id(subId)
                .type(SessionType.SUB)
                .parentId(parent.getId())
                .userId(parent.getUserId())
                .platform(parent.getPlatform())
                .chatId(parent.getChatId())
                .task(task)
                .status(SessionStatus.PENDING)
                .createdAt(clock.instant())
                .build();
        sessions.put(subId, sub);

        try {
            workerExecutor.execute(() -> runSubSession(sub));
        } catch (RejectedExecutionException e) {
            log.error("[Sessions] Sub-session rejected by executor: id={}", subId);
            sub.markRunning(clock.instant());
            sub.fail("executor rejected task: " + e.getMessage(), clock.instant());
        }
        return sub;
    }

    /**
     * Cancels a pending or running session.
     *
     * @throws SessionNotFoundException
     *             if no session has that ID
     * @throws SessionNotRunningException
     *             if the session is already terminal
     */
    public void cancel(String sessionId) {
        ConversationSession session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        if (!session.cancel(clock.instant())) {
            throw new SessionNotRunningException(sessionId);
        }
        log.info("[Sessions] Canceled session: id={}", sessionId);
    }

    /**
     * Outcome snapshot of a session, for callers polling until it is terminal.
     */
    public Optional<SubSessionStatus> getStatus(String sessionId) {
        return get(sessionId).map(ConversationSession::statusSnapshot);
    }

    // ==================== LISTING ====================

    /**
     * Sessions of a user (all users when {@code userId} is empty), oldest
     * first. Without {@code includeComplete}, complete and failed sessions are
     * left out while canceled ones are kept.
     */
    public List<ConversationSession> list(String userId, boolean includeComplete) {
        List<ConversationSession> result = new ArrayList<>();
        for (ConversationSession session : sessions.values()) {
            if (userId != null && !userId.isEmpty() && !userId.equals(session.getUserId())) {
                continue;
            }
            SessionStatus status = session.getStatus();
            if (!includeComplete && (status == SessionStatus.COMPLETE || status == SessionStatus.FAILED)) {
                continue;
            }
            result.add(session);
        }
        result.sort(Comparator.comparing(ConversationSession::getCreatedAt));
        return result;
    }

    public List<ConversationSession> listSubSessions(String parentId) {
        List<ConversationSession> result = new ArrayList<>();
        for (ConversationSession session : sessions.values()) {
            if (parentId != null && parentId.equals(session.getParentId())) {
                result.add(session);
            }
        }
        result.sort(Comparator.comparing(ConversationSession::getCreatedAt));
        return result;
    }

    /**
     * Removes terminal sessions completed more than {@code olderThan} ago.
     * Pending and running sessions are never removed.
     *
     * @return number of sessions removed
     */
    public int clear(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        for (Map.Entry<String, ConversationSession> entry : sessions.entrySet()) {
            if (entry.getValue().isCompletedBefore(cutoff) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("[Sessions] Cleared {} finished sessions", removed);
        }
        return removed;
    }

    // ==================== EXECUTION ====================

    private void runSubSession(ConversationSession sub) {
        if (!sub.markRunning(clock.instant())) {
            log.debug("[Sessions] Sub-session canceled before start: id={}", sub.getId());
            return;
        }
        log.info("[Sessions] Starting sub-session: id={}", sub.getId());

        CancellationHandle handle = sub.executionHandle();
        Duration ceiling = properties.getSession().getSubSessionTimeout();
        handle.bind(Thread.currentThread());
        ScheduledFuture<?> timeout = timeoutScheduler.schedule(
                () -> handle.cancel(CancellationHandle.Reason.TIMEOUT), ceiling.toMillis(), TimeUnit.MILLISECONDS);
        try {
            execute(sub, handle, ceiling);
        } finally {
            timeout.cancel(false);
            handle.unbind();
            // drop a late interrupt from cancel so notification I/O is unaffected
            Thread.interrupted();
        }

        notifyCompletion(sub);
    }

    private void execute(ConversationSession sub, CancellationHandle handle, Duration ceiling) {
        TaskRunnerPort runner = taskRunner;
        if (runner == null) {
            String error = new NoTaskRunnerConfiguredException().getMessage();
            sub.fail(error, clock.instant());
            log.warn("[Sessions] Sub-session failed: id={}, error={}", sub.getId(), error);
            return;
        }

        List<HistoryMessage> history = get(sub.getParentId())
                .map(parent -> parent.recentMessages(properties.getSession().getHistorySnapshotSize()))
                .orElseGet(List::of);

        try {
            String result = runner.execute(handle, sub.getTask(), history);
            if (sub.complete(result, clock.instant())) {
                log.info("[Sessions] Sub-session completed: id={}", sub.getId());
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            recordFailure(sub, timedOut(handle) ? timeoutMessage(ceiling) : describe(e));
        }
    }

    private void recordFailure(ConversationSession sub, String error) {
        if (sub.fail(error, clock.instant())) {
            log.warn("[Sessions] Sub-session failed: id={}, error={}", sub.getId(), error);
        }
    }

    private void notifyCompletion(ConversationSession sub) {
        NotifyPort target = notifier;
        SubSessionStatus outcome = sub.statusSnapshot();
        if (target == null || outcome.status() == SessionStatus.CANCELED) {
            return;
        }

        String message = formatNotification(sub.getTask(), outcome);
        Duration notifyTimeout = properties.getSession().getNotifyTimeout();
        try {
            target.notify(sub.getPlatform(), sub.getChatId(), message)
                    .get(notifyTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Sessions] Interrupted while notifying: id={}", sub.getId());
        } catch (TimeoutException e) {
            log.error("[Sessions] Notification not delivered within {}s: id={}", notifyTimeout.toSeconds(),
                    sub.getId());
        } catch (ExecutionException e) {
            log.error("[Sessions] Failed to notify: id={}, error={}", sub.getId(), describe(e.getCause()));
        } catch (RuntimeException e) {
            log.error("[Sessions] Failed to notify: id={}, error={}", sub.getId(), e.getMessage());
        }
    }

    String formatNotification(String task, SubSessionStatus outcome) {
        if (outcome.status() == SessionStatus.COMPLETE) {
            return messageService.getMessage("task.notify.complete", truncate(task, NOTIFY_TASK_LIMIT),
                    truncate(outcome.result(), NOTIFY_RESULT_LIMIT));
        }
        return messageService.getMessage("task.notify.failed", truncate(task, NOTIFY_TASK_LIMIT), outcome.error());
    }

    private static boolean timedOut(CancellationHandle handle) {
        return handle.getReason().filter(reason -> reason == CancellationHandle.Reason.TIMEOUT).isPresent();
    }

    private static String timeoutMessage(Duration ceiling) {
        return "task timed out after " + ceiling.toSeconds() + "s";
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 3) + "...";
    }

    private int maxHistory() {
        int configured = properties.getSession().getMaxHistory();
        return configured > 0 ? configured : 50;
    }
}
