package me.relaygate.gateway.domain.model;

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

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversation state for one chat ({@code platform:chatId}) or one background
 * sub-task ({@code parentId:sub:N}).
 *
 * <p>
 * Identity fields are immutable. Everything else (status, outcome, history,
 * context, timestamps) is guarded by the session's own monitor, so every
 * mutation of one session is mutually exclusive while different sessions never
 * contend. History is trimmed on every append and never holds more than the
 * configured maximum. {@code completedAt} is set exactly when the status
 * becomes terminal.
 */
public class ConversationSession {

    @Getter
    private final String id;
    @Getter
    private final SessionType type;
    @Getter
    private final String parentId;
    @Getter
    private final String userId;
    @Getter
    private final String platform;
    @Getter
    private final String chatId;
    @Getter
    private final String task;
    @Getter
    private final Instant createdAt;

    private final CancellationHandle cancellation;
    private final List<HistoryMessage> messages = new ArrayList<>();
    private final Map<String, Object> context = new HashMap<>();

    private SessionStatus status;
    private String result;
    private String error;
    private Instant updatedAt;
    private Instant completedAt;

    @Builder
    private ConversationSession(String id, SessionType type, String parentId, String userId, String platform,
            String chatId, String task, SessionStatus status, Instant createdAt) {
        this.id = id;
        this.type = type != null ? type : SessionType.MAIN;
        this.parentId = parentId;
        this.userId = userId;
        this.platform = platform;
        this.chatId = chatId;
        this.task = task;
        this.status = status != null ? status : SessionStatus.RUNNING;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.cancellation = this.type == SessionType.SUB ? new CancellationHandle() : null;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized Instant getUpdatedAt() {
        return updatedAt;
    }

    public synchronized Instant getCompletedAt() {
        return completedAt;
    }

    public synchronized SubSessionStatus statusSnapshot() {
        return new SubSessionStatus(status, result, error, completedAt);
    }

    // ==================== history ====================

    /**
     * Appends an entry and drops the oldest ones beyond {@code maxHistory}.
     */
    public synchronized void appendMessage(HistoryMessage message, int maxHistory) {
        messages.add(message);
        updatedAt = message.timestamp();

        int overflow = messages.size() - maxHistory;
        if (overflow > 0) {
            messages.subList(0, overflow).clear();
        }
    }

    /**
     * Returns a detached copy of the most recent {@code limit} entries. A limit
     * of zero or one exceeding the stored count returns everything.
     */
    public synchronized List<HistoryMessage> recentMessages(int limit) {
        int size = messages.size();
        if (limit <= 0 || limit > size) {
            limit = size;
        }
        return new ArrayList<>(messages.subList(size - limit, size));
    }

    // ==================== context ====================

    public synchronized void putContext(String key, Object value) {
        context.put(key, value);
    }

    public synchronized Optional<Object> getContextValue(String key) {
        return Optional.ofNullable(context.get(key));
    }

    // ==================== lifecycle ====================

    /**
     * Moves a pending sub-session to running. Returns {@code false} when it was
     * canceled before the worker picked it up.
     */
    public synchronized boolean markRunning(Instant now) {
        if (status != SessionStatus.PENDING) {
            return false;
        }
        status = SessionStatus.RUNNING;
        updatedAt = now;
        return true;
    }

    /**
     * Records a successful outcome. Ignored unless the session is running.
     */
    public synchronized boolean complete(String taskResult, Instant now) {
        if (status != SessionStatus.RUNNING) {
            return false;
        }
        status = SessionStatus.COMPLETE;
        result = taskResult;
        completedAt = now;
        updatedAt = now;
        return true;
    }

    /**
     * Records a failed outcome. Ignored unless the session is running.
     */
    public synchronized boolean fail(String errorText, Instant now) {
        if (status != SessionStatus.RUNNING) {
            return false;
        }
        status = SessionStatus.FAILED;
        error = errorText;
        completedAt = now;
        updatedAt = now;
        return true;
    }

    /**
     * Cancels a pending or running session, triggering its cancellation handle.
     * Returns {@code false} when the session is already terminal.
     */
    public synchronized boolean cancel(Instant now) {
        if (!status.isActive()) {
            return false;
        }
        if (cancellation != null) {
            cancellation.cancel(CancellationHandle.Reason.CANCELED);
        }
        status = SessionStatus.CANCELED;
        completedAt = now;
        updatedAt = now;
        return true;
    }

    public synchronized boolean isCompletedBefore(Instant cutoff) {
        return status.isTerminal() && completedAt != null && completedAt.isBefore(cutoff);
    }

    /**
     * Handle bound to the worker for the whole execution, regardless of status.
     */
    public CancellationHandle executionHandle() {
        return cancellation;
    }
}
