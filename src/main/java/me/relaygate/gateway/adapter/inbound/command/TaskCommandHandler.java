package me.relaygate.gateway.adapter.inbound.command;

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

import me.relaygate.gateway.domain.exception.SessionNotFoundException;
import me.relaygate.gateway.domain.exception.SessionNotRunningException;
import me.relaygate.gateway.domain.model.ConversationSession;
import me.relaygate.gateway.domain.model.InboundMessage;
import me.relaygate.gateway.domain.model.SessionStatus;
import me.relaygate.gateway.domain.model.SubSessionStatus;
import me.relaygate.gateway.domain.service.ConversationSessionService;
import me.relaygate.gateway.infrastructure.i18n.MessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Handles the {@code /task} command family for background sub-sessions.
 *
 * <ul>
 * <li>/task spawn|run|bg &lt;text&gt; - run a task in the background
 * <li>/task list|ls - list the sender's active sessions
 * <li>/task status &lt;id&gt; - show a session, matched by ID prefix
 * <li>/task cancel|stop &lt;id&gt; - cancel a pending or running task
 * <li>/task clear - drop finished tasks older than an hour
 * <li>/task help - usage
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TaskCommandHandler {

    static final String COMMAND = "task";
    static final Duration CLEAR_OLDER_THAN = Duration.ofHours(1);

    private static final int TASK_PREVIEW = 100;
    private static final int LIST_TASK_PREVIEW = 50;
    private static final int RESULT_PREVIEW = 500;
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

    private final ConversationSessionService sessionService;
    private final MessageService messageService;
    private final Clock clock;

    /**
     * Executes {@code /task} with the words after the command name.
     */
    public String handle(InboundMessage message, List<String> args) {
        if (args.isEmpty()) {
            return msg("task.help");
        }

        String subcommand = args.get(0).toLowerCase(Locale.ROOT);
        List<String> subArgs = args.subList(1, args.size());
        return switch (subcommand) {
        case "spawn", "run", "bg" -> spawn(message, subArgs);
        case "list", "ls" -> list(message.getUserId());
        case "status" -> status(subArgs);
        case "cancel", "stop" -> cancel(subArgs);
        case "clear" -> clear();
        case "help" -> msg("task.help");
        default -> msg("task.unknown", subcommand);
        };
    }

    private String spawn(InboundMessage message, List<String> args) {
        if (args.isEmpty()) {
            return msg("task.spawn.usage");
        }
        String task = String.join(" ", args);
        ConversationSession parent = sessionService.getOrCreate(message.getPlatform(), message.getChatId(),
                message.getUserId());
        ConversationSession sub = sessionService.spawn(parent, task);
        log.info("[Tasks] Spawned sub-session: id={}", sub.getId());
        return msg("task.spawn.done", truncate(task, TASK_PREVIEW), sub.getId());
    }

    private String list(String userId) {
        List<ConversationSession> sessions = sessionService.list(userId, false);
        if (sessions.isEmpty()) {
            return msg("task.list.empty");
        }

        StringBuilder sb = new StringBuilder();
        sb.append(msg("task.list.title", sessions.size())).append("\n\n");
        for (ConversationSession session : sessions) {
            sb.append(icon(session.getStatus())).append(" `").append(session.getId()).append("` [")
                    .append(session.getType().name().toLowerCase(Locale.ROOT)).append("]\n");
            if (session.getTask() != null && !session.getTask().isEmpty()) {
                sb.append("   ").append(msg("task.list.task", truncate(session.getTask(), LIST_TASK_PREVIEW)))
                        .append("\n");
            }
        }
        return sb.toString();
    }

    private String status(List<String> args) {
        if (args.isEmpty()) {
            return msg("task.status.usage");
        }
        String prefix = args.get(0);
        return findByPrefix(prefix, true)
                .map(this::formatStatus)
                .orElseGet(() -> msg("task.notFound", prefix));
    }

    private String cancel(List<String> args) {
        if (args.isEmpty()) {
            return msg("task.cancel.usage");
        }
        String prefix = args.get(0);
        Optional<ConversationSession> match = findByPrefix(prefix, false);
        if (match.isEmpty()) {
            return msg("task.notFound", prefix);
        }
        String sessionId = match.get().getId();
        try {
            sessionService.cancel(sessionId);
            return msg("task.cancel.done", sessionId);
        } catch (SessionNotFoundException | SessionNotRunningException e) {
            return msg("task.cancel.failed", e.getMessage());
        }
    }

    private String clear() {
        int count = sessionService.clear(CLEAR_OLDER_THAN);
        return msg("task.clear.done", count);
    }

    private Optional<ConversationSession> findByPrefix(String prefix, boolean includeComplete) {
        return sessionService.list("", includeComplete).stream()
                .filter(session -> session.getId().startsWith(prefix))
                .findFirst();
    }

    private String formatStatus(ConversationSession session) {
        SubSessionStatus outcome = session.statusSnapshot();
        DateTimeFormatter time = TIME.withZone(clock.getZone());

        StringBuilder sb = new StringBuilder();
        sb.append(msg("task.status.title", icon(outcome.status()))).append("\n\n");
        sb.append(msg("task.status.id", session.getId())).append("\n");
        sb.append(msg("task.status.type", session.getType().name().toLowerCase(Locale.ROOT))).append("\n");
        sb.append(msg("task.status.status", outcome.status().getValue())).append("\n");
        if (session.getTask() != null && !session.getTask().isEmpty()) {
            sb.append("\n").append(msg("task.status.task")).append("\n").append(session.getTask()).append("\n");
        }
        if (outcome.result() != null && !outcome.result().isEmpty()) {
            sb.append("\n").append(msg("task.status.result")).append("\n")
                    .append(truncate(outcome.result(), RESULT_PREVIEW)).append("\n");
        }
        if (outcome.error() != null && !outcome.error().isEmpty()) {
            sb.append("\n").append(msg("task.status.error")).append("\n").append(outcome.error()).append("\n");
        }
        sb.append("\n").append(msg("task.status.created", time.format(session.getCreatedAt())));
        if (outcome.completedAt() != null) {
            sb.append("\n").append(msg("task.status.completed", time.format(outcome.completedAt())));
        }
        return sb.toString();
    }

    private static String icon(SessionStatus status) {
        return switch (status) {
        case COMPLETE -> "✅";
        case FAILED -> "❌";
        case PENDING -> "⏳";
        case CANCELED -> "🚫";
        default -> "🔄";
        };
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }

    private static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max - 3) + "...";
    }
}
