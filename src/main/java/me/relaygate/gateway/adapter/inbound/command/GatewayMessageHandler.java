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

import me.relaygate.gateway.domain.model.CancellationHandle;
import me.relaygate.gateway.domain.model.ConversationSession;
import me.relaygate.gateway.domain.model.HistoryMessage;
import me.relaygate.gateway.domain.model.InboundMessage;
import me.relaygate.gateway.domain.service.ConversationSessionService;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.inbound.MessageHandler;
import me.relaygate.gateway.port.outbound.TaskRunnerPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Default application handler installed on the router.
 *
 * <p>
 * {@code /task ...} goes to {@link TaskCommandHandler}. Any other text is
 * recorded in the chat's conversation session; when a {@link TaskRunnerPort}
 * is available it is run synchronously on the recent history and its reply is
 * recorded and returned. Without a runner the handler stays silent.
 */
@Component
@Slf4j
public class GatewayMessageHandler implements MessageHandler {

    private final ConversationSessionService sessionService;
    private final TaskCommandHandler taskCommands;
    private final GatewayProperties properties;
    private final TaskRunnerPort taskRunner;

    @Autowired
    public GatewayMessageHandler(ConversationSessionService sessionService, TaskCommandHandler taskCommands,
            GatewayProperties properties, ObjectProvider<TaskRunnerPort> taskRunner) {
        this(sessionService, taskCommands, properties, taskRunner.getIfAvailable());
    }

    public GatewayMessageHandler(ConversationSessionService sessionService, TaskCommandHandler taskCommands,
            GatewayProperties properties, TaskRunnerPort taskRunner) {
        this.sessionService = sessionService;
        this.taskCommands = taskCommands;
        this.properties = properties;
        this.taskRunner = taskRunner;
    }

    @Override
    public String handle(InboundMessage message) {
        String text = message.getText() != null ? message.getText() : "";

        if (message.isCommand(properties.getCommandPrefix())) {
            List<String> words = Arrays.asList(text.substring(properties.getCommandPrefix().length()).trim()
                    .split("\\s+"));
            if (!words.isEmpty() && TaskCommandHandler.COMMAND.equals(words.get(0).toLowerCase(Locale.ROOT))) {
                return taskCommands.handle(message, words.subList(1, words.size()));
            }
        }

        ConversationSession session = sessionService.getOrCreate(message.getPlatform(), message.getChatId(),
                message.getUserId());
        List<HistoryMessage> history = sessionService.getHistory(session,
                properties.getSession().getHistorySnapshotSize());
        sessionService.addMessage(session, HistoryMessage.ROLE_USER, text);

        if (taskRunner == null) {
            return "";
        }

        String reply;
        try {
            reply = taskRunner.execute(new CancellationHandle(), text, history);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("task runner interrupted", e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("task runner failed: " + e.getMessage(), e);
        }

        if (reply != null && !reply.isEmpty()) {
            sessionService.addMessage(session, HistoryMessage.ROLE_ASSISTANT, reply);
        }
        log.debug("[Handler] Replied in session {}", session.getId());
        return reply != null ? reply : "";
    }
}
