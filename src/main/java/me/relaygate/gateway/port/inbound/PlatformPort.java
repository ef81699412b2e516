package me.relaygate.gateway.port.inbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Capability interface of a chat platform adapter (Telegram, Discord, Slack,
 * etc.). Adapters translate wire-level events into
 * {@link me.relaygate.gateway.domain.model.InboundMessage}s, pass them to the
 * registered {@link MessageHandler} and transmit whatever it returns.
 */
public interface PlatformPort {

    /**
     * Returns the platform name used as registry key (e.g., "telegram").
     */
    String getName();

    /**
     * Starts receiving messages from the platform.
     */
    void start();

    /**
     * Stops receiving messages and disconnects.
     */
    void stop();

    /**
     * Sends a text message to the specified chat.
     */
    CompletableFuture<Void> sendMessage(String chatId, String text);

    /**
     * Registers the callback invoked for every inbound message.
     */
    void onMessage(MessageHandler handler);
}
