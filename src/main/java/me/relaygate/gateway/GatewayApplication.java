package me.relaygate.gateway;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Relaygate chat gateway.
 *
 * <p>
 * Relaygate accepts messages from several independent chat platforms, runs
 * every inbound message through a security pipeline and hands authorized
 * traffic to a pluggable response handler.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Security Pipeline</b> - lockout, authorization, rate limiting,
 * encrypted persistence and hook interception, in that order</li>
 * <li><b>Conversation Sessions</b> - bounded per-chat history with arbitrary
 * context values</li>
 * <li><b>Sub-sessions</b> - cancellable background tasks that report back to
 * the originating chat when done</li>
 * <li><b>Hooks</b> - shell scripts triggered by lifecycle events that can
 * block or rewrite in-flight text</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → PlatformPort adapters, GatewayMessageHandler
 * Domain Layer       → MessageRouter, ConversationSessionService
 * Infrastructure     → Storage/Audit/Hook adapters, Vault, Rate limiting
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code gateway.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }

}
