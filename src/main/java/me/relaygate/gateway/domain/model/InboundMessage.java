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
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A message received from a chat platform, normalized by its adapter. Produced
 * once per inbound event and consumed once by the routing pipeline, which may
 * replace {@link #text} when a pre-message hook rewrites it.
 */
@Data
@Builder
public class InboundMessage {

    private String platform;
    private String chatId;
    private String userId;
    private String username;
    private String text;

    // File paths for images/voice/documents
    @Builder.Default
    private List<String> media = new ArrayList<>();

    private Instant timestamp;

    // Platform-specific payload, opaque to the gateway
    private Object raw;

    /**
     * A message is a group message when it was posted in a chat other than the
     * sender's direct chat.
     */
    public boolean isGroupMessage() {
        return chatId != null && !chatId.equals(userId);
    }

    /**
     * Checks if the text starts with the given command prefix.
     */
    public boolean isCommand(String prefix) {
        return text != null && prefix != null && !prefix.isEmpty() && text.startsWith(prefix);
    }
}
