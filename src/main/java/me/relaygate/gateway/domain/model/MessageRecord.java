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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted copy of a message passing through the gateway. The content is
 * always vault ciphertext and the user ID is hashed (or {@code "bot"} for
 * outbound replies).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageRecord {

    public static final String DIRECTION_IN = "in";
    public static final String DIRECTION_OUT = "out";
    public static final String BOT_USER_ID = "bot";

    private String platform;
    private String chatId;
    private String userId;
    private String username;
    private String content;
    private Instant timestamp;
    private String direction;
}
