package me.relaygate.gateway.port.outbound;

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

import me.relaygate.gateway.domain.model.MessageRecord;

import java.util.List;

/**
 * Durable append-only storage of encrypted message records and audit rows.
 * Failures surface as runtime exceptions.
 */
public interface MessageStoragePort {

    void saveMessage(MessageRecord record);

    /**
     * Records an audit row (e.g. action "unauthorized") for a hashed user.
     */
    void auditLog(String platform, String hashedUserId, String action, String details);

    /**
     * Returns up to {@code limit} most recent records of a chat, oldest first.
     */
    List<MessageRecord> loadMessages(String platform, String chatId, int limit);
}
