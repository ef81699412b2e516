package me.relaygate.gateway.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaygate.gateway.domain.model.MessageRecord;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.outbound.MessageStoragePort;
import me.relaygate.gateway.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSONL-backed message store on top of {@link StoragePort}.
 *
 * <p>
 * Layout under the workspace:
 * <ul>
 * <li>{@code messages/<platform>/<yyyy-MM-dd>.jsonl} - one {@link MessageRecord}
 * per line, day taken from the record timestamp (UTC)</li>
 * <li>{@code audit/audit_log.jsonl} - audit rows such as
 * {@code unauthorized}</li>
 * </ul>
 *
 * <p>
 * Writes block until the line is on disk. I/O failures propagate as runtime
 * exceptions; callers decide whether they are fatal.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlMessageStore implements MessageStoragePort {

    static final String AUDIT_FILE = "audit_log.jsonl";
    private static final String JSONL_SUFFIX = ".jsonl";
    private static final String NEWLINE = "\n";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    @Override
    public void saveMessage(MessageRecord record) {
        Instant timestamp = record.getTimestamp() != null ? record.getTimestamp() : clock.instant();
        record.setTimestamp(timestamp);

        String day = LocalDate.ofInstant(timestamp, ZoneOffset.UTC).toString();
        String path = record.getPlatform() + "/" + day + JSONL_SUFFIX;
        storagePort.appendText(messagesDirectory(), path, toLine(record)).join();
    }

    @Override
    public void auditLog(String platform, String hashedUserId, String action, String details) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant());
        row.put("platform", platform);
        row.put("user_id", hashedUserId);
        row.put("action", action);
        row.put("details", details);
        storagePort.appendText(auditDirectory(), AUDIT_FILE, toLine(row)).join();
    }

    @Override
    public List<MessageRecord> loadMessages(String platform, String chatId, int limit) {
        List<String> files = storagePort.listObjects(messagesDirectory(), platform).join();
        if (files.isEmpty() || limit <= 0) {
            return Collections.emptyList();
        }

        List<String> dayFiles = new ArrayList<>(files.stream()
                .filter(file -> file.endsWith(JSONL_SUFFIX))
                .sorted()
                .toList());
        Collections.reverse(dayFiles);

        List<MessageRecord> newestFirst = new ArrayList<>();
        for (String file : dayFiles) {
            String content = storagePort.getText(messagesDirectory(), file).join();
            if (content == null) {
                continue;
            }
            List<MessageRecord> dayRecords = parseLines(content, chatId);
            Collections.reverse(dayRecords);
            for (MessageRecord record : dayRecords) {
                newestFirst.add(record);
                if (newestFirst.size() == limit) {
                    break;
                }
            }
            if (newestFirst.size() == limit) {
                break;
            }
        }

        Collections.reverse(newestFirst);
        return newestFirst;
    }

    private List<MessageRecord> parseLines(String content, String chatId) {
        List<MessageRecord> records = new ArrayList<>();
        for (String line : content.split(NEWLINE)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                MessageRecord record = objectMapper.readValue(line, MessageRecord.class);
                if (chatId.equals(record.getChatId())) {
                    records.add(record);
                }
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping malformed message line: {}", e.getOriginalMessage());
            }
        }
        return records;
    }

    private String toLine(Object value) {
        try {
            return objectMapper.writeValueAsString(value) + NEWLINE;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record", e);
        }
    }

    private String messagesDirectory() {
        return properties.getStorage().getMessagesDirectory();
    }

    private String auditDirectory() {
        return properties.getStorage().getAuditDirectory();
    }
}
