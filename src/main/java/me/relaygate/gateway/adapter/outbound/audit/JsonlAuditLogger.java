package me.relaygate.gateway.adapter.outbound.audit;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaygate.gateway.domain.model.SecurityEvent;
import me.relaygate.gateway.domain.model.SecurityEventType;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.outbound.AuditPort;
import me.relaygate.gateway.port.outbound.StoragePort;
import me.relaygate.gateway.security.UserIdHasher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Security event trail written as JSON lines to {@code audit/security.log}.
 *
 * <p>
 * User IDs are hashed before they are written. Events without a severity get
 * one inferred from their type. Once the file reaches
 * {@code gateway.audit.max-file-bytes} it is renamed to
 * {@code security.log.<yyyyMMdd-HHmmss>} and a fresh file is started.
 *
 * <p>
 * Every failure is logged and dropped; auditing never interrupts message
 * processing. Disabled with {@code gateway.audit.enabled=false}, in which case
 * the router falls back to {@link AuditPort#noop()}.
 *
 * @since 1.0
 */
@Component
@ConditionalOnProperty(prefix = "gateway.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class JsonlAuditLogger implements AuditPort {

    static final String LOG_FILE = "security.log";
    private static final DateTimeFormatter ROTATION_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    private final Object writeLock = new Object();

    @Override
    public void log(SecurityEvent event) {
        if (event.getTimestamp() == null) {
            event.setTimestamp(clock.instant());
        }
        if (event.getSeverity() == null || event.getSeverity().isEmpty()) {
            event.setSeverity(event.getEventType() != null ? event.getEventType().defaultSeverity() : "info");
        }

        try {
            String line = objectMapper.writeValueAsString(event) + "\n";
            synchronized (writeLock) {
                rotateIfNeeded();
                storagePort.appendText(auditDirectory(), LOG_FILE, line).join();
            }
        } catch (Exception e) {
            log.warn("[Audit] Failed to write security event {}: {}", event.getEventType(), e.getMessage());
        }
    }

    @Override
    public void logAuthLockout(String platform, String userId) {
        log(SecurityEvent.builder()
                .eventType(SecurityEventType.AUTH_LOCKOUT)
                .platform(platform)
                .userId(UserIdHasher.hash(platform, userId))
                .success(false)
                .details("account locked due to repeated failures")
                .severity("critical")
                .build());
    }

    @Override
    public void logAuthFailure(String platform, String userId, String reason) {
        log(SecurityEvent.builder()
                .eventType(SecurityEventType.AUTH_FAILURE)
                .platform(platform)
                .userId(UserIdHasher.hash(platform, userId))
                .success(false)
                .details(reason)
                .build());
    }

    @Override
    public void logRateLimited(String platform, String userId) {
        log(SecurityEvent.builder()
                .eventType(SecurityEventType.RATE_LIMITED)
                .platform(platform)
                .userId(UserIdHasher.hash(platform, userId))
                .success(false)
                .build());
    }

    private void rotateIfNeeded() {
        long size = storagePort.size(auditDirectory(), LOG_FILE).join();
        if (size < properties.getAudit().getMaxFileBytes()) {
            return;
        }
        String rotated = LOG_FILE + "." + ROTATION_SUFFIX.format(clock.instant());
        try {
            storagePort.move(auditDirectory(), LOG_FILE, rotated).join();
            log.info("[Audit] Rotated security log to {}", rotated);
        } catch (RuntimeException e) {
            log.warn("[Audit] Rotation failed, continuing with current file: {}", e.getMessage());
        }
    }

    private String auditDirectory() {
        return properties.getStorage().getAuditDirectory();
    }
}
