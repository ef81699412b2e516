package me.relaygate.gateway.security;

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

import me.relaygate.gateway.domain.model.AccessSession;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which users are currently validated, keyed by access key.
 *
 * <p>
 * A session expires after an absolute lifetime and after an idle period
 * without traffic. {@link #touch(String, String)} refreshes a valid session or
 * replaces a stale one; {@link #cleanup()} evicts stale sessions and is driven
 * by the maintenance scheduler.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessSessionRegistry {

    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, AccessSession> sessions = new ConcurrentHashMap<>();

    /**
     * Returns the user's valid access session, creating a new one when none
     * exists or the previous one went stale.
     */
    public AccessSession touch(String platform, String userId) {
        String key = UserIdHasher.accessKey(platform, userId);
        Instant now = clock.instant();

        return sessions.compute(key, (k, existing) -> {
            if (existing != null && existing.isValid(now, idleTimeout())) {
                existing.setLastSeen(now);
                return existing;
            }
            return AccessSession.builder()
                    .platform(platform)
                    .userId(userId)
                    .createdAt(now)
                    .expiresAt(now.plus(properties.getAccessSession().getTimeout()))
                    .lastSeen(now)
                    .build();
        });
    }

    /**
     * Reports whether the user has a valid session. Stale sessions are
     * invalidated as a side effect.
     */
    public AccessSession.Validity validate(String platform, String userId) {
        String key = UserIdHasher.accessKey(platform, userId);
        AccessSession session = sessions.get(key);
        if (session == null) {
            return AccessSession.Validity.ABSENT;
        }

        AccessSession.Validity validity = session.check(clock.instant(), idleTimeout());
        if (validity != AccessSession.Validity.VALID) {
            sessions.remove(key, session);
            log.debug("[Security] Access session {}: platform={}", validity.name().toLowerCase(), platform);
        }
        return validity;
    }

    public Optional<AccessSession> get(String platform, String userId) {
        return Optional.ofNullable(sessions.get(UserIdHasher.accessKey(platform, userId)));
    }

    public void invalidate(String platform, String userId) {
        sessions.remove(UserIdHasher.accessKey(platform, userId));
    }

    /**
     * Evicts every expired or idle session.
     */
    public int cleanup() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, AccessSession> entry : sessions.entrySet()) {
            if (!entry.getValue().isValid(now, idleTimeout()) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[Security] Evicted {} stale access sessions", removed);
        }
        return removed;
    }

    private Duration idleTimeout() {
        return properties.getAccessSession().getIdleTimeout();
    }
}
