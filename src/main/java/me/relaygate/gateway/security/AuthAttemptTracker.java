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

import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.outbound.AuthAttemptsPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts failed authorization attempts per access key.
 *
 * <p>
 * A key is locked once it has {@code maxFailedAttempts} failures within the
 * lockout window. Failures older than the window are forgotten, and a
 * successful authorization clears the key, so only consecutive recent failures
 * lead to a lockout. Per-key updates are atomic through
 * {@link ConcurrentHashMap#compute}.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuthAttemptTracker implements AuthAttemptsPort {

    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, List<Instant>> attempts = new ConcurrentHashMap<>();

    @Override
    public void recordFailure(String userKey) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(lockoutDuration());

        attempts.compute(userKey, (key, existing) -> {
            List<Instant> recent = new ArrayList<>();
            if (existing != null) {
                for (Instant failure : existing) {
                    if (failure.isAfter(cutoff)) {
                        recent.add(failure);
                    }
                }
            }
            recent.add(now);
            return recent;
        });
    }

    @Override
    public boolean isLocked(String userKey) {
        List<Instant> failures = attempts.get(userKey);
        if (failures == null) {
            return false;
        }
        Instant cutoff = clock.instant().minus(lockoutDuration());
        long recentCount = failures.stream()
                .filter(failure -> failure.isAfter(cutoff))
                .count();
        return recentCount >= properties.getLockout().getMaxFailedAttempts();
    }

    @Override
    public void clearFailures(String userKey) {
        attempts.remove(userKey);
    }

    /**
     * Number of failures currently remembered for a key.
     */
    public int getFailureCount(String userKey) {
        List<Instant> failures = attempts.get(userKey);
        return failures != null ? failures.size() : 0;
    }

    /**
     * Drops keys without a failure in the last two lockout windows.
     */
    public int cleanup() {
        Instant cutoff = clock.instant().minus(lockoutDuration().multipliedBy(2));
        int removed = 0;
        for (Map.Entry<String, List<Instant>> entry : attempts.entrySet()) {
            boolean stale = entry.getValue().stream().noneMatch(failure -> failure.isAfter(cutoff));
            if (stale && attempts.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("[Security] Purged {} stale auth-failure entries", removed);
        }
        return removed;
    }

    private Duration lockoutDuration() {
        return properties.getLockout().getDuration();
    }
}
