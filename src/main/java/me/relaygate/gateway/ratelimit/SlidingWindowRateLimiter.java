package me.relaygate.gateway.ratelimit;

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
import me.relaygate.gateway.port.outbound.RateLimitPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding window rate limiter with separate budgets per access key.
 *
 * <p>
 * Implements {@link RateLimitPort} with two windows per key:
 * <ul>
 * <li><b>Messages</b> - plain text, default 30 per window</li>
 * <li><b>Commands</b> - prefixed commands, default 10 per window</li>
 * </ul>
 *
 * <p>
 * Every {@value #PURGE_EVERY_CALLS} calls, keys without activity in the last
 * two windows are dropped so the map does not grow without bound. The same
 * purge runs on {@link #cleanup()}.
 *
 * @since 1.0
 * @see SlidingWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowRateLimiter implements RateLimitPort {

    static final int PURGE_EVERY_CALLS = 200;

    private final GatewayProperties properties;
    private final Clock clock;

    private final Map<String, UserWindows> windows = new ConcurrentHashMap<>();
    private final AtomicLong callCount = new AtomicLong();

    @Override
    public boolean allowMessage(String userKey) {
        GatewayProperties.RateLimitProperties limits = properties.getRateLimit();
        return tryAcquire(userKey, false, limits.getMessagesPerMinute());
    }

    @Override
    public boolean allowCommand(String userKey) {
        GatewayProperties.RateLimitProperties limits = properties.getRateLimit();
        return tryAcquire(userKey, true, limits.getCommandsPerMinute());
    }

    /**
     * Drops keys without activity in the last two windows.
     *
     * @return number of keys removed
     */
    public int cleanup() {
        int removed = purgeStale(clock.instant(), null);
        if (removed > 0) {
            log.debug("[RateLimit] Purged {} idle keys", removed);
        }
        return removed;
    }

    int trackedKeys() {
        return windows.size();
    }

    private boolean tryAcquire(String userKey, boolean command, int limit) {
        Instant now = clock.instant();
        if (callCount.incrementAndGet() % PURGE_EVERY_CALLS == 0) {
            purgeStale(now, userKey);
        }

        Duration windowDuration = windowDuration();
        AtomicBoolean allowed = new AtomicBoolean();
        windows.compute(userKey, (key, existing) -> {
            UserWindows userWindows = existing != null ? existing : new UserWindows();
            SlidingWindow window = command ? userWindows.commands() : userWindows.messages();
            allowed.set(window.tryAcquire(now, limit, windowDuration));
            return userWindows;
        });
        if (!allowed.get()) {
            log.debug("[RateLimit] {} limit reached", command ? "Command" : "Message");
        }
        return allowed.get();
    }

    private int purgeStale(Instant now, String keep) {
        Instant cutoff = now.minus(windowDuration().multipliedBy(2));
        AtomicInteger removed = new AtomicInteger();
        for (String key : windows.keySet()) {
            if (key.equals(keep)) {
                continue;
            }
            // activity is re-checked under the map lock so a concurrent acquire keeps its window
            windows.computeIfPresent(key, (k, value) -> {
                if (value.isActiveAfter(cutoff)) {
                    return value;
                }
                removed.incrementAndGet();
                return null;
            });
        }
        return removed.get();
    }

    private Duration windowDuration() {
        return properties.getRateLimit().getWindow();
    }

    private record UserWindows(SlidingWindow messages, SlidingWindow commands) {
        UserWindows() {
            this(new SlidingWindow(), new SlidingWindow());
        }

        boolean isActiveAfter(Instant cutoff) {
            return messages.hasActivityAfter(cutoff) || commands.hasActivityAfter(cutoff);
        }
    }
}
