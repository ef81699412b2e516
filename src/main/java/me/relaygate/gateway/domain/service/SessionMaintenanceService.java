package me.relaygate.gateway.domain.service;

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
import me.relaygate.gateway.ratelimit.SlidingWindowRateLimiter;
import me.relaygate.gateway.security.AccessSessionRegistry;
import me.relaygate.gateway.security.AuthAttemptTracker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping of in-memory state.
 *
 * <p>
 * Two fixed-rate jobs run on one daemon thread:
 * <ul>
 * <li>every {@code gateway.session.cleanup-interval}: finished sessions older
 * than the retention window are cleared</li>
 * <li>every {@code gateway.access-session.cleanup-interval}: stale access
 * sessions, auth failures and rate-limit windows are purged</li>
 * </ul>
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionMaintenanceService {

    private final ConversationSessionService sessionService;
    private final AccessSessionRegistry accessSessions;
    private final AuthAttemptTracker authAttempts;
    private final SlidingWindowRateLimiter rateLimiter;
    private final GatewayProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sessionTask;
    private ScheduledFuture<?> securityTask;

    @PostConstruct
    public void start() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-maintenance");
            t.setDaemon(true);
            return t;
        });

        long sessionInterval = properties.getSession().getCleanupInterval().toMillis();
        long securityInterval = properties.getAccessSession().getCleanupInterval().toMillis();
        sessionTask = scheduler.scheduleAtFixedRate(this::clearFinishedSessions,
                sessionInterval, sessionInterval, TimeUnit.MILLISECONDS);
        securityTask = scheduler.scheduleAtFixedRate(this::purgeSecurityState,
                securityInterval, securityInterval, TimeUnit.MILLISECONDS);

        log.info("[Maintenance] Started: sessions every {}, security state every {}",
                properties.getSession().getCleanupInterval(), properties.getAccessSession().getCleanupInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (sessionTask != null) {
            sessionTask.cancel(false);
        }
        if (securityTask != null) {
            securityTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Maintenance] Shut down");
    }

    /**
     * Clears finished sessions past the retention window.
     */
    public int clearFinishedSessions() {
        try {
            return sessionService.clear(properties.getSession().getRetention());
        } catch (RuntimeException e) {
            log.error("[Maintenance] Session cleanup failed", e);
            return 0;
        }
    }

    /**
     * Purges stale access sessions, auth-failure entries and rate-limit
     * windows.
     *
     * @return total number of entries removed
     */
    public int purgeSecurityState() {
        try {
            return accessSessions.cleanup() + authAttempts.cleanup() + rateLimiter.cleanup();
        } catch (RuntimeException e) {
            log.error("[Maintenance] Security state cleanup failed", e);
            return 0;
        }
    }
}
