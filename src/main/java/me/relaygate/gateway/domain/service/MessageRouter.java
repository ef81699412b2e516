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

import me.relaygate.gateway.domain.exception.AccountLockedException;
import me.relaygate.gateway.domain.exception.NotAuthorizedException;
import me.relaygate.gateway.domain.exception.PlatformStartException;
import me.relaygate.gateway.domain.exception.RateLimitedException;
import me.relaygate.gateway.domain.exception.UnknownPlatformException;
import me.relaygate.gateway.domain.exception.VaultException;
import me.relaygate.gateway.domain.model.HookEvent;
import me.relaygate.gateway.domain.model.HookEventData;
import me.relaygate.gateway.domain.model.HookResult;
import me.relaygate.gateway.domain.model.InboundMessage;
import me.relaygate.gateway.domain.model.MessageRecord;
import me.relaygate.gateway.infrastructure.config.GatewayProperties;
import me.relaygate.gateway.port.inbound.MessageHandler;
import me.relaygate.gateway.port.inbound.PlatformPort;
import me.relaygate.gateway.port.outbound.AccessControlPort;
import me.relaygate.gateway.port.outbound.AuditPort;
import me.relaygate.gateway.port.outbound.AuthAttemptsPort;
import me.relaygate.gateway.port.outbound.HookPort;
import me.relaygate.gateway.port.outbound.MessageStoragePort;
import me.relaygate.gateway.port.outbound.RateLimitPort;
import me.relaygate.gateway.port.outbound.VaultPort;
import me.relaygate.gateway.security.AccessSessionRegistry;
import me.relaygate.gateway.security.UserIdHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Routes inbound platform messages through the security pipeline to the
 * application handler.
 *
 * <p>
 * Every message passes, in order:
 * <ol>
 * <li>Lockout check - locked accounts are rejected before anything else</li>
 * <li>Authorization - platform rules, then the legacy allowlist</li>
 * <li>Rate limiting - separate budgets for commands and plain messages</li>
 * <li>Inbound persistence - text is encrypted and stored, failures are
 * logged</li>
 * <li>{@code pre_message} hook - may block silently or rewrite the text</li>
 * <li>Handler dispatch - errors fire {@code on_error} asynchronously and are
 * rethrown</li>
 * <li>{@code post_response} hook - may rewrite the response</li>
 * <li>Outbound persistence of a non-empty response</li>
 * </ol>
 *
 * <p>
 * The platform registry and the handler are guarded by a read/write lock so
 * that concurrent messages only take the read side. The security collaborators
 * are thread-safe on their own and are called without holding the lock.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class MessageRouter {

    static final String UNAUTHORIZED_ACTION = "unauthorized";
    static final String UNAUTHORIZED_REASON = "not in allowlist";

    private final AccessControlPort accessControl;
    private final RateLimitPort rateLimiter;
    private final AuthAttemptsPort authAttempts;
    private final AccessSessionRegistry accessSessions;
    private final VaultPort vault;
    private final MessageStoragePort storage;
    private final GatewayProperties properties;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, PlatformPort> platforms = new LinkedHashMap<>();
    private MessageHandler handler;
    private AuditPort auditLogger;
    private HookPort hooks;

    @Autowired
    public MessageRouter(AccessControlPort accessControl, RateLimitPort rateLimiter, AuthAttemptsPort authAttempts,
            AccessSessionRegistry accessSessions, VaultPort vault, MessageStoragePort storage,
            ObjectProvider<AuditPort> auditLogger, ObjectProvider<HookPort> hooks, GatewayProperties properties,
            Clock clock) {
        this(accessControl, rateLimiter, authAttempts, accessSessions, vault, storage,
                auditLogger.getIfAvailable(AuditPort::noop), hooks.getIfAvailable(HookPort::noop), properties, clock);
    }

    public MessageRouter(AccessControlPort accessControl, RateLimitPort rateLimiter, AuthAttemptsPort authAttempts,
            AccessSessionRegistry accessSessions, VaultPort vault, MessageStoragePort storage, AuditPort auditLogger,
            HookPort hooks, GatewayProperties properties, Clock clock) {
        this.accessControl = accessControl;
        this.rateLimiter = rateLimiter;
        this.authAttempts = authAttempts;
        this.accessSessions = accessSessions;
        this.vault = vault;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
        this.auditLogger = auditLogger != null ? auditLogger : AuditPort.noop();
        this.hooks = hooks != null ? hooks : HookPort.noop();
    }

    // ==================== REGISTRY ====================

    /**
     * Registers a platform under its name and hands it the pipeline entry
     * point. A platform with the same name is replaced.
     */
    public void register(PlatformPort platform) {
        lock.writeLock().lock();
        try {
            platforms.put(platform.getName(), platform);
            platform.onMessage(this::handleMessage);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("[Router] Registered platform: {}", platform.getName());
    }

    public void setHandler(MessageHandler handler) {
        lock.writeLock().lock();
        try {
            this.handler = handler;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the audit logger; {@code null} disables auditing.
     */
    public void setAuditLogger(AuditPort auditLogger) {
        lock.writeLock().lock();
        try {
            this.auditLogger = auditLogger != null ? auditLogger : AuditPort.noop();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the hook manager; {@code null} disables hooks.
     */
    public void setHooks(HookPort hooks) {
        lock.writeLock().lock();
        try {
            this.hooks = hooks != null ? hooks : HookPort.noop();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Names of all registered platforms, in registration order.
     */
    public List<String> platforms() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(platforms.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== LIFECYCLE ====================

    /**
     * Starts every registered platform. The first failure aborts the start and
     * is rethrown as {@link PlatformStartException} naming the platform.
     */
    public void start() {
        List<PlatformPort> snapshot = snapshotPlatforms();
        for (PlatformPort platform : snapshot) {
            log.info("[Router] Starting platform: {}", platform.getName());
            try {
                platform.start();
            } catch (RuntimeException e) {
                throw new PlatformStartException(platform.getName(), e);
            }
        }
        currentHooks().fireAsync(HookEvent.ON_START, HookEventData.builder()
                .platforms(snapshot.stream().map(PlatformPort::getName).toList())
                .build());
    }

    /**
     * Stops every registered platform. Failures are logged and do not prevent
     * the remaining platforms from stopping.
     */
    public void stop() {
        List<PlatformPort> snapshot = snapshotPlatforms();
        currentHooks().fireAsync(HookEvent.ON_STOP, HookEventData.builder()
                .platforms(snapshot.stream().map(PlatformPort::getName).toList())
                .build());
        for (PlatformPort platform : snapshot) {
            log.info("[Router] Stopping platform: {}", platform.getName());
            try {
                platform.stop();
            } catch (RuntimeException e) {
                log.error("[Router] Stop platform failed: platform={}", platform.getName(), e);
            }
        }
    }

    /**
     * Sends a message through the named platform.
     *
     * @throws UnknownPlatformException
     *             if no platform is registered under that name
     */
    public CompletableFuture<Void> send(String platform, String chatId, String message) {
        PlatformPort target;
        lock.readLock().lock();
        try {
            target = platforms.get(platform);
        } finally {
            lock.readLock().unlock();
        }
        if (target == null) {
            throw new UnknownPlatformException(platform);
        }
        return target.sendMessage(chatId, message);
    }

    // ==================== PIPELINE ====================

    /**
     * Runs one inbound message through the pipeline.
     *
     * @return the response text, empty when there is nothing to send
     * @throws AccountLockedException
     *             if the account is locked after repeated failures
     * @throws NotAuthorizedException
     *             if no access rule admits the sender
     * @throws RateLimitedException
     *             if the sender exceeded its budget
     */
    public String handleMessage(InboundMessage message) {
        String platform = message.getPlatform();
        String userId = message.getUserId();
        String userKey = UserIdHasher.accessKey(platform, userId);
        String userHash = UserIdHasher.hash(platform, userId);
        AuditPort audit = currentAuditLogger();

        if (authAttempts.isLocked(userKey)) {
            log.warn("[Router] Account locked: platform={}, userHash={}", platform, userHash);
            audit.logAuthLockout(platform, userId);
            throw new AccountLockedException();
        }

        if (!isAuthorized(message)) {
            log.warn("[Router] Unauthorized user: platform={}, userHash={}", platform, userHash);
            recordUnauthorized(platform, userHash);
            authAttempts.recordFailure(userKey);
            audit.logAuthFailure(platform, userId, UNAUTHORIZED_REASON);
            throw new NotAuthorizedException();
        }

        authAttempts.clearFailures(userKey);
        accessSessions.touch(platform, userId);

        boolean command = message.isCommand(properties.getCommandPrefix());
        boolean withinLimit = command ? rateLimiter.allowCommand(userKey) : rateLimiter.allowMessage(userKey);
        if (!withinLimit) {
            log.warn("[Router] Rate limited ({}): userHash={}", command ? "command" : "message", userHash);
            audit.logRateLimited(platform, userId);
            throw new RateLimitedException();
        }

        persist(message, userHash, message.getUsername(), message.getText(), MessageRecord.DIRECTION_IN,
                message.getTimestamp());

        HookPort hookManager = currentHooks();
        if (hookManager.hasHooks(HookEvent.PRE_MESSAGE)) {
            HookResult result = hookManager.fire(HookEvent.PRE_MESSAGE, hookData(message).build());
            if (result.blocked()) {
                log.info("[Router] Message blocked by pre_message hook: userHash={}", userHash);
                return "";
            }
            if (result.hasOutput()) {
                message.setText(result.output());
            }
        }

        MessageHandler current = currentHandler();
        if (current == null) {
            return "";
        }

        if (message.isCommand(properties.getCommandPrefix()) && hookManager.hasHooks(HookEvent.ON_COMMAND)) {
            hookManager.fireAsync(HookEvent.ON_COMMAND, commandHookData(message));
        }

        String response;
        try {
            response = current.handle(message);
        } catch (RuntimeException e) {
            log.error("[Router] Handler error: userHash={}, error={}", userHash, e.getMessage());
            hookManager.fireAsync(HookEvent.ON_ERROR, hookData(message).error(String.valueOf(e.getMessage())).build());
            throw e;
        }
        if (response == null) {
            response = "";
        }

        if (!response.isEmpty() && hookManager.hasHooks(HookEvent.POST_RESPONSE)) {
            HookResult result = hookManager.fire(HookEvent.POST_RESPONSE,
                    hookData(message).response(response).build());
            if (result.hasOutput()) {
                response = result.output();
            }
        }

        if (!response.isEmpty()) {
            persist(message, MessageRecord.BOT_USER_ID, null, response, MessageRecord.DIRECTION_OUT, clock.instant());
        }
        return response;
    }

    private boolean isAuthorized(InboundMessage message) {
        String platform = message.getPlatform();
        String userId = message.getUserId();
        if (accessControl.isAllowed(platform, userId, message.getChatId(), message.isGroupMessage())) {
            return true;
        }
        return accessControl.isAuthorized(platform, userId);
    }

    private void recordUnauthorized(String platform, String userHash) {
        try {
            storage.auditLog(platform, userHash, UNAUTHORIZED_ACTION, "");
        } catch (RuntimeException e) {
            log.error("[Router] Audit record failed: platform={}, error={}", platform, e.getMessage());
        }
    }

    private void persist(InboundMessage message, String userId, String username, String text, String direction,
            Instant timestamp) {
        String ciphertext;
        try {
            ciphertext = vault.encrypt(text != null ? text.getBytes(StandardCharsets.UTF_8) : new byte[0]);
        } catch (VaultException e) {
            log.error("[Router] Encrypt message failed: direction={}, error={}", direction, e.getMessage());
            return;
        }

        try {
            storage.saveMessage(MessageRecord.builder()
                    .platform(message.getPlatform())
                    .chatId(message.getChatId())
                    .userId(userId)
                    .username(username)
                    .content(ciphertext)
                    .timestamp(timestamp != null ? timestamp : clock.instant())
                    .direction(direction)
                    .build());
        } catch (RuntimeException e) {
            log.error("[Router] Save message failed: direction={}, error={}", direction, e.getMessage());
        }
    }

    private HookEventData.HookEventDataBuilder hookData(InboundMessage message) {
        return HookEventData.builder()
                .platform(message.getPlatform())
                .userId(message.getUserId())
                .chatId(message.getChatId())
                .text(message.getText());
    }

    private HookEventData commandHookData(InboundMessage message) {
        String body = message.getText().substring(properties.getCommandPrefix().length()).trim();
        String[] parts = body.isEmpty() ? new String[0] : body.split("\\s+");
        return hookData(message)
                .command(parts.length > 0 ? parts[0] : "")
                .args(parts.length > 1 ? Arrays.asList(parts).subList(1, parts.length) : List.of())
                .build();
    }

    private List<PlatformPort> snapshotPlatforms() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(platforms.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private MessageHandler currentHandler() {
        lock.readLock().lock();
        try {
            return handler;
        } finally {
            lock.readLock().unlock();
        }
    }

    private AuditPort currentAuditLogger() {
        lock.readLock().lock();
        try {
            return auditLogger;
        } finally {
            lock.readLock().unlock();
        }
    }

    private HookPort currentHooks() {
        lock.readLock().lock();
        try {
            return hooks;
        } finally {
            lock.readLock().unlock();
        }
    }
}
