package me.relaygate.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the gateway, bound from
 * application.properties.
 *
 * <p>
 * All gateway configuration is organized under the {@code gateway.*} prefix.
 * This class contains nested property classes for different subsystems:
 * <ul>
 * <li>{@link AccessProperties} - access mode, global admins, legacy
 * allowlist</li>
 * <li>{@link PlatformProperties} - per-platform access rules</li>
 * <li>{@link RateLimitProperties} and {@link LockoutProperties} - abuse
 * protection</li>
 * <li>{@link SessionProperties} - conversation history and sub-sessions</li>
 * <li>{@link StorageProperties}, {@link VaultProperties},
 * {@link AuditProperties} - persistence</li>
 * <li>{@link HooksProperties} - event hooks</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private String commandPrefix = "/";
    /** Language of user-facing replies, see {@code messages_<lang>.properties}. */
    private String language = "en";
    private AccessProperties access = new AccessProperties();
    private Map<String, PlatformProperties> platforms = new HashMap<>();
    private RateLimitProperties rateLimit = new RateLimitProperties();
    private LockoutProperties lockout = new LockoutProperties();
    private AccessSessionProperties accessSession = new AccessSessionProperties();
    private SessionProperties session = new SessionProperties();
    private StorageProperties storage = new StorageProperties();
    private VaultProperties vault = new VaultProperties();
    private AuditProperties audit = new AuditProperties();
    private HooksProperties hooks = new HooksProperties();

    // ==================== ACCESS ====================

    @Data
    public static class AccessProperties {
        /** allowlist, denylist or open. */
        private String mode = "allowlist";
        private List<String> globalAdmins = new ArrayList<>();
        /** Legacy global authorizer table: platform to allowed user IDs. */
        private Map<String, List<String>> legacyAllowedUsers = new HashMap<>();
    }

    @Data
    public static class PlatformProperties {
        private boolean enabled = false;
        private List<String> admins = new ArrayList<>();
        private List<String> allowedUsers = new ArrayList<>();
        private List<String> allowedChats = new ArrayList<>();
        private boolean allowGroups = false;
        private boolean allowDms = true;
    }

    // ==================== ABUSE PROTECTION ====================

    @Data
    public static class RateLimitProperties {
        private int messagesPerMinute = 30;
        private int commandsPerMinute = 10;
        private Duration window = Duration.ofMinutes(1);
    }

    @Data
    public static class LockoutProperties {
        private int maxFailedAttempts = 5;
        private Duration duration = Duration.ofMinutes(15);
    }

    @Data
    public static class AccessSessionProperties {
        private Duration timeout = Duration.ofHours(24);
        private Duration idleTimeout = Duration.ofHours(4);
        private Duration cleanupInterval = Duration.ofMinutes(15);
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionProperties {
        /** Max history entries kept per session. */
        private int maxHistory = 50;

        /** Hard ceiling for a single sub-session run. */
        private Duration subSessionTimeout = Duration.ofMinutes(5);

        /** Number of recent parent entries handed to the task runner. */
        private int historySnapshotSize = 10;

        /** Terminal sessions older than this are removed by maintenance. */
        private Duration retention = Duration.ofHours(24);

        private Duration cleanupInterval = Duration.ofHours(1);

        /** Upper bound on delivering a completion notification. */
        private Duration notifyTimeout = Duration.ofSeconds(30);
    }

    // ==================== PERSISTENCE ====================

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String messagesDirectory = "messages";
        private String auditDirectory = "audit";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.relaygate/workspace";
    }

    @Data
    public static class VaultProperties {
        /** Base64-encoded 32-byte AES key. */
        private String key = "";
    }

    @Data
    public static class AuditProperties {
        private boolean enabled = true;
        private long maxFileBytes = 50L * 1024 * 1024;
    }

    // ==================== HOOKS ====================

    @Data
    public static class HooksProperties {
        private List<HookProperties> definitions = new ArrayList<>();
        private int maxOutputBytes = 1024 * 1024;
    }

    @Data
    public static class HookProperties {
        private String name;
        /** pre_message, post_response, on_command, on_start, on_stop, on_error. */
        private String event;
        private String command;
        private Duration timeout = Duration.ofSeconds(10);
        /** Empty list matches every platform. */
        private List<String> platforms = new ArrayList<>();
        private boolean async = false;
    }
}
