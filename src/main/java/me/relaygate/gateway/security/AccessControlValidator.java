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
import me.relaygate.gateway.port.outbound.AccessControlPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Validates senders against platform-scoped access rules and the legacy global
 * allowlist.
 *
 * <p>
 * Platform rules are evaluated in order:
 * <ul>
 * <li>Global admins are always allowed</li>
 * <li>Access mode {@code open} allows everyone</li>
 * <li>Unknown or disabled platforms deny everyone</li>
 * <li>Group messages require {@code allowGroups}, direct messages require
 * {@code allowDms}</li>
 * <li>Platform admins are allowed</li>
 * <li>Otherwise the user (and, in groups, the chat) must be listed. An empty
 * list admits everyone unless the mode is {@code allowlist}</li>
 * </ul>
 *
 * <p>
 * The legacy allowlist denies platforms it does not know and treats an empty
 * list as "allow all" (initial setup).
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessControlValidator implements AccessControlPort {

    static final String MODE_OPEN = "open";
    static final String MODE_ALLOWLIST = "allowlist";

    private final GatewayProperties properties;

    @Override
    public boolean isAllowed(String platform, String userId, String chatId, boolean isGroup) {
        GatewayProperties.AccessProperties access = properties.getAccess();
        if (contains(access.getGlobalAdmins(), userId)) {
            return true;
        }
        if (MODE_OPEN.equalsIgnoreCase(access.getMode())) {
            return true;
        }

        GatewayProperties.PlatformProperties platformProps = properties.getPlatforms().get(platform);
        if (platformProps == null) {
            log.trace("[Security] No access rules for platform={}", platform);
            return false;
        }
        return isAllowedOnPlatform(platformProps, userId, chatId, isGroup);
    }

    @Override
    public boolean isAuthorized(String platform, String userId) {
        Map<String, List<String>> legacy = properties.getAccess().getLegacyAllowedUsers();
        if (legacy == null || !legacy.containsKey(platform)) {
            return false;
        }
        List<String> allowedUsers = legacy.get(platform);
        if (allowedUsers == null || allowedUsers.isEmpty()) {
            return true; // Empty legacy list = allow all
        }
        return allowedUsers.contains(userId);
    }

    private boolean isAllowedOnPlatform(GatewayProperties.PlatformProperties platformProps, String userId,
            String chatId, boolean isGroup) {
        if (!platformProps.isEnabled()) {
            return false;
        }
        if (isGroup && !platformProps.isAllowGroups()) {
            return false;
        }
        if (!isGroup && !platformProps.isAllowDms()) {
            return false;
        }
        if (contains(platformProps.getAdmins(), userId)) {
            return true;
        }

        boolean strict = MODE_ALLOWLIST.equalsIgnoreCase(properties.getAccess().getMode());

        boolean userOk = isEmpty(platformProps.getAllowedUsers())
                ? !strict
                : platformProps.getAllowedUsers().contains(userId);

        boolean chatOk = true;
        if (isGroup) {
            chatOk = isEmpty(platformProps.getAllowedChats())
                    ? !strict
                    : platformProps.getAllowedChats().contains(chatId);
        }
        return userOk && chatOk;
    }

    private static boolean contains(List<String> values, String value) {
        return values != null && values.contains(value);
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
