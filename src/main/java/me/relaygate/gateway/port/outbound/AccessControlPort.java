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

/**
 * Port deciding whether a sender may use the gateway.
 */
public interface AccessControlPort {

    /**
     * Platform-scoped rules: global and platform admins, user and chat
     * allowlists, DM/group policy and access mode.
     */
    boolean isAllowed(String platform, String userId, String chatId, boolean isGroup);

    /**
     * Legacy global allowlist, consulted only when the platform rules do not
     * allow the sender.
     */
    boolean isAuthorized(String platform, String userId);
}
