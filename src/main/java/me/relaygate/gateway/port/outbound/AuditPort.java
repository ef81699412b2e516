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

import me.relaygate.gateway.domain.model.SecurityEvent;

/**
 * Append-only trail of security-relevant events. All methods are
 * fire-and-forget: implementations never throw.
 */
public interface AuditPort {

    void log(SecurityEvent event);

    void logAuthLockout(String platform, String userId);

    void logAuthFailure(String platform, String userId, String reason);

    void logRateLimited(String platform, String userId);

    /**
     * Audit logger that discards everything, used when auditing is disabled.
     */
    static AuditPort noop() {
        return NoopAuditPort.INSTANCE;
    }

    final class NoopAuditPort implements AuditPort {

        private static final NoopAuditPort INSTANCE = new NoopAuditPort();

        private NoopAuditPort() {
        }

        @Override
        public void log(SecurityEvent event) {
            // audit disabled
        }

        @Override
        public void logAuthLockout(String platform, String userId) {
            // audit disabled
        }

        @Override
        public void logAuthFailure(String platform, String userId, String reason) {
            // audit disabled
        }

        @Override
        public void logRateLimited(String platform, String userId) {
            // audit disabled
        }
    }
}
