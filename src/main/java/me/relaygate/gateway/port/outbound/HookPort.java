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

import me.relaygate.gateway.domain.model.HookEvent;
import me.relaygate.gateway.domain.model.HookEventData;
import me.relaygate.gateway.domain.model.HookResult;

/**
 * Fires lifecycle events to externally configured hooks.
 */
public interface HookPort {

    /**
     * Checks if any hook is configured for the event.
     */
    boolean hasHooks(HookEvent event);

    /**
     * Runs matching hooks synchronously. The result can block the message or
     * carry replacement text.
     */
    HookResult fire(HookEvent event, HookEventData data);

    /**
     * Runs matching hooks detached; never waits for them.
     */
    void fireAsync(HookEvent event, HookEventData data);

    /**
     * Hook manager with no hooks configured.
     */
    static HookPort noop() {
        return NoopHookPort.INSTANCE;
    }

    final class NoopHookPort implements HookPort {

        private static final NoopHookPort INSTANCE = new NoopHookPort();

        private NoopHookPort() {
        }

        @Override
        public boolean hasHooks(HookEvent event) {
            return false;
        }

        @Override
        public HookResult fire(HookEvent event, HookEventData data) {
            return HookResult.empty();
        }

        @Override
        public void fireAsync(HookEvent event, HookEventData data) {
            // no hooks configured
        }
    }
}
