package me.relaygate.gateway.domain.model;

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

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle events that hooks can subscribe to.
 */
public enum HookEvent {

    PRE_MESSAGE("pre_message"),
    POST_RESPONSE("post_response"),
    ON_COMMAND("on_command"),
    ON_START("on_start"),
    ON_STOP("on_stop"),
    ON_ERROR("on_error");

    private final String value;

    HookEvent(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<HookEvent> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(event -> event.value.equals(normalized))
                .findFirst();
    }
}
