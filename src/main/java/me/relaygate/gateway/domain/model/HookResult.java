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

/**
 * Outcome of firing hooks synchronously.
 *
 * @param output
 *            last non-empty trimmed stdout of a matching hook, or empty
 * @param blocked
 *            true when a matching hook exited non-zero or timed out
 */
public record HookResult(String output, boolean blocked) {

    public static HookResult empty() {
        return new HookResult("", false);
    }

    public boolean hasOutput() {
        return output != null && !output.isEmpty();
    }
}
