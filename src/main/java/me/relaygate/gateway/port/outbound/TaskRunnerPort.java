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

import me.relaygate.gateway.domain.model.CancellationHandle;
import me.relaygate.gateway.domain.model.HistoryMessage;

import java.util.List;

/**
 * Executes a background task (usually an LLM call) for a sub-session.
 *
 * <p>
 * Implementations must stop promptly once the cancellation handle is
 * triggered, either by checking it or by honoring thread interruption.
 */
public interface TaskRunnerPort {

    /**
     * @param cancellation
     *            stop signal for explicit cancel and execution ceiling
     * @param task
     *            task description
     * @param history
     *            snapshot of the parent session recent history
     * @return result text
     */
    String execute(CancellationHandle cancellation, String task, List<HistoryMessage> history) throws Exception;
}
