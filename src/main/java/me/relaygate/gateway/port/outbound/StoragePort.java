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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for file storage within the local workspace. Provides file operations
 * organized by directory (messages, audit) with support for text reads and
 * append-only (JSONL) writes.
 */
public interface StoragePort {

    /**
     * Read text content from file. Completes with {@code null} when the file
     * does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Size of a file in bytes, {@code 0} when it does not exist.
     */
    CompletableFuture<Long> size(String directory, String path);

    /**
     * Rename a file within a directory.
     *
     * @param directory
     *            subdirectory (e.g., "audit")
     * @param path
     *            current relative path
     * @param newPath
     *            target relative path
     */
    CompletableFuture<Void> move(String directory, String path, String newPath);

    /**
     * List files by prefix.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (for logs, JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);
}
