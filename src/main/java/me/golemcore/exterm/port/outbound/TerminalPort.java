package me.golemcore.exterm.port.outbound;

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

import me.golemcore.exterm.domain.model.TerminalEntry;

import java.util.List;

/**
 * Port to the terminal associated with a chat session. Spawning the
 * pseudo-terminal and rendering it are handled elsewhere; this port only reads
 * recorded history and writes input.
 *
 * <p>
 * Both operations take the <em>chat</em> session id and return structured
 * results instead of throwing.
 */
public interface TerminalPort {

    /**
     * Returns up to {@code maxLines} most recent entries, oldest first.
     */
    ReadResult read(String chatSessionId, int maxLines);

    /**
     * Sends raw input (including any trailing newline) to the terminal.
     */
    WriteResult write(String chatSessionId, String text);

    record ReadResult(boolean success, List<TerminalEntry> entries, String error) {

        public static ReadResult of(List<TerminalEntry> entries) {
            return new ReadResult(true, List.copyOf(entries), null);
        }

        public static ReadResult unavailable(String error) {
            return new ReadResult(false, List.of(), error);
        }
    }

    record WriteResult(boolean success, String message) {

        public static WriteResult ok(String message) {
            return new WriteResult(true, message);
        }

        public static WriteResult error(String message) {
            return new WriteResult(false, message);
        }
    }
}
