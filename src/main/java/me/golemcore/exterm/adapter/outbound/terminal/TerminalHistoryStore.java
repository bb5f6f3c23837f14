package me.golemcore.exterm.adapter.outbound.terminal;

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
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded in-memory history of commands and output per terminal session.
 */
@Component
public class TerminalHistoryStore {

    private final Map<String, Deque<TerminalEntry>> histories = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    public TerminalHistoryStore(ExtermProperties properties, Clock clock) {
        this.maxEntries = properties.getTools().getTerminal().getHistorySize();
        this.clock = clock;
    }

    public void addCommand(String terminalId, String command) {
        add(terminalId, TerminalEntry.Type.COMMAND, command);
    }

    public void addOutput(String terminalId, String output) {
        add(terminalId, TerminalEntry.Type.OUTPUT, output);
    }

    /**
     * Returns up to {@code lines} most recent entries, oldest first.
     */
    public List<TerminalEntry> recent(String terminalId, int lines) {
        Deque<TerminalEntry> history = histories.get(terminalId);
        if (history == null || lines <= 0) {
            return List.of();
        }
        List<TerminalEntry> result = new ArrayList<>(Math.min(lines, maxEntries));
        synchronized (history) {
            Iterator<TerminalEntry> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && result.size() < lines) {
                result.add(0, newestFirst.next());
            }
        }
        return result;
    }

    public void clear(String terminalId) {
        histories.remove(terminalId);
    }

    private void add(String terminalId, TerminalEntry.Type type, String content) {
        TerminalEntry entry = TerminalEntry.builder()
                .type(type)
                .content(content)
                .timestamp(clock.instant())
                .build();
        Deque<TerminalEntry> history = histories.computeIfAbsent(terminalId, id -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(entry);
            while (history.size() > maxEntries) {
                history.removeFirst();
            }
        }
    }
}
