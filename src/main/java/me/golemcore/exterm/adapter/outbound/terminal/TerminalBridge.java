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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.port.outbound.TerminalPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connects chat sessions to terminal sessions.
 *
 * <p>
 * Terminals register a {@link TerminalSink} under their terminal session id.
 * A chat may be bound to one terminal; an unbound chat uses any registered
 * terminal, and input for a terminal that is gone falls back to any other.
 */
@Component
@Slf4j
public class TerminalBridge implements TerminalPort {

    static final String NO_TERMINAL = "No terminal session found";
    static final String NO_ASSOCIATED_TERMINAL = "No terminal session associated with this chat";

    private final Map<String, TerminalSink> terminals = new ConcurrentHashMap<>();
    private final Map<String, String> chatBindings = new ConcurrentHashMap<>();
    private final TerminalHistoryStore historyStore;

    public TerminalBridge(TerminalHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    public void registerTerminal(String terminalId, TerminalSink sink) {
        terminals.put(terminalId, sink);
        log.info("[Terminal] Registered terminal {}", terminalId);
    }

    public void unregisterTerminal(String terminalId) {
        if (terminals.remove(terminalId) != null) {
            log.info("[Terminal] Unregistered terminal {}", terminalId);
        }
        historyStore.clear(terminalId);
    }

    public void bindChat(String chatSessionId, String terminalId) {
        chatBindings.put(chatSessionId, terminalId);
    }

    public void unbindChat(String chatSessionId) {
        chatBindings.remove(chatSessionId);
    }

    /**
     * Records output produced by a terminal so tools can read it.
     */
    public void recordOutput(String terminalId, String output) {
        historyStore.addOutput(terminalId, output);
    }

    public Optional<String> resolveTerminal(String chatSessionId) {
        String bound = chatSessionId != null ? chatBindings.get(chatSessionId) : null;
        if (bound != null) {
            return Optional.of(bound);
        }
        return terminals.keySet().stream().sorted().findFirst();
    }

    @Override
    public ReadResult read(String chatSessionId, int maxLines) {
        return resolveTerminal(chatSessionId)
                .map(terminalId -> ReadResult.of(historyStore.recent(terminalId, maxLines)))
                .orElseGet(() -> ReadResult.unavailable(NO_ASSOCIATED_TERMINAL));
    }

    @Override
    public WriteResult write(String chatSessionId, String text) {
        Optional<String> resolved = resolveTerminal(chatSessionId);
        if (resolved.isEmpty()) {
            return WriteResult.error(NO_TERMINAL);
        }

        String terminalId = resolved.get();
        TerminalSink sink = terminals.get(terminalId);
        if (sink == null) {
            Optional<Map.Entry<String, TerminalSink>> fallback = terminals.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .findFirst();
            if (fallback.isEmpty()) {
                return WriteResult.error(NO_TERMINAL);
            }
            log.debug("[Terminal] Terminal {} is gone, falling back to {}", terminalId, fallback.get().getKey());
            terminalId = fallback.get().getKey();
            sink = fallback.get().getValue();
        }

        if (!sink.send(text)) {
            return WriteResult.error("Terminal session " + terminalId + " is not accepting input");
        }
        historyStore.addCommand(terminalId, text.strip());
        return WriteResult.ok("Input sent to terminal");
    }
}
