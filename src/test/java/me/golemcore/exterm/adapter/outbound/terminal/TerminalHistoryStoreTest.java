package me.golemcore.exterm.adapter.outbound.terminal;

import me.golemcore.exterm.domain.model.TerminalEntry;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TerminalHistoryStoreTest {

    private static final String TERMINAL = "term_1";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private TerminalHistoryStore store;

    @BeforeEach
    void setUp() {
        ExtermProperties properties = new ExtermProperties();
        properties.getTools().getTerminal().setHistorySize(3);
        store = new TerminalHistoryStore(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReturnRecentEntriesOldestFirst() {
        store.addCommand(TERMINAL, "ls");
        store.addOutput(TERMINAL, "a.txt b.txt");
        store.addCommand(TERMINAL, "pwd");

        List<TerminalEntry> recent = store.recent(TERMINAL, 2);

        assertEquals(2, recent.size());
        assertEquals(TerminalEntry.Type.OUTPUT, recent.get(0).getType());
        assertEquals("a.txt b.txt", recent.get(0).getContent());
        assertEquals("pwd", recent.get(1).getContent());
        assertEquals(NOW, recent.get(1).getTimestamp());
    }

    @Test
    void shouldDropOldestEntriesBeyondCapacity() {
        for (int i = 1; i <= 5; i++) {
            store.addOutput(TERMINAL, "line " + i);
        }

        List<TerminalEntry> recent = store.recent(TERMINAL, 10);

        assertEquals(List.of("line 3", "line 4", "line 5"), recent.stream().map(TerminalEntry::getContent).toList());
    }

    @Test
    void shouldReturnNothingForUnknownTerminalOrAfterClear() {
        store.addCommand(TERMINAL, "ls");
        store.clear(TERMINAL);

        assertTrue(store.recent(TERMINAL, 5).isEmpty());
        assertTrue(store.recent("term_unknown", 5).isEmpty());
    }
}
