package me.golemcore.exterm.tools;

import me.golemcore.exterm.domain.model.TerminalEntry;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.TerminalPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TerminalToolsTest {

    private static final String SESSION_ID = "chat_1";
    private static final Instant TIME = Instant.parse("2026-03-01T12:00:00Z");

    private TerminalPort terminalPort;
    private ToolContext context;
    private ExtermProperties properties;

    @BeforeEach
    void setUp() {
        terminalPort = mock(TerminalPort.class);
        context = mock(ToolContext.class);
        when(context.getSessionId()).thenReturn(SESSION_ID);
        properties = new ExtermProperties();
    }

    private static TerminalEntry entry(TerminalEntry.Type type, String content) {
        return TerminalEntry.builder().type(type).content(content).timestamp(TIME).build();
    }

    // ==================== read_terminal ====================

    @Test
    @SuppressWarnings("unchecked")
    void readTerminalShouldFormatEntries() throws Exception {
        when(terminalPort.read(SESSION_ID, 20)).thenReturn(TerminalPort.ReadResult.of(List.of(
                entry(TerminalEntry.Type.COMMAND, "ls"),
                entry(TerminalEntry.Type.OUTPUT, "a.txt\n"))));

        ToolResult result = new ReadTerminalTool(terminalPort, properties).execute(Map.of(), context).get();

        assertTrue(result.isSuccess());
        assertEquals(2, result.getData().get("entry_count"));
        List<Map<String, Object>> output = (List<Map<String, Object>>) result.getData().get("terminal_output");
        assertEquals(Map.of("type", "command", "content", "ls", "timestamp", TIME.toString()), output.get(0));
        assertEquals("a.txt", output.get(1).get("content"));
        assertEquals("Recent terminal output and commands", result.getData().get("note"));
    }

    @Test
    void readTerminalShouldClampLines() throws Exception {
        when(terminalPort.read(eq(SESSION_ID), anyInt())).thenReturn(TerminalPort.ReadResult.of(List.of()));
        ReadTerminalTool tool = new ReadTerminalTool(terminalPort, properties);

        tool.execute(Map.of("lines", 500), context).get();
        tool.execute(Map.of("lines", 0), context).get();

        verify(terminalPort).read(SESSION_ID, 100);
        verify(terminalPort).read(SESSION_ID, 1);
    }

    @Test
    void readTerminalShouldReportMissingTerminal() throws Exception {
        when(terminalPort.read(eq(SESSION_ID), anyInt()))
                .thenReturn(TerminalPort.ReadResult.unavailable("No terminal session associated with this chat"));

        ToolResult result = new ReadTerminalTool(terminalPort, properties).execute(Map.of(), context).get();

        assertFalse(result.isSuccess());
        assertEquals("No terminal session associated with this chat", result.getError());
    }

    // ==================== get_terminal_history ====================

    @Test
    void historyShouldCapLinesAtFifty() throws Exception {
        when(terminalPort.read(eq(SESSION_ID), anyInt())).thenReturn(TerminalPort.ReadResult.of(List.of(
                entry(TerminalEntry.Type.COMMAND, "make"))));

        ToolResult result = new GetTerminalHistoryTool(terminalPort, properties)
                .execute(Map.of("lines", "80"), context).get();

        verify(terminalPort).read(SESSION_ID, 50);
        assertEquals(1, result.getData().get("entry_count"));
    }

    // ==================== sleep ====================

    @Test
    void sleepShouldClampToMinimum() throws Exception {
        ToolResult result = new SleepTool().execute(Map.of("seconds", 0), context).get();

        assertTrue(result.isSuccess());
        assertEquals("Waited for 0.1 seconds", result.getMessage());
        assertEquals(0.1, result.getData().get("slept_seconds"));
    }

    @Test
    void sleepShouldWaitRequestedTime() throws Exception {
        long started = System.nanoTime();

        ToolResult result = new SleepTool().execute(Map.of("seconds", 0.3), context).get();

        assertTrue((System.nanoTime() - started) / 1_000_000 >= 250);
        assertEquals(0.3, result.getData().get("slept_seconds"));
    }

    // ==================== suggest_terminal_command ====================

    @Test
    void suggestShouldReturnAwaitingApproval() throws Exception {
        ToolResult result = new SuggestTerminalCommandTool()
                .execute(Map.of("command", "rm -rf build", "reason", "clean build output"), context).get();

        assertTrue(result.isSuccess());
        assertEquals("Command suggestion created", result.getMessage());
        assertEquals("rm -rf build", result.getData().get("command"));
        assertEquals("clean build output", result.getData().get("reason"));
        assertEquals("awaiting_approval", result.getData().get("status"));
    }

    @Test
    void suggestShouldRequireCommand() throws Exception {
        ToolResult result = new SuggestTerminalCommandTool().execute(Map.of("reason", "x"), context).get();

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameter: 'command'", result.getError());
    }
}
