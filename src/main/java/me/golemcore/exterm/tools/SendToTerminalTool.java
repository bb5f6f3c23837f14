package me.golemcore.exterm.tools;

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
import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.model.TerminalEntry;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;
import me.golemcore.exterm.port.outbound.TerminalPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends input to the chat's terminal and, unless told otherwise, waits for
 * the output to settle before returning the recent history.
 *
 * <p>
 * Settling is detected by polling: once new entries show up, the output is
 * considered complete when two consecutive polls see the same entries. The
 * wait never exceeds {@code sleep_seconds}; on timeout whatever was recorded
 * so far is returned.
 */
@Component
@Slf4j
public class SendToTerminalTool implements ToolComponent {

    static final long POLL_INTERVAL_MS = 50;
    private static final long MIN_SETTLE_MS = 100;
    private static final int RESULT_LINES = 20;
    private static final double DEFAULT_WAIT_SECONDS = 1.5;

    private final TerminalPort terminalPort;

    public SendToTerminalTool(TerminalPort terminalPort) {
        this.terminalPort = terminalPort;
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SEND_TO_TERMINAL;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Send a command or input directly to the terminal. By default, waits for completion "
                        + "and returns results automatically.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "input", ToolDefinition.property("string",
                                "The text/command to send to the terminal (e.g., 'ls -la', 'cd /home', 'exit')"),
                        "add_newline", ToolDefinition.property("boolean",
                                "Whether to add a newline (Enter) after the input (default: true for commands)"),
                        "auto_read", ToolDefinition.property("boolean",
                                "Whether to automatically wait and read terminal output after sending command "
                                        + "(default: true)"),
                        "sleep_seconds", ToolDefinition.property("number",
                                "How long to wait before reading results when auto_read is true "
                                        + "(default: 1.5 seconds)")),
                        List.of("input")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        return CompletableFuture.supplyAsync(() -> {
            // some models name the argument "command"
            String input = ToolArguments.string(parameters, "input");
            if (input == null) {
                input = ToolArguments.string(parameters, "command");
            }
            if (input == null) {
                return ToolResult.failure("Missing required parameter: 'input' or 'command'");
            }

            boolean addNewline = ToolArguments.bool(parameters, "add_newline", true);
            boolean autoRead = ToolArguments.bool(parameters, "auto_read", true);
            double waitSeconds = ToolArguments.number(parameters, "sleep_seconds", DEFAULT_WAIT_SECONDS);
            String finalInput = addNewline ? input + "\n" : input;

            String sessionId = context.getSessionId();
            TerminalPort.WriteResult write = terminalPort.write(sessionId, finalInput);
            if (!write.success()) {
                log.debug("[Tools] send_to_terminal failed for {}: {}", sessionId, write.message());
                return ToolResult.failure(write.message());
            }

            ToolResult result = ToolResult.success(write.message())
                    .with("sent_input", finalInput)
                    .with("note", "Input sent to terminal successfully");
            if (!autoRead) {
                return result;
            }

            Settled settled = awaitStableOutput(sessionId, Math.round(Math.max(0, waitSeconds) * 1000));
            return result
                    .with("terminal_output", TerminalEntryFormatter.format(settled.entries()))
                    .with("auto_read", true)
                    .with("note", settled.stable()
                            ? "Command sent and monitored until completion"
                            : "Command sent, timed out after " + waitSeconds + "s, showing partial results");
        });
    }

    private Settled awaitStableOutput(String sessionId, long timeoutMs) {
        long start = System.nanoTime();
        List<TerminalEntry> last = snapshot(sessionId);
        try {
            while (elapsedMs(start) < timeoutMs) {
                Thread.sleep(POLL_INTERVAL_MS);
                List<TerminalEntry> current = snapshot(sessionId);
                if (current.equals(last)) {
                    continue;
                }
                Thread.sleep(POLL_INTERVAL_MS);
                List<TerminalEntry> again = snapshot(sessionId);
                if (again.equals(current) && elapsedMs(start) > MIN_SETTLE_MS) {
                    return new Settled(true, again);
                }
                last = again;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return new Settled(false, snapshot(sessionId));
    }

    private List<TerminalEntry> snapshot(String sessionId) {
        return terminalPort.read(sessionId, RESULT_LINES).entries();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private record Settled(boolean stable, List<TerminalEntry> entries) {
    }
}
