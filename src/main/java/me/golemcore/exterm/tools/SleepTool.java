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

import me.golemcore.exterm.domain.component.ToolComponent;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits a bounded amount of time, typically before reading terminal output
 * again.
 */
@Component
public class SleepTool implements ToolComponent {

    static final double MIN_SECONDS = 0.1;
    static final double MAX_SECONDS = 10.0;

    @Override
    public ToolKind getKind() {
        return ToolKind.SLEEP;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Wait for a specified amount of time. Useful for waiting for terminal commands "
                        + "to complete before reading output.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "seconds", ToolDefinition.property("number",
                                "Number of seconds to wait (can be decimal, e.g., 0.5 for 500ms)")),
                        List.of("seconds")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        double requested = ToolArguments.number(parameters, "seconds", MIN_SECONDS);
        double seconds = Math.max(MIN_SECONDS, Math.min(requested, MAX_SECONDS));
        long millis = Math.round(seconds * 1000);
        ToolResult result = ToolResult.success("Waited for " + seconds + " seconds")
                .with("slept_seconds", seconds);
        return CompletableFuture.supplyAsync(() -> result,
                CompletableFuture.delayedExecutor(millis, TimeUnit.MILLISECONDS));
    }
}
