package me.golemcore.exterm.domain.component;

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

import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component interface for tools the model can call through function calling.
 * Each implementation handles exactly one {@link ToolKind}.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    ToolKind getKind();

    /**
     * Returns the tool definition with JSON Schema for function calling. The
     * definition name must equal {@code getKind().getToolName()}.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with already-parsed arguments. Implementations report
     * failures as unsuccessful {@link ToolResult}s; an exceptionally completed
     * future is still converted to a failure by the dispatcher.
     *
     * @param parameters
     *            the execution parameters as a map
     * @param context
     *            the session the call belongs to
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context);

    default String getToolName() {
        return getKind().getToolName();
    }
}
