package me.golemcore.exterm.domain.toolloop;

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

import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.ToolCall;
import me.golemcore.exterm.domain.model.ToolResult;

/**
 * Result of executing a single tool call inside a tool round.
 *
 * @param toolCall
 *            the call as requested by the model
 * @param result
 *            structured result, never null
 * @param messageContent
 *            JSON-encoded result, used as the tool message content
 */
public record ToolExecutionOutcome(ToolCall toolCall, ToolResult result, String messageContent) {

    public Message toMessage() {
        return Message.tool(toolCall.getId(), toolCall.getName(), messageContent);
    }
}
