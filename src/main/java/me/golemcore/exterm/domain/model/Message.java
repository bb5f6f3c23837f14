package me.golemcore.exterm.domain.model;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One entry of a conversation history. Messages are immutable once created;
 * the owning session only ever appends them or replaces the whole list during
 * summarization.
 *
 * <p>
 * Roles follow the OpenAI chat format: {@code system}, {@code user},
 * {@code assistant} and {@code tool}. Assistant messages may carry the tool
 * calls the model requested, tool messages reference the call they answer via
 * {@link #getToolCallId()}.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    String role;
    String content;
    List<ToolCall> toolCalls;
    String toolCallId;
    String toolName;

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    /**
     * Assistant turn that requested tools. Content may be empty when the model
     * went straight to calling tools.
     */
    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .toolCalls(List.copyOf(toolCalls))
                .build();
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(ROLE_TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .content(content)
                .build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean isSystem() {
        return ROLE_SYSTEM.equals(role);
    }
}
