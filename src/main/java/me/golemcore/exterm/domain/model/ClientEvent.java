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

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Downstream event produced by a chat session for its client connection.
 *
 * <p>
 * The wire form is a flat JSON object with a {@code type} discriminator, the
 * event fields, and the {@code timestamp}/{@code session_id} envelope added by
 * {@link #toPayload(String, Instant)}.
 */
@Value
public class ClientEvent {

    public static final String TYPE_STREAM_START = "stream_start";
    public static final String TYPE_STREAM_CHUNK = "stream_chunk";
    public static final String TYPE_STREAM_END = "stream_end";
    public static final String TYPE_TOOL_USAGE = "tool_usage";
    public static final String TYPE_TOOL_RESULT = "tool_result";
    public static final String TYPE_AI_STATUS = "ai_status";
    public static final String TYPE_ERROR = "error";
    public static final String TYPE_SYSTEM = "system";
    public static final String TYPE_PING = "ping";
    public static final String TYPE_PONG = "pong";

    public static final String ROLE_THINKING = "thinking";

    private static final String FIELD_CONTENT = "content";

    String type;
    Map<String, Object> fields;

    private static ClientEvent of(String type, Map<String, Object> fields) {
        return new ClientEvent(type, Collections.unmodifiableMap(fields));
    }

    private static ClientEvent of(String type, String key, Object value) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(key, value);
        return of(type, fields);
    }

    public static ClientEvent streamStart(String model) {
        return of(TYPE_STREAM_START, "model", model);
    }

    public static ClientEvent streamChunk(String content) {
        return of(TYPE_STREAM_CHUNK, FIELD_CONTENT, content);
    }

    public static ClientEvent thinkingChunk(String content) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FIELD_CONTENT, content);
        fields.put("role", ROLE_THINKING);
        return of(TYPE_STREAM_CHUNK, fields);
    }

    public static ClientEvent streamEnd(String reason) {
        return of(TYPE_STREAM_END, "reason", reason);
    }

    public static ClientEvent toolUsage(String summary, List<ToolCall> toolCalls) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FIELD_CONTENT, summary);
        fields.put("tool_calls", List.copyOf(toolCalls));
        return of(TYPE_TOOL_USAGE, fields);
    }

    public static ClientEvent toolResult(ToolCall toolCall, ToolResult result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("tool_name", toolCall.getName());
        fields.put("tool_call", toolCall);
        fields.put("result", result);
        return of(TYPE_TOOL_RESULT, fields);
    }

    public static ClientEvent aiStatus(AiStatus status) {
        return of(TYPE_AI_STATUS, "status", status.getWireName());
    }

    public static ClientEvent aiStatus(AiStatus status, String message) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", status.getWireName());
        fields.put("message", message);
        return of(TYPE_AI_STATUS, fields);
    }

    public static ClientEvent error(String content) {
        return of(TYPE_ERROR, FIELD_CONTENT, content);
    }

    public static ClientEvent system(String content) {
        return of(TYPE_SYSTEM, FIELD_CONTENT, content);
    }

    public static ClientEvent ping() {
        return of(TYPE_PING, new LinkedHashMap<>());
    }

    public static ClientEvent pong() {
        return of(TYPE_PONG, new LinkedHashMap<>());
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public Map<String, Object> toPayload(String sessionId, Instant timestamp) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.putAll(fields);
        payload.put("timestamp", timestamp.toString());
        payload.put("session_id", sessionId);
        return payload;
    }
}
