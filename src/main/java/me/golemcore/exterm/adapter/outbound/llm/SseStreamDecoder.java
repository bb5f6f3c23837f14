package me.golemcore.exterm.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.exception.LlmTransportException;
import me.golemcore.exterm.domain.model.StreamDelta;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily decodes an OpenAI-style {@code text/event-stream} body into
 * {@link StreamDelta}s.
 *
 * <p>
 * Only {@code data:} lines are considered. {@code [DONE]} yields a single
 * {@code Finish("stop")} and ends the sequence; a payload that is not valid
 * JSON is skipped. Both the {@code reasoning} and {@code reasoning_content}
 * dialects are mapped to {@link StreamDelta.Thinking}. A read failure surfaces
 * as {@link LlmTransportException} from {@link #next()} or
 * {@link #hasNext()}.
 */
@Slf4j
public class SseStreamDecoder implements Iterator<StreamDelta> {

    static final String DATA_PREFIX = "data:";
    static final String DONE_MARKER = "[DONE]";

    private final BufferedReader reader;
    private final ObjectMapper objectMapper;
    private final Deque<StreamDelta> pending = new ArrayDeque<>();
    private boolean finished = false;

    public SseStreamDecoder(BufferedReader reader, ObjectMapper objectMapper) {
        this.reader = reader;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && !finished) {
            readNextEvent();
        }
        return !pending.isEmpty();
    }

    @Override
    public StreamDelta next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.pollFirst();
    }

    private void readNextEvent() {
        String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            finished = true;
            throw new LlmTransportException("Stream read failed: " + e.getMessage(), e);
        }
        if (line == null) {
            finished = true;
            return;
        }
        if (!line.startsWith(DATA_PREFIX)) {
            return;
        }

        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (payload.isEmpty()) {
            return;
        }
        if (DONE_MARKER.equals(payload)) {
            pending.addLast(new StreamDelta.Finish(StreamDelta.Finish.STOP));
            finished = true;
            return;
        }

        try {
            decodePayload(objectMapper.readTree(payload));
        } catch (JsonProcessingException e) {
            log.debug("[LLM] Dropping malformed stream event: {}", e.getOriginalMessage());
        }
    }

    private void decodePayload(JsonNode event) {
        JsonNode choice = event.path("choices").path(0);
        if (choice.isMissingNode()) {
            return;
        }
        JsonNode delta = choice.path("delta");

        String content = textOrNull(delta.path("content"));
        if (content != null && !content.isEmpty()) {
            pending.addLast(new StreamDelta.Content(content));
        }

        String reasoning = textOrNull(delta.path("reasoning"));
        if (reasoning == null) {
            reasoning = textOrNull(delta.path("reasoning_content"));
        }
        if (reasoning != null && !reasoning.isEmpty()) {
            pending.addLast(new StreamDelta.Thinking(reasoning));
        }

        JsonNode toolCalls = delta.path("tool_calls");
        if (toolCalls.isArray()) {
            for (int position = 0; position < toolCalls.size(); position++) {
                JsonNode call = toolCalls.get(position);
                int index = call.path("index").isInt() ? call.path("index").asInt() : position;
                JsonNode function = call.path("function");
                pending.addLast(new StreamDelta.ToolCallFragment(
                        index,
                        textOrNull(call.path("id")),
                        textOrNull(function.path("name")),
                        textOrNull(function.path("arguments"))));
            }
        }

        String finishReason = textOrNull(choice.path("finish_reason"));
        if (finishReason != null && !finishReason.isEmpty()) {
            pending.addLast(new StreamDelta.Finish(finishReason));
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
