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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.model.ClientEvent;
import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.ToolCall;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.session.SessionEventListener;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolDispatcher;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drives the tool loop between generations: builds the generation requests,
 * executes a round of tool calls and bounds how many follow-up generations a
 * single user turn may trigger.
 *
 * <p>
 * Follow-ups carry the continuation prompt as a trailing user message that is
 * sent to the provider but never stored in history.
 */
@Component
@Slf4j
public class ContinuationController {

    public static final String CONTINUATION_PROMPT = """
            Please analyze the tool results above and provide a comprehensive answer to the user's question. \
            If search results are not enough to provide correct data continue using tools as needed.""";

    private final LlmPort llmPort;
    private final ToolDispatcher toolDispatcher;
    private final ObjectMapper objectMapper;
    private final ExtermProperties properties;
    private final ToolUsageFormatter usageFormatter = new ToolUsageFormatter();

    public ContinuationController(LlmPort llmPort, ToolDispatcher toolDispatcher, ObjectMapper objectMapper,
            ExtermProperties properties) {
        this.llmPort = llmPort;
        this.toolDispatcher = toolDispatcher;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String resolveModel() {
        String configured = properties.getLlm().getModel();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return llmPort.getCurrentModel();
    }

    public LlmRequest initialRequest(String sessionId, List<Message> history) {
        return buildRequest(sessionId, new ArrayList<>(history));
    }

    public LlmRequest continuationRequest(String sessionId, List<Message> history) {
        List<Message> messages = new ArrayList<>(history);
        messages.add(Message.user(CONTINUATION_PROMPT));
        return buildRequest(sessionId, messages);
    }

    /**
     * Whether another follow-up generation is allowed after
     * {@code completedContinuations} follow-ups in the current turn.
     */
    public boolean canContinue(int completedContinuations) {
        return completedContinuations < properties.getSession().getMaxContinuations();
    }

    public int getMaxContinuations() {
        return properties.getSession().getMaxContinuations();
    }

    public String summarizeUsage(List<ToolCall> toolCalls) {
        return usageFormatter.summarize(toolCalls);
    }

    /**
     * Executes the calls sequentially in the order the model listed them and
     * emits one {@code tool_result} event per call. Blocks the calling thread.
     */
    public List<ToolExecutionOutcome> executeToolRound(List<ToolCall> toolCalls, ToolContext context,
            SessionEventListener listener) {
        List<ToolExecutionOutcome> outcomes = new ArrayList<>(toolCalls.size());
        for (ToolCall toolCall : toolCalls) {
            long started = System.currentTimeMillis();
            ToolResult result = toolDispatcher.execute(toolCall.getName(), toolCall.getArguments(), context);
            log.info("[Tools] '{}' finished in {}ms, success={}", toolCall.getName(),
                    System.currentTimeMillis() - started, result.isSuccess());
            listener.onEvent(ClientEvent.toolResult(toolCall, result));
            outcomes.add(new ToolExecutionOutcome(toolCall, result, encode(result)));
        }
        return outcomes;
    }

    private LlmRequest buildRequest(String sessionId, List<Message> messages) {
        return LlmRequest.builder()
                .model(resolveModel())
                .messages(messages)
                .tools(toolDispatcher.getDefinitions())
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxTokens())
                .sessionId(sessionId)
                .build();
    }

    private String encode(ToolResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to encode tool result: {}", e.getOriginalMessage());
            String error = result.getError() != null ? result.getError() : "Unserializable tool result";
            return "{\"success\":" + result.isSuccess() + ",\"error\":" + quote(error) + "}";
        }
    }

    private String quote(String value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return "\"\"";
        }
    }
}
