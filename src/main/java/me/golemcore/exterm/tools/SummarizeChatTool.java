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
import me.golemcore.exterm.domain.model.SummaryLength;
import me.golemcore.exterm.domain.model.SummaryReason;
import me.golemcore.exterm.domain.model.ToolDefinition;
import me.golemcore.exterm.domain.model.ToolResult;
import me.golemcore.exterm.domain.session.ConversationSummarizer;
import me.golemcore.exterm.domain.tool.ToolContext;
import me.golemcore.exterm.domain.tool.ToolKind;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lets the model condense its own conversation. The summary replaces the
 * older part of the calling session's history; system messages and the most
 * recent messages are kept.
 */
@Component
@Slf4j
public class SummarizeChatTool implements ToolComponent {

    private final ConversationSummarizer summarizer;
    private final int defaultKeepRecent;

    public SummarizeChatTool(ConversationSummarizer summarizer, ExtermProperties properties) {
        this.summarizer = summarizer;
        this.defaultKeepRecent = properties.getSession().getSummaryKeepRecent();
    }

    @Override
    public ToolKind getKind() {
        return ToolKind.SUMMARIZE_CHAT;
    }

    @Override
    public ToolDefinition getDefinition() {
        List<String> reasons = Arrays.stream(SummaryReason.values()).map(SummaryReason::getWireName).toList();
        return ToolDefinition.builder()
                .name(getToolName())
                .description("Summarize the current chat history to condense it when it becomes too long or "
                        + "when switching topics. This helps maintain context while reducing memory usage.")
                .inputSchema(ToolDefinition.objectSchema(Map.of(
                        "reason", Map.of(
                                "type", "string",
                                "description", "Reason for summarization: 'topic_change', "
                                        + "'automatic_length_limit', 'user_request', or 'custom'",
                                "enum", reasons),
                        "max_history_length", ToolDefinition.property("integer",
                                "Number of recent messages to keep after summarization (default: "
                                        + defaultKeepRecent + ")"),
                        "summary_length", Map.of(
                                "type", "string",
                                "description", "Length of summary: 'short', 'medium', or 'long' "
                                        + "(default: 'medium')",
                                "enum", List.of("short", "medium", "long"))),
                        List.of("reason")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters, ToolContext context) {
        SummaryReason reason = SummaryReason.fromWireName(ToolArguments.string(parameters, "reason"));
        int keepRecent = Math.max(0, ToolArguments.integer(parameters, "max_history_length", defaultKeepRecent));
        SummaryLength length = SummaryLength.fromWireName(ToolArguments.string(parameters, "summary_length"));

        return context.getHistory()
                .thenCompose(history -> summarizer.summarize(history, reason, keepRecent, length))
                .thenCompose(outcome -> {
                    if (!outcome.success()) {
                        return CompletableFuture.completedFuture(ToolResult.failure(outcome.error()));
                    }
                    if (!outcome.summarized()) {
                        return CompletableFuture.completedFuture(
                                ToolResult.success("Chat history is too short to summarize")
                                        .with("action", "none"));
                    }
                    log.info("[Summary] Session {} condensed from {} to {} messages", context.getSessionId(),
                            outcome.originalCount(), outcome.condensedHistory().size());
                    return context.replaceHistory(outcome.condensedHistory())
                            .thenApply(ignored -> ToolResult.success("Chat history summarized successfully")
                                    .with("reason", reason.getWireName())
                                    .with("original_message_count", outcome.originalCount())
                                    .with("condensed_message_count", outcome.condensedHistory().size())
                                    .with("summary_preview", outcome.summaryPreview()));
                });
    }
}
