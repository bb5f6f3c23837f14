package me.golemcore.exterm.domain.session;

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
import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.SummaryLength;
import me.golemcore.exterm.domain.model.SummaryReason;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Condenses a conversation into a summary plus its most recent messages.
 *
 * <p>
 * The summary comes from an isolated, non-streaming generation with an empty
 * history. The summarizer never touches a session: callers pass a history
 * snapshot in and apply the condensed history themselves.
 */
@Service
@Slf4j
public class ConversationSummarizer {

    public static final int MIN_MESSAGES = 3;
    public static final String SUMMARY_PREFIX = "Previous conversation summary: ";
    static final String SUMMARIZER_SYSTEM_PROMPT = "You are a helpful assistant that creates concise summaries.";
    static final double SUMMARY_TEMPERATURE = 0.3;
    static final int SUMMARY_MAX_TOKENS = 1000;
    private static final int PREVIEW_LENGTH = 200;

    private static final String PROMPT_TEMPLATE = """
            You are an expert at summarizing technical conversations. Please provide a comprehensive summary \
            of this AI assistant conversation. %s %s

            **SUMMARIZATION GOALS:**
            - Preserve key technical details and context
            - Maintain important command outputs and file operations
            - Keep track of project state and ongoing work
            - Note any important decisions or conclusions
            - Preserve error resolutions and troubleshooting steps

            **FOCUS AREAS:**
            - Key topics and technical discussions
            - Commands executed and their outcomes
            - Files created, modified, or analyzed
            - Current state of any ongoing work
            - Important context that should be remembered for future assistance
            - Any unresolved issues or next steps

            **CONVERSATION TO SUMMARIZE:**
            %s

            **INSTRUCTIONS:**
            - Write in clear, technical language
            - Use bullet points or structured format for clarity
            - Include specific technical details that are important
            - Mention any ongoing context or state that should be preserved
            - Keep the summary focused and actionable

            Provide only the summary content, no meta-commentary about the summarization process.
            """;

    private final LlmPort llmPort;
    private final ExtermProperties properties;

    public ConversationSummarizer(LlmPort llmPort, ExtermProperties properties) {
        this.llmPort = llmPort;
        this.properties = properties;
    }

    /**
     * Result of a summarization attempt.
     *
     * @param success
     *            false only when the summary generation failed
     * @param summarized
     *            whether {@code condensedHistory} differs from the input
     * @param summary
     *            generated summary text, null when nothing was summarized
     * @param originalCount
     *            size of the input history
     * @param condensedHistory
     *            history to install, equal to the input when not summarized
     * @param error
     *            failure description, null on success
     */
    public record SummaryOutcome(boolean success, boolean summarized, String summary, int originalCount,
            List<Message> condensedHistory, String error) {

        public String summaryPreview() {
            if (summary == null) {
                return null;
            }
            return summary.length() > PREVIEW_LENGTH ? summary.substring(0, PREVIEW_LENGTH) + "..." : summary;
        }
    }

    public boolean shouldAutoSummarize(int messageCount) {
        return messageCount > properties.getSession().getAutoSummarizeThreshold();
    }

    public CompletableFuture<SummaryOutcome> summarize(List<Message> history, SummaryReason reason,
            int keepRecent, SummaryLength length) {
        List<Message> snapshot = List.copyOf(history);
        if (snapshot.size() <= MIN_MESSAGES) {
            return CompletableFuture.completedFuture(
                    new SummaryOutcome(true, false, null, snapshot.size(), snapshot, null));
        }

        LlmRequest request = LlmRequest.builder()
                .model(resolveSummaryModel())
                .messages(List.of(
                        Message.system(SUMMARIZER_SYSTEM_PROMPT),
                        Message.user(buildPrompt(snapshot, reason, length))))
                .temperature(SUMMARY_TEMPERATURE)
                .maxTokens(SUMMARY_MAX_TOKENS)
                .build();

        log.info("[Summary] Summarizing {} messages (reason={}, keep={})", snapshot.size(),
                reason.getWireName(), keepRecent);
        return llmPort.complete(request)
                .thenApply(summary -> new SummaryOutcome(true, true, summary, snapshot.size(),
                        condense(snapshot, summary, keepRecent), null))
                .exceptionally(error -> {
                    Throwable cause = error.getCause() != null ? error.getCause() : error;
                    log.warn("[Summary] Summary generation failed: {}", cause.getMessage());
                    return new SummaryOutcome(false, false, null, snapshot.size(), snapshot,
                            "Error summarizing chat: " + cause.getMessage());
                });
    }

    /**
     * System messages, then the summary as a system message, then the last
     * {@code keepRecent} non-system messages. Tool messages whose assistant
     * call fell outside the window are dropped from the front. A trailing
     * assistant message with tool calls is always kept: it is the round still
     * in flight, and its results are appended after the history is replaced.
     */
    static List<Message> condense(List<Message> history, String summary, int keepRecent) {
        List<Message> condensed = new ArrayList<>();
        List<Message> conversation = new ArrayList<>();
        for (Message message : history) {
            if (message.isSystem()) {
                condensed.add(message);
            } else {
                conversation.add(message);
            }
        }
        condensed.add(Message.system(SUMMARY_PREFIX + summary));

        int from = Math.max(0, conversation.size() - Math.max(0, keepRecent));
        if (!conversation.isEmpty() && conversation.get(conversation.size() - 1).hasToolCalls()) {
            from = Math.min(from, conversation.size() - 1);
        }
        while (from < conversation.size() && Message.ROLE_TOOL.equals(conversation.get(from).getRole())) {
            from++;
        }
        condensed.addAll(conversation.subList(from, conversation.size()));
        return condensed;
    }

    static String buildPrompt(List<Message> history, SummaryReason reason, SummaryLength length) {
        String conversation = history.stream()
                .filter(message -> !message.isSystem())
                .map(message -> message.getRole().toUpperCase(Locale.ROOT) + ": "
                        + (message.getContent() != null ? message.getContent() : ""))
                .collect(Collectors.joining("\n\n"));
        return PROMPT_TEMPLATE.formatted(reason.getPromptContext(), length.getInstruction(), conversation);
    }

    private String resolveSummaryModel() {
        String summaryModel = properties.getLlm().getSummaryModel();
        if (summaryModel != null && !summaryModel.isBlank()) {
            return summaryModel;
        }
        String model = properties.getLlm().getModel();
        return model != null && !model.isBlank() ? model : llmPort.getCurrentModel();
    }
}
