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

import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.toolloop.ContinuationController;
import me.golemcore.exterm.infrastructure.config.ExtermProperties;
import me.golemcore.exterm.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Creates chat sessions seeded with the rendered system prompt.
 */
@Component
public class ChatSessionFactory {

    private final SessionCollaborators collaborators;
    private final SystemPromptRenderer promptRenderer;

    public ChatSessionFactory(LlmPort llmPort, ContinuationController continuationController,
            ConversationSummarizer summarizer, SystemPromptRenderer promptRenderer, SessionRegistry registry,
            ExtermProperties properties, Clock clock,
            @Qualifier("sessionMailboxExecutor") Executor mailboxExecutor,
            @Qualifier("toolExecutor") Executor toolExecutor) {
        this.promptRenderer = promptRenderer;
        this.collaborators = new SessionCollaborators(
                llmPort,
                continuationController,
                summarizer,
                mailboxExecutor,
                toolExecutor,
                registry::isGloballyStopped,
                properties.getLlm().getRequestTimeout(),
                properties.getSession().getSummaryKeepRecent(),
                clock);
    }

    public ChatSession create(String sessionId, SessionEventListener listener) {
        List<Message> initialHistory = List.of(Message.system(promptRenderer.render(sessionId)));
        return new ChatSession(sessionId, initialHistory, listener, collaborators);
    }
}
