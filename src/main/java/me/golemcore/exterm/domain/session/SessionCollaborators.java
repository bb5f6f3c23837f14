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

import me.golemcore.exterm.domain.toolloop.ContinuationController;
import me.golemcore.exterm.port.outbound.LlmPort;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Shared services every {@link ChatSession} works with.
 *
 * @param mailboxExecutor
 *            runs mailbox drains; shared by all sessions
 * @param toolExecutor
 *            runs tool rounds, which may block
 * @param globalStop
 *            reads the registry-wide kill switch
 */
public record SessionCollaborators(
        LlmPort llmPort,
        ContinuationController continuationController,
        ConversationSummarizer summarizer,
        Executor mailboxExecutor,
        Executor toolExecutor,
        BooleanSupplier globalStop,
        Duration generationTimeout,
        int summaryKeepRecent,
        Clock clock) {
}
