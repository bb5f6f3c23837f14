package me.golemcore.exterm.domain.tool;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * View of the owning chat session handed to tools. History access goes through
 * the session's mailbox, so both operations are asynchronous.
 */
public interface ToolContext {

    String getSessionId();

    CompletableFuture<List<Message>> getHistory();

    CompletableFuture<Void> replaceHistory(List<Message> messages);
}
