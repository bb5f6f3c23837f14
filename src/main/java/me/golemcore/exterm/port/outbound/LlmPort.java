package me.golemcore.exterm.port.outbound;

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

import me.golemcore.exterm.domain.model.LlmRequest;
import me.golemcore.exterm.domain.model.StreamDelta;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for OpenAI-compatible chat completion providers.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openrouter", "groq").
     */
    String getProviderId();

    /**
     * Returns the model used when a request does not name one.
     */
    String getCurrentModel();

    /**
     * Streams a generation as typed deltas. The flux is cold, finite and must
     * not be re-subscribed. Transport failures terminate it with
     * {@link me.golemcore.exterm.domain.exception.LlmTransportException}, non-2xx
     * answers with
     * {@link me.golemcore.exterm.domain.exception.LlmProviderException}.
     */
    Flux<StreamDelta> chatStream(LlmRequest request);

    /**
     * Executes a non-streaming completion and returns the assistant text.
     */
    CompletableFuture<String> complete(LlmRequest request);

    /**
     * Checks if the provider is configured (URL and API key present).
     */
    boolean isAvailable();
}
