package me.golemcore.exterm.adapter.inbound.web;

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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;

/**
 * Outbound side of one chat WebSocket. Session events arrive from the session
 * mailbox, the heartbeat timer and the inbound handler, so emission is
 * serialized here.
 */
@Slf4j
class ChatConnection {

    private final String sessionId;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();

    ChatConnection(String sessionId, ObjectMapper objectMapper, Clock clock) {
        this.sessionId = sessionId;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    String getSessionId() {
        return sessionId;
    }

    Flux<String> outbound() {
        return sink.asFlux();
    }

    void send(ClientEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event.toPayload(sessionId, clock.instant()));
        } catch (JsonProcessingException e) {
            log.warn("[WebSocket] Failed to serialize {} event for {}: {}", event.getType(), sessionId,
                    e.getMessage());
            return;
        }
        synchronized (sink) {
            Sinks.EmitResult result = sink.tryEmitNext(json);
            if (result.isFailure()) {
                log.debug("[WebSocket] Dropped {} event for {}: {}", event.getType(), sessionId, result);
            }
        }
    }

    void complete() {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }
}
