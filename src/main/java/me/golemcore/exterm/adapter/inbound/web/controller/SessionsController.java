package me.golemcore.exterm.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.exterm.domain.model.Message;
import me.golemcore.exterm.domain.model.SessionInfo;
import me.golemcore.exterm.domain.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Live chat session browser and per-session stop/start.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private final SessionRegistry registry;

    @GetMapping
    public Mono<ResponseEntity<List<SessionInfo>>> listSessions() {
        return Mono.just(ResponseEntity.ok(registry.list()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionInfo>> getSession(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(registry.describe(id)));
    }

    @GetMapping("/{id}/history")
    public Mono<ResponseEntity<List<Message>>> getHistory(@PathVariable String id) {
        return Mono.fromCallable(() -> registry.require(id))
                .flatMap(session -> Mono.fromFuture(session.getHistory()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{id}/stop")
    public Mono<ResponseEntity<SessionInfo>> stopSession(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            log.info("[API] Stop requested for session {}", id);
            return ResponseEntity.ok(registry.stopSession(id));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/start")
    public Mono<ResponseEntity<SessionInfo>> startSession(@PathVariable String id) {
        return Mono.fromCallable(() -> {
            log.info("[API] Start requested for session {}", id);
            return ResponseEntity.ok(registry.startSession(id));
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
