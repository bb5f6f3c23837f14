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
import me.golemcore.exterm.adapter.inbound.web.dto.AiStatusResponse;
import me.golemcore.exterm.domain.session.SessionRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Global kill switch.
 */
@RestController
@RequestMapping("/api/ai")
@RequiredArgsConstructor
@Slf4j
public class AiController {

    private final SessionRegistry registry;

    @PostMapping("/stop")
    public Mono<ResponseEntity<AiStatusResponse>> stopAll() {
        return Mono.fromCallable(() -> {
            int stopped = registry.stopAll();
            log.warn("[API] AI globally stopped, {} sessions affected", stopped);
            return ResponseEntity.ok(AiStatusResponse.builder()
                    .globallyStopped(true)
                    .activeSessions(registry.size())
                    .stoppedSessions(stopped)
                    .message("AI globally stopped")
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<AiStatusResponse>> startAll() {
        return Mono.fromCallable(() -> {
            registry.startAll();
            log.info("[API] AI globally started");
            return ResponseEntity.ok(AiStatusResponse.builder()
                    .globallyStopped(false)
                    .activeSessions(registry.size())
                    .message("AI globally started")
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<AiStatusResponse>> status() {
        return Mono.just(ResponseEntity.ok(AiStatusResponse.builder()
                .globallyStopped(registry.isGloballyStopped())
                .activeSessions(registry.size())
                .build()));
    }
}
