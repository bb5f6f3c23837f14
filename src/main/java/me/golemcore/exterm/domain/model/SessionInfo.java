package me.golemcore.exterm.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a registered session.
 */
@Value
@Builder(toBuilder = true)
public class SessionInfo {

    String id;
    SessionStatus status;

    @JsonProperty("turn_state")
    TurnState turnState;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("last_activity")
    Instant lastActivity;

    @JsonProperty("message_count")
    int messageCount;
}
