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

/**
 * Outcome of one user turn, including every tool round and continuation it
 * triggered.
 *
 * @param finishReason
 *            reason of the last {@code stream_end}
 * @param finalContent
 *            assistant text of the last generation, possibly empty
 * @param toolRounds
 *            number of tool rounds executed
 * @param failed
 *            whether the turn ended on a transport or provider error
 */
public record TurnResult(String finishReason, String finalContent, int toolRounds, boolean failed) {

    public static final String REASON_ERROR = "error";
    public static final String REASON_MAX_CONTINUATIONS = "max_continuations";
}
