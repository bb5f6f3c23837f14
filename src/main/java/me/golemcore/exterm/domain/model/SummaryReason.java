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

import java.util.Arrays;

/**
 * Why a conversation is being summarized. The reason shapes the instructions
 * given to the summarization model.
 */
public enum SummaryReason {

    TOPIC_CHANGE("topic_change", "The user is switching to a completely different topic."),
    AUTOMATIC_LENGTH_LIMIT("automatic_length_limit", "The conversation has become too long and needs to be condensed."),
    USER_REQUEST("user_request", "The user has explicitly requested a summary."),
    CUSTOM("custom", "The conversation needs to be summarized.");

    private final String wireName;
    private final String promptContext;

    SummaryReason(String wireName, String promptContext) {
        this.wireName = wireName;
        this.promptContext = promptContext;
    }

    public String getWireName() {
        return wireName;
    }

    public String getPromptContext() {
        return promptContext;
    }

    /**
     * Resolves a wire name, defaulting to {@link #USER_REQUEST} when absent and
     * to {@link #CUSTOM} when unrecognized.
     */
    public static SummaryReason fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return USER_REQUEST;
        }
        return Arrays.stream(values())
                .filter(reason -> reason.wireName.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(CUSTOM);
    }
}
