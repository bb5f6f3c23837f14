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

import java.util.Locale;

/**
 * Requested size of a generated conversation summary.
 */
public enum SummaryLength {

    SHORT("Keep the summary very concise (2-3 sentences)."),
    MEDIUM("Provide a moderate summary (1-2 paragraphs)."),
    LONG("Provide a detailed summary (2-3 paragraphs).");

    private final String instruction;

    SummaryLength(String instruction) {
        this.instruction = instruction;
    }

    public String getInstruction() {
        return instruction;
    }

    public static SummaryLength fromWireName(String value) {
        if (value == null) {
            return MEDIUM;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
        case "short" -> SHORT;
        case "long" -> LONG;
        default -> MEDIUM;
        };
    }
}
