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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a tool execution. Serialized as a flat JSON object
 * ({@code {"success":true,"message":...,"path":...}}) which becomes the
 * content of the {@code tool} message the model sees, so tool failures are
 * reported as data rather than exceptions.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "success", "message", "error" })
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String message;
    private String error;

    @JsonIgnore
    private ToolFailureKind failureKind;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    /**
     * Extra result fields, flattened next to {@code success}.
     */
    @JsonAnyGetter
    public Map<String, Object> details() {
        return data;
    }

    public ToolResult with(String key, Object value) {
        if (value != null) {
            data.put(key, value);
        }
        return this;
    }

    public static ToolResult success(String message) {
        return ToolResult.builder()
                .success(true)
                .message(message)
                .build();
    }

    /**
     * Successful result without a message; callers add fields via
     * {@link #with(String, Object)}.
     */
    public static ToolResult success() {
        return ToolResult.builder()
                .success(true)
                .build();
    }

    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(ToolFailureKind.EXECUTION_FAILED)
                .build();
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }
}
