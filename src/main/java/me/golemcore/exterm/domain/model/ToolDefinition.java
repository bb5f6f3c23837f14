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

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Function the model may call. Carries the tool name, description, and JSON
 * Schema for input parameters.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Builds an object schema from property definitions and the required
     * property names.
     */
    public static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        if (required == null || required.isEmpty()) {
            return Map.of("type", "object", "properties", properties);
        }
        return Map.of("type", "object", "properties", properties, "required", required);
    }

    public static Map<String, Object> property(String type, String description) {
        return Map.of("type", type, "description", description);
    }
}
