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

/**
 * Classification of tool failures. Used for logging and tests; the model only
 * sees the error text.
 */
public enum ToolFailureKind {

    /**
     * Arguments were not a valid JSON object.
     */
    INVALID_ARGUMENTS,

    /**
     * No handler is registered for the requested tool name.
     */
    UNKNOWN_TOOL,

    /**
     * Handler did not finish within the tool timeout.
     */
    TIMEOUT,

    /**
     * Tool execution failed during runtime (exceptions, I/O errors, missing
     * collaborators, etc.).
     */
    EXECUTION_FAILED
}
