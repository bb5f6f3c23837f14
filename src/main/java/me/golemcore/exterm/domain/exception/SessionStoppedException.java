package me.golemcore.exterm.domain.exception;

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
 * A user message was rejected because the session or the whole AI is
 * stopped. The session state is left untouched.
 */
public class SessionStoppedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final String GLOBALLY_STOPPED = "AI is globally stopped. Please contact administrator.";
    public static final String SESSION_STOPPED = "AI session is currently stopped. Send a 'start_ai' message to resume.";
    public static final String CANNOT_START = "AI is globally stopped. Cannot start session.";

    private final boolean global;

    private SessionStoppedException(String message, boolean global) {
        super(message);
        this.global = global;
    }

    public static SessionStoppedException globally() {
        return new SessionStoppedException(GLOBALLY_STOPPED, true);
    }

    public static SessionStoppedException session() {
        return new SessionStoppedException(SESSION_STOPPED, false);
    }

    public static SessionStoppedException cannotStart() {
        return new SessionStoppedException(CANNOT_START, true);
    }

    public boolean isGlobal() {
        return global;
    }
}
