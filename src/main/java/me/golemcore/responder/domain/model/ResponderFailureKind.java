package me.golemcore.responder.domain.model;

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
 * Named failure categories returned by the public surface of the core.
 */
public enum ResponderFailureKind {

    /**
     * Message text missing, empty, not valid text or longer than the limit.
     */
    INVALID_INPUT,

    /**
     * Malformed pattern rejected at registration time.
     */
    VALIDATION,

    /**
     * Response template references context that is not available.
     */
    TEMPLATE,

    /**
     * Per-user guard state could not be read or updated.
     */
    GUARD_UNAVAILABLE,

    /**
     * Stats sink unreachable. Never fatal.
     */
    SINK_UNAVAILABLE,

    NOT_FOUND,

    /**
     * Anything else; callers treat it as "defer".
     */
    INTERNAL
}
