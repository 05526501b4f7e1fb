package me.golemcore.responder.domain.exception;

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

import me.golemcore.responder.domain.model.ResponderFailureKind;

/**
 * Base type for failures raised inside the core. Each subclass maps to one
 * {@link ResponderFailureKind}; the inbound ports translate them into
 * {@code ResponderResult} failures.
 */
public class ResponderException extends RuntimeException {

    private final ResponderFailureKind failureKind;

    public ResponderException(ResponderFailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public ResponderException(ResponderFailureKind failureKind, String message, Throwable cause) {
        super(message, cause);
        this.failureKind = failureKind;
    }

    public ResponderFailureKind getFailureKind() {
        return failureKind;
    }
}
