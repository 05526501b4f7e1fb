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
 * Message text missing, empty, not valid text, or longer than the configured
 * maximum. Raised before classification; text is never truncated silently.
 */
public class InvalidInputException extends ResponderException {

    public InvalidInputException(String message) {
        super(ResponderFailureKind.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(ResponderFailureKind.INVALID_INPUT, message, cause);
    }
}
