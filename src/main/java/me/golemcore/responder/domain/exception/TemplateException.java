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

import java.util.List;

/**
 * Response template references context that is unavailable and has no default.
 * Generation fails closed: no partially rendered text is ever returned.
 */
public class TemplateException extends ResponderException {

    private final List<String> missingKeys;

    public TemplateException(String message, List<String> missingKeys) {
        super(ResponderFailureKind.TEMPLATE, message);
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }
}
