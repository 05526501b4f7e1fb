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
 * Who produced a message in a conversation. Used by loop detection: a tail of
 * consecutive {@link #AUTOMATIC} or {@link #EXTERNAL} entries means the bot is
 * talking to itself.
 */
public enum MessageOrigin {

    /**
     * Written by a human user.
     */
    USER,

    /**
     * Canned response sent by this core.
     */
    AUTOMATIC,

    /**
     * Reply produced by the external text generator.
     */
    EXTERNAL;

    public boolean isMachineGenerated() {
        return this != USER;
    }
}
