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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight per-request view of the sender supplied by the caller. The core
 * never stores it.
 *
 * @since 1.0
 */
@Data
@Builder
public class UserContext {

    private String userId;

    /**
     * Conversation the message belongs to. Defaults to the user id for direct
     * chats.
     */
    private String conversationId;

    private String firstName;

    @Builder.Default
    private boolean premium = false;

    private long totalMessageCount;

    /**
     * Timestamps of automatic responses already sent to this user, most recent
     * first. Optional: the guard tracks its own window as well.
     */
    @Builder.Default
    private List<Instant> recentAutoResponseTimestamps = new ArrayList<>();

    /**
     * Additional values available to response templates.
     */
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    public String resolveConversationId() {
        return conversationId != null && !conversationId.isBlank() ? conversationId : userId;
    }
}
