package me.golemcore.responder.port.outbound;

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

import me.golemcore.responder.domain.model.MessageOrigin;

import java.util.List;

/**
 * Provides the origins of the most recent messages of a conversation, oldest
 * first, for loop detection.
 */
public interface ConversationHistoryPort {

    List<MessageOrigin> recentOrigins(String conversationId, int limit);

    void append(String conversationId, MessageOrigin origin);
}
