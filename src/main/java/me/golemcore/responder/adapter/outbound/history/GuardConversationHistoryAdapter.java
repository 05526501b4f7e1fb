package me.golemcore.responder.adapter.outbound.history;

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
import me.golemcore.responder.port.outbound.ConversationHistoryPort;
import me.golemcore.responder.ratelimit.ResponseGuard;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Default conversation history provider backed by the guard's per-conversation
 * origin ring buffer. Replace with a transport-specific adapter when the
 * channel keeps its own message log.
 */
@Component
@RequiredArgsConstructor
public class GuardConversationHistoryAdapter implements ConversationHistoryPort {

    private final ResponseGuard responseGuard;

    @Override
    public List<MessageOrigin> recentOrigins(String conversationId, int limit) {
        List<MessageOrigin> origins = responseGuard.recentOrigins(conversationId);
        if (limit <= 0 || origins.size() <= limit) {
            return origins;
        }
        return List.copyOf(origins.subList(origins.size() - limit, origins.size()));
    }

    @Override
    public void append(String conversationId, MessageOrigin origin) {
        responseGuard.recordOrigin(conversationId, origin);
    }
}
