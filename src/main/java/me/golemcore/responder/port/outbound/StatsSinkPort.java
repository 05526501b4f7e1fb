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

import me.golemcore.responder.domain.exception.SinkUnavailableException;
import me.golemcore.responder.domain.model.FeedbackEvent;
import me.golemcore.responder.domain.model.StatRecord;

import java.time.Instant;
import java.util.List;

/**
 * Durable destination for decision outcomes. Called only from the stats
 * recorder's background writer, never from the response path.
 */
public interface StatsSinkPort {

    /**
     * @throws SinkUnavailableException
     *             if the sink cannot be reached
     */
    void append(StatRecord statRecord);

    /**
     * @throws SinkUnavailableException
     *             if the sink cannot be reached
     */
    void appendFeedback(FeedbackEvent feedback);

    /**
     * Load records written at or after {@code since}, with feedback already
     * applied.
     */
    List<StatRecord> loadSince(Instant since);
}
