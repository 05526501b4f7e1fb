package me.golemcore.responder.stats;

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

import me.golemcore.responder.domain.exception.ResponderException;
import me.golemcore.responder.domain.model.AcceptanceStats;
import me.golemcore.responder.domain.model.StatRecord;
import me.golemcore.responder.domain.model.StatsSummary;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Interface for recording decision outcomes and aggregating acceptance
 * metrics.
 *
 * <p>
 * Recording is fire-and-forget: {@link #record(StatRecord)} returns as soon as
 * the record is indexed in memory and queued for the sink. Statistics can be
 * queried per pattern or for all patterns over a time window.
 *
 * @since 1.0
 * @see AsyncStatsRecorder
 */
public interface StatsRecorder {

    /**
     * Append an outcome.
     *
     * @return id of the stored record, or null when recording is disabled
     */
    String record(StatRecord outcome);

    /**
     * Attach user feedback to a record. Allowed exactly once per record.
     *
     * @return copy of the updated record
     * @throws ResponderException
     *             {@code NOT_FOUND} for unknown ids, {@code VALIDATION} if
     *             feedback was already attached
     */
    StatRecord attachFeedback(String recordId, boolean accepted, String note);

    Optional<StatRecord> find(String recordId);

    /**
     * Accepted records divided by records with feedback in the window. Empty
     * when the pattern has no feedback in the window.
     */
    OptionalDouble acceptanceRate(String patternId, Duration window);

    AcceptanceStats patternStats(String patternId, Duration window);

    StatsSummary summary(Duration window);
}
