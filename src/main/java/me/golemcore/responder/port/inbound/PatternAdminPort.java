package me.golemcore.responder.port.inbound;

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

import me.golemcore.responder.domain.model.AcceptanceStats;
import me.golemcore.responder.domain.model.PatternSummary;
import me.golemcore.responder.domain.model.ResponderResult;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.StatsSummary;

import java.time.Duration;
import java.util.List;

/**
 * CRUD-shaped administration surface over the pattern registry and the stats
 * recorder, intended to be wrapped by a REST layer.
 *
 * @since 1.0
 */
public interface PatternAdminPort {

    List<ResponsePattern> list(boolean enabledOnly);

    ResponderResult<ResponsePattern> get(String patternId);

    /**
     * Validate and admit a pattern, replacing any pattern with the same id.
     * Invalid patterns are rejected and the registry stays unchanged.
     */
    ResponderResult<ResponsePattern> upsert(ResponsePattern pattern);

    boolean remove(String patternId);

    /**
     * Keep the pattern but stop using it for classification.
     */
    boolean disable(String patternId);

    /**
     * Reload all patterns from the persistent store. Returns the number of
     * patterns in the new snapshot.
     */
    ResponderResult<Integer> reload();

    /**
     * Write the active patterns to the persistent store. Existing ids are
     * skipped unless {@code overwrite} is set. Returns the number written.
     */
    ResponderResult<Integer> sync(boolean overwrite);

    PatternSummary summary();

    StatsSummary stats(Duration window);

    AcceptanceStats patternStats(String patternId, Duration window);
}
