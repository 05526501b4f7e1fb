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

import java.util.OptionalDouble;

/**
 * Aggregated acceptance metrics for one pattern (or all patterns) over a
 * window.
 *
 * <p>
 * {@code acceptanceRate} is accepted / (accepted + rejected) and is null when
 * no record in the window has feedback yet. Pending records (no feedback) are
 * excluded from the rate.
 *
 * @since 1.0
 */
@Data
@Builder
public class AcceptanceStats {

    private String key;
    private long total;
    private long sent;
    private long accepted;
    private long rejected;
    private long pending;
    private Double acceptanceRate;

    public OptionalDouble rate() {
        return acceptanceRate == null ? OptionalDouble.empty() : OptionalDouble.of(acceptanceRate);
    }

    public static AcceptanceStats empty(String key) {
        return AcceptanceStats.builder()
                .key(key)
                .build();
    }
}
