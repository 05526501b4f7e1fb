package me.golemcore.responder.domain.service;

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
import me.golemcore.responder.domain.model.PatternSummary;
import me.golemcore.responder.domain.model.ResponderFailureKind;
import me.golemcore.responder.domain.model.ResponderResult;
import me.golemcore.responder.domain.model.ResponsePattern;
import me.golemcore.responder.domain.model.StatsSummary;
import me.golemcore.responder.port.inbound.PatternAdminPort;
import me.golemcore.responder.stats.StatsRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Administration surface over {@link PatternRegistry} and
 * {@link StatsRecorder}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatternAdministrationService implements PatternAdminPort {

    private static final String LOG_PREFIX = "[Admin]";

    private final PatternRegistry patternRegistry;
    private final StatsRecorder statsRecorder;

    @Override
    public List<ResponsePattern> list(boolean enabledOnly) {
        return patternRegistry.list(enabledOnly);
    }

    @Override
    public ResponderResult<ResponsePattern> get(String patternId) {
        return patternRegistry.get(patternId)
                .map(ResponderResult::success)
                .orElseGet(() -> ResponderResult.failure(ResponderFailureKind.NOT_FOUND,
                        "Pattern not found: " + patternId));
    }

    @Override
    public ResponderResult<ResponsePattern> upsert(ResponsePattern pattern) {
        try {
            return ResponderResult.success(patternRegistry.upsert(pattern));
        } catch (ResponderException e) {
            log.warn("{} Rejected pattern: {}", LOG_PREFIX, e.getMessage());
            return ResponderResult.failure(e.getFailureKind(), e.getMessage());
        }
    }

    @Override
    public boolean remove(String patternId) {
        return patternRegistry.remove(patternId);
    }

    @Override
    public boolean disable(String patternId) {
        return patternRegistry.disable(patternId);
    }

    @Override
    public ResponderResult<Integer> reload() {
        try {
            return ResponderResult.success(patternRegistry.reload().size());
        } catch (ResponderException e) {
            log.warn("{} Reload rejected, keeping current patterns: {}", LOG_PREFIX, e.getMessage());
            return ResponderResult.failure(e.getFailureKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} Reload failed, keeping current patterns", LOG_PREFIX, e);
            return ResponderResult.failure(ResponderFailureKind.INTERNAL, e.getMessage());
        }
    }

    @Override
    public ResponderResult<Integer> sync(boolean overwrite) {
        try {
            return ResponderResult.success(patternRegistry.sync(overwrite));
        } catch (RuntimeException e) {
            log.warn("{} Sync failed: {}", LOG_PREFIX, e.getMessage());
            return ResponderResult.failure(ResponderFailureKind.INTERNAL, e.getMessage());
        }
    }

    @Override
    public PatternSummary summary() {
        return patternRegistry.summary();
    }

    @Override
    public StatsSummary stats(Duration window) {
        return statsRecorder.summary(window);
    }

    @Override
    public AcceptanceStats patternStats(String patternId, Duration window) {
        return statsRecorder.patternStats(patternId, window);
    }
}
