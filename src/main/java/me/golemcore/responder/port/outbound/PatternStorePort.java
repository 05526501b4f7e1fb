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

import me.golemcore.responder.domain.model.ResponsePattern;

import java.util.Collection;
import java.util.List;

/**
 * Persistent pattern store consulted by the registry on reload and written by
 * the administration surface.
 *
 * <p>
 * Implementations may throw unchecked exceptions on I/O failure; the registry
 * logs them and keeps its current snapshot.
 */
public interface PatternStorePort {

    List<ResponsePattern> loadAll();

    void save(ResponsePattern pattern);

    /**
     * Replace the stored set with the given patterns.
     */
    void saveAll(Collection<ResponsePattern> patterns);

    boolean delete(String patternId);
}
