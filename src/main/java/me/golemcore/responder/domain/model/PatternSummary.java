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

import java.util.List;

/**
 * Overview of the active pattern set for administration screens.
 */
@Data
@Builder
public class PatternSummary {

    private long version;
    private int total;
    private int active;
    private int inactive;
    private List<Entry> patterns;

    @Data
    @Builder
    public static class Entry {
        private String id;
        private String description;
        private MessageType messageType;
        private ResponsePriority priority;
        private boolean enabled;
    }
}
