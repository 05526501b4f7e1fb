package me.golemcore.responder;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for GolemCore Responder.
 *
 * <p>
 * Decides whether an inbound chat message can be answered with a canned
 * response instead of the (expensive) external generator, and keeps users from
 * being flooded with automatic replies.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Pattern Registry</b> - regex triggers with templates, hot-swapped
 * atomically on reload</li>
 * <li><b>Classifier</b> - deterministic scoring with keyword bonuses, urgency,
 * mention and sentiment signals</li>
 * <li><b>Rate/Loop Guard</b> - rolling per-user limits and automated-reply
 * loop detection</li>
 * <li><b>Response Generator</b> - fail-closed template rendering with
 * personalization</li>
 * <li><b>Stats Recorder</b> - asynchronous JSONL outcome log with feedback and
 * acceptance rates</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Inbound ports      → AutoResponsePort, PatternAdminPort
 * Domain Layer       → PatternRegistry, MessageClassifier, DecisionEngine, ResponseGenerator
 * Infrastructure     → Local storage, JSON pattern store, JSONL stats sink
 * </pre>
 *
 * <p>
 * All configuration via {@code application.properties} under
 * {@code responder.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class ResponderApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResponderApplication.class, args);
    }

}
