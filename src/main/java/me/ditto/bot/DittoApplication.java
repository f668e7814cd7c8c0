package me.ditto.bot;

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
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Ditto chat bot.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Event Scheduler</b> - durable, restart-safe delivery of named events
 * at a given instant</li>
 * <li><b>Reminders</b> - {@code /remind} built on the event scheduler</li>
 * <li><b>Time Zones</b> - per-user time zone management</li>
 * <li><b>Command Stats</b> - batched command usage history</li>
 * <li><b>Log Shipping</b> - warnings and errors forwarded to a chat
 * webhook</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → CommandRouter, REST controllers
 * Domain Layer       → EventScheduler, TimeZoneService, CommandStatsService
 * Infrastructure     → JPA stores, webhook client, Spring event bus
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix, datasource via {@code spring.datasource.*}.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class DittoApplication {

    public static void main(String[] args) {
        SpringApplication.run(DittoApplication.class, args);
    }

}
