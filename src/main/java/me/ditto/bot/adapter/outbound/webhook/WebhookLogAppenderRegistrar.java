package me.ditto.bot.adapter.outbound.webhook;

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

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Attaches the {@link WebhookLogShipper} to the root logger when a log webhook
 * is configured.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookLogAppenderRegistrar {

    static final String APPENDER_NAME = "WEBHOOK_LOG_SHIPPER";

    private final WebhookLogShipper shipper;
    private AppenderBase<ILoggingEvent> appender;

    @PostConstruct
    void registerAppender() {
        if (!shipper.isEnabled()) {
            return;
        }

        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        if (rootLogger.getAppender(APPENDER_NAME) != null) {
            return;
        }

        appender = new AppenderBase<>() {
            @Override
            protected void append(ILoggingEvent eventObject) {
                shipper.append(eventObject);
            }
        };
        appender.setContext(loggerContext);
        appender.setName(APPENDER_NAME);
        appender.start();
        rootLogger.addAppender(appender);
        log.info("[Webhook] Shipping log events to webhook");
    }

    @PreDestroy
    void unregisterAppender() {
        if (appender == null) {
            return;
        }
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.detachAppender(APPENDER_NAME);
        appender.stop();
        shipper.flush();
    }
}
