package me.ditto.bot.domain.service;

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

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses compact user-entered durations such as {@code 30s}, {@code 10m},
 * {@code 2h}, {@code 1d} or {@code 1h30m}.
 */
public final class DurationSupport {

    private static final Pattern COMPACT = Pattern.compile("^(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?$");

    private DurationSupport() {
    }

    /**
     * @throws IllegalArgumentException
     *             if the text is not a positive compact duration
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Duration is required");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = COMPACT.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + text + " (expected e.g. 30s, 10m, 2h, 1d, 1h30m)");
        }
        try {
            Duration result = Duration.ZERO
                    .plusDays(group(matcher, 1))
                    .plusHours(group(matcher, 2))
                    .plusMinutes(group(matcher, 3))
                    .plusSeconds(group(matcher, 4));
            if (result.isZero()) {
                throw new IllegalArgumentException("Duration must be positive: " + text);
            }
            return result;
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration is too large: " + text, e);
        }
    }

    private static long group(Matcher matcher, int index) {
        String value = matcher.group(index);
        if (value == null) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ArithmeticException("overflow");
        }
    }
}
