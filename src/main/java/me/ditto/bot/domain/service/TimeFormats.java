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
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Shared helpers for rendering times, offsets and durations in chat replies.
 */
public final class TimeFormats {

    private static final DateTimeFormatter CLOCK = DateTimeFormatter.ofPattern("hh:mma", Locale.ENGLISH);
    private static final DateTimeFormatter WEEKDAY = DateTimeFormatter.ofPattern("EEEE", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM, yyyy", Locale.ENGLISH);

    private TimeFormats() {
    }

    /**
     * Formats a time as e.g. {@code "03:04PM on Monday the 19th of October, 2026"}.
     */
    public static String humanFriendly(ZonedDateTime time) {
        return CLOCK.format(time) + " on " + WEEKDAY.format(time)
                + " the " + ordinal(time.getDayOfMonth())
                + " of " + MONTH_YEAR.format(time);
    }

    /**
     * Current UTC offset of the zone, e.g. {@code "UTC+05:30"}, or {@code "UTC"}
     * when the offset is zero.
     */
    public static String utcOffset(ZoneId zone, Instant at) {
        return utcOffset(zone.getRules().getOffset(at));
    }

    public static String utcOffset(ZoneOffset offset) {
        int total = offset.getTotalSeconds();
        if (total == 0) {
            return "UTC";
        }
        int absolute = Math.abs(total);
        int hours = absolute / 3600;
        int minutes = (absolute % 3600) / 60;
        int seconds = absolute % 60;
        StringBuilder sb = new StringBuilder("UTC").append(total < 0 ? '-' : '+');
        sb.append(String.format(Locale.ROOT, "%02d:%02d", hours, minutes));
        if (seconds != 0) {
            sb.append(String.format(Locale.ROOT, ":%02d", seconds));
        }
        return sb.toString();
    }

    /**
     * English ordinal, e.g. {@code 1st}, {@code 12th}, {@code 23rd}.
     */
    public static String ordinal(int number) {
        int lastTwo = Math.abs(number) % 100;
        String suffix;
        if (lastTwo >= 11 && lastTwo <= 13) {
            suffix = "th";
        } else {
            switch (lastTwo % 10) {
            case 1 -> suffix = "st";
            case 2 -> suffix = "nd";
            case 3 -> suffix = "rd";
            default -> suffix = "th";
            }
        }
        return number + suffix;
    }

    /**
     * Renders a duration as e.g. {@code "1 day, 2 hours, 5 seconds"}. Zero
     * components are skipped; sub-second precision is dropped.
     */
    public static String humanDuration(Duration duration) {
        long totalSeconds = Math.max(0, duration.getSeconds());
        long days = totalSeconds / 86400;
        long hours = (totalSeconds % 86400) / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;

        List<String> parts = new ArrayList<>();
        addUnit(parts, days, "day");
        addUnit(parts, hours, "hour");
        addUnit(parts, minutes, "minute");
        addUnit(parts, seconds, "second");
        return parts.isEmpty() ? "0 seconds" : String.join(", ", parts);
    }

    private static void addUnit(List<String> parts, long value, String unit) {
        if (value > 0) {
            parts.add(value + " " + unit + (value == 1 ? "" : "s"));
        }
    }
}
