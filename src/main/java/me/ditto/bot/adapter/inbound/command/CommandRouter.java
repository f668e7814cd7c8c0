package me.ditto.bot.adapter.inbound.command;

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

import lombok.extern.slf4j.Slf4j;
import me.ditto.bot.domain.model.CommandInvocation;
import me.ditto.bot.domain.model.ScheduledEvent;
import me.ditto.bot.domain.model.StoreUnavailableException;
import me.ditto.bot.domain.service.CommandStatsService;
import me.ditto.bot.domain.service.DurationSupport;
import me.ditto.bot.domain.service.EventScheduler;
import me.ditto.bot.domain.service.ReminderService;
import me.ditto.bot.domain.service.TimeFormats;
import me.ditto.bot.domain.service.TimeZoneService;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.infrastructure.i18n.MessageService;
import me.ditto.bot.port.inbound.CommandPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes chat commands to their handlers.
 *
 * <ul>
 * <li>/help - Show available commands
 * <li>/about - Show bot name and version
 * <li>/uptime - Show how long the bot has been running
 * <li>/timezone [zone|user|get|set|clear|list] - Time zone lookups and
 * preferences
 * <li>/timezones [page] - List time zones
 * <li>/remind &lt;duration&gt; &lt;text&gt; - Schedule a reminder
 * <li>/command_history - Recent command usage (owners only)
 * <li>/next_event - Event the scheduler waits on (owners only)
 * </ul>
 *
 * <p>
 * Every executed command is recorded by {@link CommandStatsService}.
 *
 * @see me.ditto.bot.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    static final int TIMEZONES_PAGE_SIZE = 50;

    private static final String CMD_HELP = "help";
    private static final String CMD_ABOUT = "about";
    private static final String CMD_UPTIME = "uptime";
    private static final String CMD_TIMEZONE = "timezone";
    private static final String CMD_TIMEZONES = "timezones";
    private static final String CMD_REMIND = "remind";
    private static final String CMD_COMMAND_HISTORY = "command_history";
    private static final String CMD_NEXT_EVENT = "next_event";
    private static final String SUBCMD_GET = "get";
    private static final String SUBCMD_SET = "set";
    private static final String SUBCMD_CLEAR = "clear";
    private static final String SUBCMD_LIST = "list";
    private static final String NEWLINE = "\n";
    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Pattern USER_REFERENCE = Pattern.compile("^<@!?(\\d+)>$|^(\\d{5,})$");

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_HELP, CMD_ABOUT, CMD_UPTIME, CMD_TIMEZONE, CMD_TIMEZONES, CMD_REMIND,
            CMD_COMMAND_HISTORY, CMD_NEXT_EVENT);
    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);
    private static final Set<String> OWNER_COMMANDS = Set.of(CMD_COMMAND_HISTORY, CMD_NEXT_EVENT);

    private final EventScheduler eventScheduler;
    private final ReminderService reminderService;
    private final TimeZoneService timeZoneService;
    private final CommandStatsService statsService;
    private final MessageService messageService;
    private final BotProperties properties;
    private final Clock clock;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;
    private final Instant startedAt;

    public CommandRouter(
            EventScheduler eventScheduler,
            ReminderService reminderService,
            TimeZoneService timeZoneService,
            CommandStatsService statsService,
            MessageService messageService,
            BotProperties properties,
            Clock clock,
            ObjectProvider<BuildProperties> buildPropertiesProvider) {
        this.eventScheduler = eventScheduler;
        this.reminderService = reminderService;
        this.timeZoneService = timeZoneService;
        this.statsService = statsService;
        this.messageService = messageService;
        this.properties = properties;
        this.clock = clock;
        this.buildPropertiesProvider = buildPropertiesProvider;
        this.startedAt = clock.instant();
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        List<String> safeArgs = args != null ? args : List.of();
        Map<String, Object> safeContext = context != null ? context : Map.of();
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: {} (user={})", command, safeContext.get(CTX_USER_ID));
            if (!hasCommand(command)) {
                return CommandResult.failure(msg("command.unknown", command));
            }
            CommandResult result = executeKnown(command, safeArgs, safeContext);
            statsService.record(command, safeContext, !result.success());
            return result;
        });
    }

    private CommandResult executeKnown(String command, List<String> args, Map<String, Object> context) {
        String userId = contextString(context, CTX_USER_ID);
        if (OWNER_COMMANDS.contains(command) && !properties.isOwner(userId)) {
            return CommandResult.failure(msg("command.owner-only", command));
        }
        try {
            return switch (command) {
            case CMD_HELP -> handleHelp(context);
            case CMD_ABOUT -> handleAbout();
            case CMD_UPTIME -> handleUptime();
            case CMD_TIMEZONE -> handleTimezone(args, userId);
            case CMD_TIMEZONES -> handleTimezoneList(args);
            case CMD_REMIND -> handleRemind(args, userId, contextString(context, CTX_CHANNEL_TYPE));
            case CMD_COMMAND_HISTORY -> handleCommandHistory();
            case CMD_NEXT_EVENT -> handleNextEvent();
            default -> CommandResult.failure(msg("command.unknown", command));
            };
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("[Command] Store unavailable while running {}: {}", command, e.getMessage());
            return CommandResult.failure(msg("command.store-unavailable"));
        } catch (RuntimeException e) {
            log.error("[Command] Unexpected error with command {}", command, e);
            return CommandResult.failure(msg("command.error", command));
        }
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_HELP, "Show available commands", "help", false),
                new CommandDefinition(CMD_ABOUT, "Show information about the bot", "about", false),
                new CommandDefinition(CMD_UPTIME, "Show how long the bot has been running", "uptime", false),
                new CommandDefinition(CMD_TIMEZONE, "Get the current time for a user or time zone",
                        "timezone [zone|user|get [user]|set <zone>|clear|list]", false),
                new CommandDefinition(CMD_TIMEZONES, "List available time zones", "timezones [page]", false),
                new CommandDefinition(CMD_REMIND, "Schedule a reminder", "remind <duration> <text>", false),
                new CommandDefinition(CMD_COMMAND_HISTORY, "Show recent command usage", "command_history", true),
                new CommandDefinition(CMD_NEXT_EVENT, "Show the next scheduled event", "next_event", true));
    }

    // ==================== Info Commands ====================

    private CommandResult handleHelp(Map<String, Object> context) {
        String prefix = contextString(context, CTX_PREFIX);
        if (prefix == null) {
            prefix = properties.getPrefix();
        }
        boolean owner = properties.isOwner(contextString(context, CTX_USER_ID));
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.help.header")).append(NEWLINE);
        for (CommandDefinition command : listCommands()) {
            if (command.ownerOnly() && !owner) {
                continue;
            }
            sb.append(prefix).append(command.usage()).append(" - ").append(command.description()).append(NEWLINE);
        }
        return CommandResult.success(sb.toString().trim());
    }

    private CommandResult handleAbout() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        return CommandResult.success(msg("command.about", properties.getAppName(), version,
                System.getProperty("java.version")));
    }

    private CommandResult handleUptime() {
        Duration uptime = Duration.between(startedAt, clock.instant());
        String since = TimeFormats.humanFriendly(startedAt.atZone(ZoneOffset.UTC));
        return CommandResult.success(msg("command.uptime", TimeFormats.humanDuration(uptime), since));
    }

    // ==================== Time Zone Commands ====================

    private CommandResult handleTimezone(List<String> args, String userId) {
        if (args.isEmpty()) {
            return timeIn(UTC);
        }
        String subcommand = args.get(0).toLowerCase(Locale.ROOT);
        List<String> rest = args.subList(1, args.size());
        return switch (subcommand) {
        case SUBCMD_GET -> handleTimezoneGet(rest.isEmpty() ? userId : parseUserReference(rest.get(0)));
        case SUBCMD_SET -> handleTimezoneSet(rest, userId);
        case SUBCMD_CLEAR -> handleTimezoneClear(userId);
        case SUBCMD_LIST -> handleTimezoneList(rest);
        default -> handleTimezoneLookup(String.join(" ", args));
        };
    }

    private CommandResult handleTimezoneLookup(String argument) {
        try {
            return timeIn(timeZoneService.resolve(argument));
        } catch (IllegalArgumentException e) {
            Optional<String> user = matchUserReference(argument);
            if (user.isPresent()) {
                return handleTimezoneGet(user.get());
            }
            throw e;
        }
    }

    private CommandResult timeIn(ZoneId zone) {
        ZonedDateTime now = timeZoneService.now().atZone(zone);
        return CommandResult.success(msg("command.timezone.time-in", zone.getId(), TimeFormats.humanFriendly(now)));
    }

    private CommandResult handleTimezoneGet(String userId) {
        requireUser(userId);
        Optional<ZoneId> zone = timeZoneService.getTimeZone(userId);
        if (zone.isEmpty()) {
            return CommandResult.failure(msg("command.timezone.not-set", userId));
        }
        Instant now = timeZoneService.now();
        return CommandResult.success(msg("command.timezone.user-time", userId,
                TimeFormats.humanFriendly(now.atZone(zone.get())),
                zone.get().getId(), TimeFormats.utcOffset(zone.get(), now)));
    }

    private CommandResult handleTimezoneSet(List<String> args, String userId) {
        requireUser(userId);
        if (args.isEmpty()) {
            return CommandResult.failure(msg("command.timezone.set.usage"));
        }
        ZoneId zone = timeZoneService.resolve(String.join(" ", args));
        timeZoneService.setTimeZone(userId, zone);
        String localTime = TimeFormats.humanFriendly(timeZoneService.now().atZone(zone));
        return CommandResult.success(msg("command.timezone.set", zone.getId(), localTime));
    }

    private CommandResult handleTimezoneClear(String userId) {
        requireUser(userId);
        boolean existed = timeZoneService.clearTimeZone(userId);
        return CommandResult.success(msg(existed ? "command.timezone.cleared" : "command.timezone.clear.none"));
    }

    private CommandResult handleTimezoneList(List<String> args) {
        List<ZoneId> zones = timeZoneService.mainTimeZones();
        int pages = Math.max(1, (zones.size() + TIMEZONES_PAGE_SIZE - 1) / TIMEZONES_PAGE_SIZE);
        int page = 1;
        if (!args.isEmpty()) {
            try {
                page = Integer.parseInt(args.get(0));
            } catch (NumberFormatException e) {
                return CommandResult.failure(msg("command.timezones.invalid-page", args.get(0), pages));
            }
        }
        if (page < 1 || page > pages) {
            return CommandResult.failure(msg("command.timezones.invalid-page", args.get(0), pages));
        }

        Instant now = timeZoneService.now();
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.timezones.header", page, pages)).append(NEWLINE);
        int from = (page - 1) * TIMEZONES_PAGE_SIZE;
        int to = Math.min(zones.size(), from + TIMEZONES_PAGE_SIZE);
        for (ZoneId zone : zones.subList(from, to)) {
            sb.append('`').append(zone.getId()).append("` (").append(TimeFormats.utcOffset(zone, now)).append(')')
                    .append(NEWLINE);
        }
        return CommandResult.success(sb.toString().trim());
    }

    // ==================== Reminder Command ====================

    private CommandResult handleRemind(List<String> args, String userId, String channelType) {
        requireUser(userId);
        if (args.size() < 2) {
            return CommandResult.failure(msg("command.remind.usage"));
        }
        Duration delay = DurationSupport.parse(args.get(0));
        String text = String.join(" ", args.subList(1, args.size()));
        ScheduledEvent event = reminderService.scheduleReminder(userId, channelType, delay, text);
        String due = TimeFormats.humanFriendly(event.getScheduledFor().atZone(
                timeZoneService.getTimeZone(userId).orElse(ZoneOffset.UTC)));
        return CommandResult.success(msg("command.remind.scheduled", TimeFormats.humanDuration(delay), due), event);
    }

    // ==================== Owner Commands ====================

    private CommandResult handleCommandHistory() {
        List<CommandInvocation> invocations = statsService.recentInvocations();
        if (invocations.isEmpty()) {
            return CommandResult.success(msg("command.history.empty"));
        }
        StringBuilder sb = new StringBuilder();
        sb.append(msg("command.history.header", invocations.size())).append(NEWLINE);
        for (CommandInvocation invocation : invocations) {
            sb.append(msg("command.history.entry",
                    invocation.getInvokedAt() != null ? invocation.getInvokedAt().toString() : "?",
                    (invocation.getPrefix() != null ? invocation.getPrefix() : "") + invocation.getCommand(),
                    nullToDash(invocation.getUserId()),
                    nullToDash(invocation.getChannelType()) + "/" + nullToDash(invocation.getChatId()),
                    invocation.isFailed() ? msg("command.history.failed") : msg("command.history.ok")))
                    .append(NEWLINE);
        }
        return CommandResult.success(sb.toString().trim(), invocations);
    }

    private CommandResult handleNextEvent() {
        long pending = eventScheduler.getPendingCount();
        Optional<ScheduledEvent> next = eventScheduler.getNextScheduledEvent();
        if (next.isEmpty()) {
            return CommandResult.success(msg("command.next-event.none", pending));
        }
        ScheduledEvent event = next.get();
        return CommandResult.success(msg("command.next-event",
                event.getEventType(), String.valueOf(event.getId()),
                TimeFormats.humanFriendly(event.getScheduledFor().atZone(ZoneOffset.UTC)), pending), event);
    }

    // ==================== Helpers ====================

    private void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException(msg("command.user-required"));
        }
    }

    private String parseUserReference(String argument) {
        return matchUserReference(argument)
                .orElseThrow(() -> new IllegalArgumentException(msg("command.user-invalid", argument)));
    }

    private static Optional<String> matchUserReference(String argument) {
        Matcher matcher = USER_REFERENCE.matcher(argument.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1) != null ? matcher.group(1) : matcher.group(2));
    }

    private static String contextString(Map<String, Object> context, String key) {
        Object value = context.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    private static String nullToDash(String value) {
        return value != null ? value : "-";
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }
}
