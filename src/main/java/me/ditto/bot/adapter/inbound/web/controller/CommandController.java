package me.ditto.bot.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.ditto.bot.infrastructure.config.BotProperties;
import me.ditto.bot.port.inbound.CommandPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs chat commands over HTTP, for operators and integration tests.
 */
@RestController
@RequestMapping("/api/commands")
@RequiredArgsConstructor
public class CommandController {

    static final String CHANNEL_WEB = "web";

    private final CommandPort commandPort;
    private final BotProperties properties;

    @GetMapping
    public Mono<ResponseEntity<List<CommandPort.CommandDefinition>>> listCommands() {
        return Mono.just(ResponseEntity.ok(commandPort.listCommands()));
    }

    @PostMapping("/{name}")
    public Mono<ResponseEntity<CommandResponse>> execute(@PathVariable String name,
            @RequestBody(required = false) CommandRequest request) {
        if (!commandPort.hasCommand(name)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown command: " + name);
        }

        Map<String, Object> context = new HashMap<>();
        context.put(CommandPort.CTX_CHANNEL_TYPE, CHANNEL_WEB);
        context.put(CommandPort.CTX_PREFIX, properties.getPrefix());
        List<String> args = List.of();
        if (request != null) {
            if (request.userId() != null) {
                context.put(CommandPort.CTX_USER_ID, request.userId());
            }
            if (request.chatId() != null) {
                context.put(CommandPort.CTX_CHAT_ID, request.chatId());
            }
            if (request.args() != null) {
                args = request.args();
            }
        }

        return Mono.fromFuture(commandPort.execute(name, args, context))
                .map(result -> ResponseEntity.ok(new CommandResponse(result.success(), result.output())));
    }

    public record CommandRequest(List<String> args, String userId, String chatId) {
    }

    public record CommandResponse(boolean success, String output) {
    }
}
