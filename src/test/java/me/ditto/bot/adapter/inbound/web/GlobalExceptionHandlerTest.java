package me.ditto.bot.adapter.inbound.web;

import me.ditto.bot.adapter.inbound.web.dto.ApiErrorResponse;
import me.ditto.bot.domain.model.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldKeepResponseStatusAndReason() {
        assertError(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown command: x")),
                HttpStatus.NOT_FOUND, "Unknown command: x");
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        assertError(handler.handleIllegalArgument(new IllegalArgumentException("Event time is in the past")),
                HttpStatus.BAD_REQUEST, "Event time is in the past");
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        assertError(handler.handleIllegalState(new IllegalStateException("Event scheduler is not running")),
                HttpStatus.CONFLICT, "Event scheduler is not running");
    }

    @Test
    void shouldMapStoreUnavailableToServiceUnavailable() {
        assertError(handler.handleStoreUnavailable(new StoreUnavailableException("connection refused", null)),
                HttpStatus.SERVICE_UNAVAILABLE, "Event store is unavailable");
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        assertError(handler.handleGeneric(new RuntimeException("secret")),
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static void assertError(Mono<ResponseEntity<ApiErrorResponse>> response, HttpStatus status,
            String message) {
        StepVerifier.create(response)
                .assertNext(entity -> {
                    assertEquals(status, entity.getStatusCode());
                    ApiErrorResponse body = entity.getBody();
                    assertNotNull(body);
                    assertEquals(status.value(), body.getStatus());
                    assertEquals(message, body.getMessage());
                })
                .verifyComplete();
    }
}
