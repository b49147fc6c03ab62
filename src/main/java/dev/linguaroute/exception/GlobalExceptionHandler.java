package dev.linguaroute.exception;

import dev.linguaroute.routing.ActiveLocale;
import dev.linguaroute.routing.LocalizedRouterFunctions;
import dev.linguaroute.routing.PathLocaleResolver;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Error mapping for the localized router functions.
 * Messages are resolved from {@code messages*.properties} in the request's active locale.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final MessageSource messageSource;
    private final PathLocaleResolver localeResolver;

    public Mono<ServerResponse> handle(Throwable ex, ServerRequest request) {
        ActiveLocale active = LocalizedRouterFunctions.activeLocale(request, localeResolver);
        Locale locale = active.toLocale();

        if (ex instanceof ResourceNotFoundException notFound) {
            log.warn("Resource not found: {}", ex.getMessage());
            return respond(HttpStatus.NOT_FOUND, "error.not_found",
                    msg(locale, "error.resource_not_found", notFound.getResource(), notFound.getValue()),
                    request, active);
        }
        if (ex instanceof EntityInUseException) {
            log.warn("Conflict: {}", ex.getMessage());
            return respond(HttpStatus.CONFLICT, "error.conflict", msg(locale, "error.entity_in_use"), request, active);
        }
        if (ex instanceof ConstraintViolationException || ex instanceof IllegalArgumentException) {
            log.warn("Bad request on {}: {}", request.path(), ex.getMessage());
            return respond(HttpStatus.BAD_REQUEST, "error.bad_request", msg(locale, "error.invalid_request"), request, active);
        }
        if (ex instanceof ResponseStatusException rse) {
            HttpStatusCode status = rse.getStatusCode();
            log.warn("Response status {} on {}: {}", status.value(), request.path(), rse.getReason());
            return respond(status, statusToKey(status), msg(locale, statusToKey(status)), request, active);
        }

        log.error("Unexpected error on {}", request.path(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "error.internal_server_error",
                msg(locale, "error.unexpected_error"), request, active);
    }

    private Mono<ServerResponse> respond(HttpStatusCode status, String errorKey, String message,
                                         ServerRequest request, ActiveLocale active) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(msg(active.toLocale(), errorKey))
                .message(message)
                .path(request.path())
                .locale(active.code())
                .build();
        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body);
    }

    /**
     * Get a translated message from MessageSource, falling back to the code itself.
     */
    private String msg(Locale locale, String code, Object... args) {
        return messageSource.getMessage(code, args, code, locale);
    }

    private String statusToKey(HttpStatusCode status) {
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return "error.not_found";
        }
        if (status.value() == HttpStatus.CONFLICT.value()) {
            return "error.conflict";
        }
        if (status.is4xxClientError()) {
            return "error.bad_request";
        }
        return "error.internal_server_error";
    }
}
