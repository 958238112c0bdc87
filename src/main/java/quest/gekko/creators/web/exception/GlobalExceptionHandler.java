package quest.gekko.creators.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.creators.web.dto.ErrorResponse;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        log.warn("Response status exception: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        final HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return body(status, ex.getReason(), request);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return body(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(Exception ex, HttpServletRequest request) {
        // framework errors (unknown route, wrong method, ...) already carry their status
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            log.warn("Request failed: {} for URL: {}", ex.getMessage(), request.getRequestURL());
            return body(HttpStatus.valueOf(framework.getStatusCode().value()), framework.getBody().getDetail(), request);
        }
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String message, HttpServletRequest request) {
        final ErrorResponse error = new ErrorResponse(status.value(), status.getReasonPhrase(), message,
                request.getRequestURI(), Instant.now());
        return ResponseEntity.status(status).body(error);
    }
}
