package quest.gekko.rankboard.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import quest.gekko.rankboard.service.integration.connector.RankSourceUnavailableException;
import quest.gekko.rankboard.web.dto.ErrorResponse;

import java.util.NoSuchElementException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, HttpServletRequest request) {
        log.warn("Response status exception: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        int status = ex.getStatusCode().value();
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getReason(), status));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return new ErrorResponse("Invalid request: " + ex.getMessage(), 400);
    }

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        log.warn("Not found: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return new ErrorResponse(ex.getMessage(), 404);
    }

    @ExceptionHandler(RankSourceUnavailableException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public ErrorResponse handleSourceUnavailable(RankSourceUnavailableException ex, HttpServletRequest request) {
        log.warn("Rank source unavailable: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return new ErrorResponse("Rank source unavailable", 502);
    }

    // Let Spring Security turn these into 401/403
    @ExceptionHandler(AccessDeniedException.class)
    public void rethrowAccessDenied(AccessDeniedException ex) {
        throw ex;
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return new ErrorResponse("An unexpected error occurred", 500);
    }
}
