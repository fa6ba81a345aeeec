package com.loom.backend.api;

import com.loom.backend.repo.EventStoreException;
import com.loom.backend.service.LockConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e) {
        return Map.of(
                "error", "NOT_FOUND",
                "message", e.getMessage()
        );
    }

    @ExceptionHandler(LockConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleLockConflict(LockConflictException e) {
        return Map.of(
                "error", "LOCK_CONFLICT",
                "message", e.getMessage(),
                "nodeId", e.getNodeId(),
                "holder", e.getHolderName()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidBody(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .orElse("invalid body");
        return Map.of(
                "error", "BAD_REQUEST",
                "message", msg
        );
    }

    @ExceptionHandler(EventStoreException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStorage(EventStoreException e) {
        log.warn("event store unavailable: {}", e.getMessage());
        return Map.of(
                "error", "STORAGE_UNAVAILABLE",
                "message", e.getMessage()
        );
    }
}
