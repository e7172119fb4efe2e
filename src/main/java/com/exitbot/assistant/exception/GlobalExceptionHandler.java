package com.exitbot.assistant.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LlmException.class)
    public ResponseEntity<Map<String, Object>> handleLlmException(LlmException ex) {
        HttpStatus status = ex.getKind().isTemporary() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
        log.error("LLM error [{} from {}]: {}", ex.getKind(), ex.getProvider(), ex.getMessage());
        return ResponseEntity.status(status).body(errorBody(ex.getMessage(), ex.getKind().name()));
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownProvider(UnknownProviderException ex) {
        return ResponseEntity.badRequest().body(errorBody(ex.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("An unexpected error occurred", null));
    }

    private Map<String, Object> errorBody(String message, String kind) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (kind != null) {
            body.put("kind", kind);
        }
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
