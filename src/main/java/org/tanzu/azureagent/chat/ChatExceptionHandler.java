package org.tanzu.azureagent.chat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Renders failures of the chat endpoints as {"detail": "..."} bodies.
 */
@RestControllerAdvice(assignableTypes = ChatCompletionController.class)
public class ChatExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ChatExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleStatus(ResponseStatusException e) {
        String detail = e.getReason() != null ? e.getReason() : e.getStatusCode().toString();
        logger.warn("Rejected chat request with {}: {}", e.getStatusCode().value(), detail);
        return ResponseEntity.status(e.getStatusCode()).body(Map.of("detail", detail));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception e) {
        logger.error("Error processing chat completion: {}", e.getMessage(), e);
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("detail", detail));
    }
}
