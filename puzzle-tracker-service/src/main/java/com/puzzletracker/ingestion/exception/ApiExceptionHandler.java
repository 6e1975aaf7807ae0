package com.puzzletracker.ingestion.exception;

import com.puzzletracker.ingestion.dto.ErrorResponse;
import com.puzzletracker.parser.ShareTextParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ShareTextParseException.class)
    public ResponseEntity<ErrorResponse> handleParse(ShareTextParseException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex.getGameName() != null) {
            details.put("gameName", ex.getGameName());
        }
        if (ex.getExpectedFormat() != null) {
            details.put("expectedFormat", ex.getExpectedFormat());
        }
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), details);
    }

    @ExceptionHandler(UnknownGameException.class)
    public ResponseEntity<ErrorResponse> handleUnknownGame(UnknownGameException ex) {
        return build(HttpStatus.NOT_FOUND, ex.getMessage(), Map.of("gameId", String.valueOf(ex.getGameId())));
    }

    @ExceptionHandler(DuplicateRecordException.class)
    public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateRecordException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("gameId", ex.getGameId());
        details.put("puzzleDay", ex.getPuzzleDay().toString());
        return build(HttpStatus.CONFLICT, ex.getMessage(), details);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        List<Map<String, Object>> errors = new ArrayList<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            Map<String, Object> e = new LinkedHashMap<>();
            e.put("field", fe.getField());
            e.put("message", fe.getDefaultMessage());
            errors.add(e);
        }
        return build(HttpStatus.BAD_REQUEST, "Validation failed", Map.of("errors", errors));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableJson(HttpMessageNotReadableException ex) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex) {
        log.error("Unhandled error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, Map<String, Object> details) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .details((details == null || details.isEmpty()) ? null : details)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
