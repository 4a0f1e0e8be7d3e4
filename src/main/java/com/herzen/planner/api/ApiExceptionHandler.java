package com.herzen.planner.api;

import com.herzen.planner.validation.InvalidInputException;
import com.herzen.planner.validation.PlanningInputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INSUFFICIENT_INFORMATION = "INSUFFICIENT_INFORMATION";

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException e) {
        log.warn("Rejected planning request: {}", e.violations().stream()
                .map(PlanningInputValidator.Violation::code)
                .collect(Collectors.joining(", ")));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(INSUFFICIENT_INFORMATION, InvalidInputException.USER_MESSAGE));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable planning request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(INSUFFICIENT_INFORMATION, InvalidInputException.USER_MESSAGE));
    }

    public record ErrorResponse(String code, String message) {}
}
