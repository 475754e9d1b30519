package com.herzen.prereq.api;

import com.herzen.prereq.graph.PrerequisiteNotFoundException;
import com.herzen.prereq.validation.PrerequisiteValidationException;
import com.herzen.prereq.validation.RequestError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PrerequisiteValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(PrerequisiteValidationException ex) {
        return validationFailed(ex.code(), ex.getErrors());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body", ex);
        return validationFailed(RequestError.INVALID_REQUEST,
                List.of(new RequestError(RequestError.INVALID_REQUEST, "body", "Malformed request body")));
    }

    @ExceptionHandler(PrerequisiteNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(PrerequisiteNotFoundException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "not_found");
        body.put("message", ex.getMessage());
        return new ResponseEntity<>(body, HttpStatus.NOT_FOUND);
    }

    private ResponseEntity<Map<String, Object>> validationFailed(String code, List<RequestError> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "validation_failed");
        body.put("code", code);
        body.put("errors", errors);
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
