package com.autonomous.quota.controller;

import com.autonomous.quota.exception.AdmissionException;
import com.autonomous.quota.model.ErrorResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns request-level rejections into {@code {"error": ..., "code": ...}} bodies.
 */
@RestControllerAdvice
public class AdmissionExceptionHandler {

    @ExceptionHandler(AdmissionException.class)
    public ResponseEntity<ErrorResponse> handleRejection(AdmissionException ex) {
        return ResponseEntity.status(ex.getReason().getStatus())
            .body(new ErrorResponse(ex.getMessage(), ex.getReason().name()));
    }
}
