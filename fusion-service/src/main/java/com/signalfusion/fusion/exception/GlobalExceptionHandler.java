package com.signalfusion.fusion.exception;

import com.signalfusion.common.exception.FusionException;
import com.signalfusion.fusion.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps caller errors to 400 and configuration errors to 500. Missing signal never reaches
 * here: the pipeline degrades instead of throwing.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(FusionException.class)
    public ResponseEntity<ErrorResponse> handleFusion(FusionException ex) {
        ErrorResponse body = new ErrorResponse(ex.getMessage(), ex.getComponent(), ex.getField());
        if (ex.isCallerError()) {
            log.warn("Rejected request. component={} field={} reason={}",
                ex.getComponent(), ex.getField(), ex.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
        }
        log.error("Fusion configuration error. component={} reason={}", ex.getComponent(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(IllegalArgumentException ex) {
        log.warn("Rejected request. reason={}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(ex.getMessage(), "request", null));
    }
}
