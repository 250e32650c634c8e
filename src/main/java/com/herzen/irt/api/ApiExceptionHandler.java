package com.herzen.irt.api;

import com.herzen.irt.analysis.AnalysisModels;
import com.herzen.irt.analysis.AnalysisModels.ErrorResponse;
import com.herzen.irt.error.AnalysisException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AnalysisException.class)
    public ResponseEntity<ErrorResponse> analysisFailed(AnalysisException e) {
        HttpStatus status = switch (e.kind()) {
            case SCHEMA, INSUFFICIENT_DATA, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ESTIMATION, CURVE_COMPUTATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Analysis request failed: {}", e.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(e));
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> uploadFailed(MultipartException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(AnalysisModels.ERROR, "Upload failed: " + e.getMessage(), null));
    }
}
