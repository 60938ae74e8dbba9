package com.snapback.drop.config;

import com.snapback.drop.service.ScanAlreadyRunningException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ScanExceptionHandler {

    @ExceptionHandler(ScanAlreadyRunningException.class)
    public ResponseEntity<Map<String, String>> handleActiveScan(ScanAlreadyRunningException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "scan_already_running", "message", ex.getMessage()));
    }
}
