package com.snapback.drop.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ScanAlreadyRunningException extends RuntimeException {
    public ScanAlreadyRunningException(String message) {
        super(message);
    }
}
