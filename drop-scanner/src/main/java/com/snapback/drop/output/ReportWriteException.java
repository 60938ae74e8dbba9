package com.snapback.drop.output;

public class ReportWriteException extends RuntimeException {
    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
