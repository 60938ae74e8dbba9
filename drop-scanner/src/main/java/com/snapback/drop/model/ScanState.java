package com.snapback.drop.model;

public enum ScanState {
    IDLE,
    RUNNING,
    FAILED
}
