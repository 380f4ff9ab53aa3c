package com.enterprise.orchestration.core;

public enum WorkerStatus {
    IDLE,
    BUSY,
    OFFLINE
}
