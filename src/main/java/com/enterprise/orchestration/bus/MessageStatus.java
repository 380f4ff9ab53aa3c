package com.enterprise.orchestration.bus;

public enum MessageStatus {
    PENDING,
    DELIVERED,
    FAILED
}
