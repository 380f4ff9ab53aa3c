package com.enterprise.orchestration.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Describes why a task or message reached a failed state
 */
public class ErrorInfo {

    private final ErrorKind kind;
    private final String message;
    private final Instant occurredAt;

    @JsonCreator
    public ErrorInfo(@JsonProperty("kind") ErrorKind kind,
                     @JsonProperty("message") String message,
                     @JsonProperty("occurredAt") Instant occurredAt) {
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.message = message;
        this.occurredAt = occurredAt != null ? occurredAt : Instant.now();
    }

    public static ErrorInfo of(ErrorKind kind, String message) {
        return new ErrorInfo(kind, message, Instant.now());
    }

    public static ErrorInfo cancelled(String reason) {
        return of(ErrorKind.CANCELLED, reason != null ? reason : "Cancelled by caller");
    }

    public ErrorKind getKind() { return kind; }

    public String getMessage() { return message; }

    public Instant getOccurredAt() { return occurredAt; }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
