package com.enterprise.orchestration.bus;

import java.time.Duration;

/**
 * Retry policy for failed message deliveries
 */
public interface RetryPolicy {
    
    /**
     * Determine if a message should be attempted again after its latest failure
     */
    boolean shouldRetry(Message message, int retryCount);
    
    /**
     * Calculate the delay before the next delivery attempt
     */
    Duration getRetryDelay(Message message, int retryCount);
    
    /**
     * Get the number of failed attempts after which a message is dead-lettered
     */
    int getMaxRetries();
    
    /**
     * Linear back-off: the n-th retry waits n times the base delay, capped at the maximum delay
     */
    class LinearRetryPolicy implements RetryPolicy {
        private final int maxRetries;
        private final Duration baseDelay;
        private final Duration maxDelay;
        
        public LinearRetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {
            this.maxRetries = maxRetries;
            this.baseDelay = baseDelay;
            this.maxDelay = maxDelay;
        }
        
        @Override
        public boolean shouldRetry(Message message, int retryCount) {
            return retryCount < maxRetries;
        }
        
        @Override
        public Duration getRetryDelay(Message message, int retryCount) {
            Duration delay = baseDelay.multipliedBy(Math.max(1, retryCount));
            return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
        }
        
        @Override
        public int getMaxRetries() {
            return maxRetries;
        }
    }
    
    /**
     * Builder for creating retry policies
     */
    class Builder {
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(1);
        
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }
        
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
            return this;
        }
        
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }
        
        public RetryPolicy build() {
            return new LinearRetryPolicy(maxRetries, baseDelay, maxDelay);
        }
    }
    
    static Builder builder() {
        return new Builder();
    }
    
    /**
     * Predefined retry policies
     */
    class Predefined {
        
        /**
         * Three attempts, one second apart per retry
         */
        public static RetryPolicy standard() {
            return builder().build();
        }
        
        /**
         * Retries on every delivery tick until the bound is reached
         */
        public static RetryPolicy immediate(int maxRetries) {
            return builder()
                .maxRetries(maxRetries)
                .baseDelay(Duration.ZERO)
                .maxDelay(Duration.ZERO)
                .build();
        }
    }
}
