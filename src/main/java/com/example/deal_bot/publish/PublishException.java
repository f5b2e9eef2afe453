package com.example.deal_bot.publish;

public class PublishException extends RuntimeException {

    private final boolean retryable;

    public PublishException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public PublishException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
