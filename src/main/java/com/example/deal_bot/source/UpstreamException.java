package com.example.deal_bot.source;

/**
 * 価格データソースの通信・プロトコル障害。サイクル内では再試行しない。
 */
public class UpstreamException extends RuntimeException {

    public UpstreamException(String message) {
        super(message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
