package com.example.deal_bot.deal;

/**
 * 永続化層に到達できない。サイクルを FAILED にする。
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
