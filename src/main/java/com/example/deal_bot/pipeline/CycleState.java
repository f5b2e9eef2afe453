package com.example.deal_bot.pipeline;

public enum CycleState {
    FETCHING,
    PERSIST_FILTERING,
    PUBLISH_FILTERING,
    RANKING,
    PUBLISHING,
    DONE,
    FAILED
}
