package com.example.deal_bot.publish;

import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.deal_bot.ops.SystemFlagService;

/**
 * ローカル用。投稿せずログに出す。
 * PUBLISH_STUB_FAIL_CONTAINS の文字列を本文に含む場合は失敗させる。
 */
public class StubPublisher implements Publisher {

    private static final Logger log = LoggerFactory.getLogger(StubPublisher.class);

    static final String FAIL_CONTAINS_KEY = "PUBLISH_STUB_FAIL_CONTAINS";

    private final SystemFlagService flags;
    private final AtomicLong seq = new AtomicLong();

    public StubPublisher(SystemFlagService flags) {
        this.flags = flags;
    }

    @Override
    public String publish(String text) {
        String failOn = flags.get(FAIL_CONTAINS_KEY);
        if (failOn != null && !failOn.isBlank() && text.contains(failOn)) {
            throw new PublishException("stub publish failure", true);
        }
        String id = "STUB-" + seq.incrementAndGet();
        log.info("[StubPublisher] {} ({} chars)\n{}", id, text.length(), text);
        return id;
    }
}
