package com.example.deal_bot.publish;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.Test;

import com.example.deal_bot.ops.SystemFlagService;

class StubPublisherTest {

    @Test
    void returnsSequentialIds() {
        StubPublisher publisher = new StubPublisher(mock(SystemFlagService.class));

        assertThat(publisher.publish("first")).isEqualTo("STUB-1");
        assertThat(publisher.publish("second")).isEqualTo("STUB-2");
    }

    @Test
    void failsWhenBodyContainsConfiguredText() {
        SystemFlagService flags = mock(SystemFlagService.class);
        when(flags.get(StubPublisher.FAIL_CONTAINS_KEY)).thenReturn("B0STUB0003");
        StubPublisher publisher = new StubPublisher(flags);

        assertThatThrownBy(() -> publisher.publish("deal https://www.amazon.com/dp/B0STUB0003"))
                .isInstanceOf(PublishException.class)
                .satisfies(e -> assertThat(((PublishException) e).isRetryable()).isTrue());
        assertThat(publisher.publish("other deal")).isEqualTo("STUB-1");
    }
}
