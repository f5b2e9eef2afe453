package com.example.deal_bot.publish;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import com.example.deal_bot.ops.SystemFlagService;

/**
 * 投稿クライアント設定。
 * - デフォルト: StubPublisher
 * - real profile: TwitterPublisher
 */
@Configuration
public class PublisherConfig {

    @Bean
    @Profile("!real")
    @Primary
    public Publisher stubPublisher(SystemFlagService flags) {
        return new StubPublisher(flags);
    }
}
