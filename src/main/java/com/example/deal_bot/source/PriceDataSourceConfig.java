package com.example.deal_bot.source;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

import com.example.deal_bot.ops.SystemFlagService;

/**
 * 価格データソース設定。
 * - デフォルト: StubPriceDataSource
 * - real profile: KeepaPriceDataSource
 */
@Configuration
public class PriceDataSourceConfig {

    @Bean
    @Profile("!real")
    @Primary
    public PriceDataSource stubPriceDataSource(SystemFlagService flags) {
        return new StubPriceDataSource(flags);
    }
}
