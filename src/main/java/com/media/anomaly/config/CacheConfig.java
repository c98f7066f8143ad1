package com.media.anomaly.config;

import com.google.common.base.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Time sources for the baseline caches. Exposed as beans so tests can swap in
 * fixed clocks and manual tickers.
 */
@Configuration
public class CacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }
}
