package com.example.spimex.service;

import com.example.spimex.config.CacheNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Component;

/**
 * Invalidation of the cached read responses
 */
@Slf4j
@Component
public class TradingResultsCache {

    @CacheEvict(cacheNames = {
            CacheNames.LAST_TRADING_DATES,
            CacheNames.TRADING_RESULTS_IN_PERIOD,
            CacheNames.LAST_TRADING_RESULTS
    }, allEntries = true)
    public void evictAll() {
        log.info("Cleared trading result caches");
    }
}
