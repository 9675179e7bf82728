package com.example.spimex.config;

/**
 * Cache regions for the trading result read endpoints
 */
public final class CacheNames {

    public static final String LAST_TRADING_DATES = "lastTradingDates";
    public static final String TRADING_RESULTS_IN_PERIOD = "tradingResultsInPeriod";
    public static final String LAST_TRADING_RESULTS = "lastTradingResults";

    private CacheNames() {
    }
}
