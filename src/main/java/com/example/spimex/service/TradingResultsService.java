package com.example.spimex.service;

import com.example.spimex.config.CacheNames;
import com.example.spimex.domain.repository.TradingResultRepository;
import com.example.spimex.dto.LastTradingDates;
import com.example.spimex.dto.TradingResultFilter;
import com.example.spimex.dto.TradingResultsList;
import com.example.spimex.exception.TradingDataNotFoundException;
import com.example.spimex.domain.entity.TradingResult;
import com.example.spimex.mapper.TradingResultMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the trading results.
 * <p>
 * Responses are cached in Redis; keys that depend on "today" include the date so a
 * cached answer never outlives the day it was computed for.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TradingResultsService {

    static final String DATABASE_EMPTY = "Database is empty!";

    private final TradingResultRepository repository;
    private final TradingResultMapper mapper;
    private final Clock clock;

    /**
     * Dates among the last {@code days} calendar days (today included) that have results, newest first
     */
    @Cacheable(cacheNames = CacheNames.LAST_TRADING_DATES, key = "#days + ':' + #root.target.today()")
    public LastTradingDates getLastTradingDates(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1");
        }
        var today = today();
        var dates = repository.findTradeDatesBetween(today.minusDays(days - 1L), today);
        log.debug("Found {} trading dates in the last {} days", dates.size(), days);
        return new LastTradingDates(dates);
    }

    @Cacheable(cacheNames = CacheNames.TRADING_RESULTS_IN_PERIOD,
            key = "#startDate + ':' + #endDate + ':' + #filter.cacheKey()")
    public TradingResultsList getTradingResultsInPeriod(LocalDate startDate, LocalDate endDate, TradingResultFilter filter) {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("start_date must not be after end_date");
        }
        return new TradingResultsList(mapper.toResponseList(findMatching(startDate, endDate, filter)));
    }

    /**
     * Results of the most recent trading date in the store, filtered afterwards
     *
     * @throws TradingDataNotFoundException if the store holds no results at all
     */
    @Cacheable(cacheNames = CacheNames.LAST_TRADING_RESULTS, key = "#filter.cacheKey()")
    public TradingResultsList getLastTradingResults(TradingResultFilter filter) {
        var latest = repository.findLatestTradeDate()
                .orElseThrow(() -> new TradingDataNotFoundException(DATABASE_EMPTY));
        return new TradingResultsList(mapper.toResponseList(findMatching(latest, latest, filter)));
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private List<TradingResult> findMatching(LocalDate from, LocalDate to, TradingResultFilter filter) {
        return repository.findMatching(from, to, filter.getOilId(), filter.getDeliveryTypeId(), filter.getDeliveryBasisId());
    }
}
