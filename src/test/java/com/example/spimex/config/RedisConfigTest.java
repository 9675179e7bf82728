package com.example.spimex.config;

import com.example.spimex.domain.repository.TradingResultRepository;
import com.example.spimex.dto.TradingResultFilter;
import com.example.spimex.mapper.TradingResultMapper;
import com.example.spimex.service.TradingResultsCache;
import com.example.spimex.service.TradingResultsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringJUnitConfig(classes = {RedisConfig.class, TradingResultsService.class, TradingResultsCache.class,
        RedisConfigTest.UnreachableRedis.class})
@DisplayName("RedisConfig Tests")
class RedisConfigTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Autowired
    private TradingResultsService tradingResultsService;

    @Autowired
    private TradingResultsCache tradingResultsCache;

    @MockBean
    private TradingResultRepository repository;

    @MockBean
    private TradingResultMapper mapper;

    @Test
    @DisplayName("Should serve reads from the store while Redis is down")
    void shouldReadThroughWhenCacheUnavailable() {
        // Given
        when(repository.findTradeDatesBetween(TODAY.minusDays(2), TODAY)).thenReturn(List.of(TODAY));
        when(repository.findLatestTradeDate()).thenReturn(Optional.of(TODAY));

        // When
        var dates = tradingResultsService.getLastTradingDates(3);
        var results = tradingResultsService.getLastTradingResults(TradingResultFilter.of(null, null, null));

        // Then
        assertThat(dates.getLastTradingDates()).containsExactly(TODAY);
        assertThat(results.getTradingResults()).isEmpty();
        verify(repository).findMatching(TODAY, TODAY, null, null, null);
        verify(mapper).toResponseList(any());
    }

    @Test
    @DisplayName("Should fail a cache refresh while Redis is down")
    void shouldPropagateClearFailure() {
        assertThatThrownBy(() -> tradingResultsCache.evictAll())
                .isInstanceOf(RedisConnectionFailureException.class);
    }

    @Configuration
    static class UnreachableRedis {

        @Bean
        LettuceConnectionFactory redisConnectionFactory() {
            return new LettuceConnectionFactory(new RedisStandaloneConfiguration("127.0.0.1", 1));
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper().findAndRegisterModules();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2024-03-15T09:00:00Z"), ZoneId.of("Europe/Moscow"));
        }
    }
}
