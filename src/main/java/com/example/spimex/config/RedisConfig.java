package com.example.spimex.config;

import com.example.spimex.dto.LastTradingDates;
import com.example.spimex.dto.TradingResultsList;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.LoggingCacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Redis configuration for the response cache.
 * <p>
 * Each cache region gets a serializer bound to its response type so cached values
 * come back as DTOs. Values are written with the application's ObjectMapper (ISO dates).
 * The broker side uses the auto-configured StringRedisTemplate.
 * <p>
 * Failed cache reads and writes are logged and the call goes to the store. Evictions
 * still fail loudly so a refresh is never reported as done when nothing was cleared.
 */
@Slf4j
@Configuration
@EnableCaching
public class RedisConfig implements CachingConfigurer {

    @Override
    public CacheErrorHandler errorHandler() {
        return new StoreFallbackCacheErrorHandler();
    }

    @Bean
    public CacheManager cacheManager(RedisConnectionFactory connectionFactory,
                                     ObjectMapper objectMapper,
                                     @Value("${REDIS_EXPIRATION_TIME:86400}") long expirationSeconds) {
        var ttl = Duration.ofSeconds(expirationSeconds);

        var defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(ttl)
                .disableCachingNullValues()
                .prefixCacheNameWith("spimex:cache:")
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()));

        Map<String, RedisCacheConfiguration> regions = new HashMap<>();
        regions.put(CacheNames.LAST_TRADING_DATES, defaultConfig.serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(objectMapper, LastTradingDates.class))));
        regions.put(CacheNames.TRADING_RESULTS_IN_PERIOD, defaultConfig.serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(objectMapper, TradingResultsList.class))));
        regions.put(CacheNames.LAST_TRADING_RESULTS, defaultConfig.serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                        new Jackson2JsonRedisSerializer<>(objectMapper, TradingResultsList.class))));

        log.info("Configured RedisCacheManager with regions {} (ttl {})", regions.keySet(), ttl);

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaultConfig)
                .withInitialCacheConfigurations(regions)
                .disableCreateOnMissingCache()
                .build();
    }

    static class StoreFallbackCacheErrorHandler extends LoggingCacheErrorHandler {

        @Override
        public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
            throw exception;
        }

        @Override
        public void handleCacheClearError(RuntimeException exception, Cache cache) {
            throw exception;
        }
    }
}
