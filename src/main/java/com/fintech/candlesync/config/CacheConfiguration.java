package com.fintech.candlesync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.cache.IndicatorCache;
import com.fintech.candlesync.cache.InMemoryIndicatorCache;
import com.fintech.candlesync.cache.RedisIndicatorCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the indicator cache: Redis when {@code pipeline.cache.type=redis}, in-memory otherwise.
 * Redis host and port come from the spring.data.redis.* properties.
 */
@Configuration
public class CacheConfiguration {

    @Bean
    @ConditionalOnProperty(name = "pipeline.cache.type", havingValue = "redis")
    public IndicatorCache redisIndicatorCache(StringRedisTemplate redisTemplate,
                                              ObjectMapper objectMapper,
                                              PipelineConfig pipelineConfig) {
        return new RedisIndicatorCache(redisTemplate, objectMapper, pipelineConfig.cache().keyPrefix());
    }

    @Bean
    @ConditionalOnProperty(name = "pipeline.cache.type", havingValue = "memory", matchIfMissing = true)
    public IndicatorCache inMemoryIndicatorCache(Clock clock) {
        return new InMemoryIndicatorCache(clock);
    }
}
