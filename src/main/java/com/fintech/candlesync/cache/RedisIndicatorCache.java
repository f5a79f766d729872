package com.fintech.candlesync.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.candlesync.domain.IndicatorSet;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.exception.MalformedDataException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed cache.
 *
 * Key: "PREFIX:SOURCE:INSTRUMENT:TIMEFRAME", e.g. "indicators:binance:BTCUSDT:1m".
 * Value: {"timestamp": "2024-01-01T00:00:00Z", "computed_at": "...", "indicators": {"SMA_20": 42000.5}}
 * where timestamp is the bucket start.
 */
public class RedisIndicatorCache implements IndicatorCache {

    private static final TypeReference<Map<String, Double>> VALUES = new TypeReference<>() {
    };

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisIndicatorCache(StringRedisTemplate redis, ObjectMapper objectMapper, String keyPrefix) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void put(IndicatorSet indicators, Duration ttl) {
        String key = indicators.series().toCacheKey(keyPrefix);
        redis.opsForValue().set(key, toJson(indicators), ttl.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public Optional<IndicatorSet> get(SeriesKey key) {
        String json = redis.opsForValue().get(key.toCacheKey(keyPrefix));
        return json == null ? Optional.empty() : Optional.of(fromJson(key, json));
    }

    String toJson(IndicatorSet indicators) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", Instant.ofEpochMilli(indicators.bucketStart()).toString());
        root.put("computed_at", indicators.computedAt().toString());
        root.set("indicators", objectMapper.valueToTree(indicators.values()));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize indicators for " + indicators.series(), e);
        }
    }

    IndicatorSet fromJson(SeriesKey key, String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            Instant bucket = Instant.parse(root.path("timestamp").asText());
            JsonNode computed = root.get("computed_at");
            Instant computedAt = computed == null ? bucket : Instant.parse(computed.asText());
            Map<String, Double> values = objectMapper.convertValue(root.path("indicators"), VALUES);
            return new IndicatorSet(key, bucket.toEpochMilli(), values, computedAt);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new MalformedDataException("Unreadable cached indicators for " + key, e);
        }
    }
}
