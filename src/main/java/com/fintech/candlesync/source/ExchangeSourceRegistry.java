package com.fintech.candlesync.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.config.PipelineConfig;
import com.fintech.candlesync.source.binance.BinanceExchangeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves configured source names to {@link ExchangeSource} instances.
 */
public class ExchangeSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExchangeSourceRegistry.class);

    private final Map<String, ExchangeSource> sources;

    public ExchangeSourceRegistry(Collection<? extends ExchangeSource> sources) {
        Map<String, ExchangeSource> byName = new LinkedHashMap<>();
        for (ExchangeSource source : sources) {
            if (byName.putIfAbsent(source.name(), source) != null) {
                throw new IllegalArgumentException("Duplicate exchange source: " + source.name());
            }
        }
        this.sources = Map.copyOf(byName);
    }

    /**
     * Builds one client per configured source.
     *
     * @throws IllegalArgumentException for an unsupported source type
     */
    public static ExchangeSourceRegistry fromConfig(PipelineConfig config, HttpClient httpClient, ObjectMapper objectMapper) {
        Map<String, ExchangeSource> built = new LinkedHashMap<>();
        for (PipelineConfig.SourceConfig source : config.sources()) {
            if (!"binance".equalsIgnoreCase(source.type())) {
                throw new IllegalArgumentException("Unsupported source type '" + source.type()
                    + "' for source " + source.name() + ". Supported: binance");
            }
            built.put(source.name(), new BinanceExchangeSource(
                source.name(), source.baseUrl(), httpClient, objectMapper, config.sync().requestTimeout()));
            log.info("Registered exchange source {} ({}) with {} instruments",
                source.name(), source.baseUrl(), source.instruments().size());
        }
        return new ExchangeSourceRegistry(built.values());
    }

    /**
     * @throws IllegalArgumentException if no source is registered under {@code name}
     */
    public ExchangeSource get(String name) {
        ExchangeSource source = sources.get(name);
        if (source == null) {
            throw new IllegalArgumentException("Unknown exchange source: " + name);
        }
        return source;
    }
}
