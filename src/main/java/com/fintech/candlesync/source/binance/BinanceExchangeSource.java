package com.fintech.candlesync.source.binance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.exception.MalformedDataException;
import com.fintech.candlesync.exception.SourceUnavailableException;
import com.fintech.candlesync.source.ExchangeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binance spot klines over REST: {@code GET /api/v3/klines}.
 *
 * Each kline is an array:
 * [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades, takerBase, takerQuote, ignore]
 * with prices and volumes encoded as strings.
 */
public class BinanceExchangeSource implements ExchangeSource {

    private static final Logger log = LoggerFactory.getLogger(BinanceExchangeSource.class);

    static final int MAX_LIMIT = 1000;

    private final String name;
    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public BinanceExchangeSource(String name, String baseUrl, HttpClient httpClient,
                                 ObjectMapper objectMapper, Duration requestTimeout) {
        this.name = name;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<Candle> fetchOhlcv(String instrument, Timeframe timeframe, Long since, int limit) {
        URI uri = klinesUri(instrument, timeframe, since, limit);
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(requestTimeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceUnavailableException(name, "Request failed for " + instrument + " " + timeframe.code(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException(name, "Interrupted fetching " + instrument, e, false);
        }

        int status = response.statusCode();
        if (status == 429 || status == 418 || status >= 500) {
            throw new SourceUnavailableException(name,
                "HTTP " + status + " for " + instrument + " " + timeframe.code(), null);
        }
        if (status >= 400) {
            throw new SourceUnavailableException(name,
                "HTTP " + status + " for " + instrument + " " + timeframe.code() + ": " + abbreviate(response.body()),
                null, false);
        }

        List<Candle> candles = parseKlines(response.body());
        if (log.isDebugEnabled()) {
            log.debug("Fetched {} klines for {} {} (since={}, limit={})",
                candles.size(), instrument, timeframe.code(), since, limit);
        }
        return candles;
    }

    URI klinesUri(String instrument, Timeframe timeframe, Long since, int limit) {
        StringBuilder url = new StringBuilder(baseUrl)
            .append("/api/v3/klines?symbol=").append(toExchangeSymbol(instrument))
            .append("&interval=").append(timeframe.code())
            .append("&limit=").append(Math.max(1, Math.min(limit, MAX_LIMIT)));
        if (since != null) {
            url.append("&startTime=").append(since);
        }
        return URI.create(url.toString());
    }

    /**
     * Parses a klines payload.
     *
     * @throws MalformedDataException if the body is not an array of kline arrays
     */
    List<Candle> parseKlines(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedDataException("[" + name + "] Unparseable klines payload: " + abbreviate(body), e);
        }
        if (root == null || !root.isArray()) {
            throw new MalformedDataException("[" + name + "] Expected a JSON array of klines: " + abbreviate(body));
        }
        List<Candle> candles = new ArrayList<>(root.size());
        for (JsonNode kline : root) {
            if (!kline.isArray() || kline.size() < 9) {
                throw new MalformedDataException("[" + name + "] Kline row has unexpected shape: " + kline);
            }
            candles.add(new Candle(
                integer(kline.get(0)),
                decimal(kline.get(1)),
                decimal(kline.get(2)),
                decimal(kline.get(3)),
                decimal(kline.get(4)),
                decimal(kline.get(5)),
                decimal(kline.get(7)),
                integer(kline.get(8)),
                false));
        }
        return candles;
    }

    private double decimal(JsonNode node) {
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            throw new MalformedDataException("[" + name + "] Not a number: " + node, e);
        }
    }

    private long integer(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText());
            } catch (NumberFormatException e) {
                throw new MalformedDataException("[" + name + "] Not an integer: " + node, e);
            }
        }
        throw new MalformedDataException("[" + name + "] Not an integer: " + node);
    }

    /** "BTC/USDT" and "BTC-USDT" become "BTCUSDT". */
    static String toExchangeSymbol(String instrument) {
        return instrument.replace("/", "").replace("-", "").toUpperCase();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
