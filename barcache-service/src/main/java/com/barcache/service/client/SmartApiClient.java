package com.barcache.service.client;

import com.barcache.core.exception.InvalidSymbolException;
import com.barcache.core.exception.MarketDataException;
import com.barcache.core.exception.RateLimitException;
import com.barcache.core.model.BarRecord;
import com.barcache.core.model.Interval;
import com.barcache.core.model.SeriesKey;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Historical candle client for an Angel One SmartAPI style provider.
 * <p>
 * The access token comes from outside (session login is not handled here). Every call is a
 * single HTTP request; retries, spacing and the circuit breaker belong to the fetch executor.
 */
public class SmartApiClient implements MarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(SmartApiClient.class);

    static final String CANDLE_PATH = "/rest/secure/angelbroking/historical/v1/getCandleData";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final DateTimeFormatter REQUEST_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final long DEFAULT_RETRY_AFTER_MS = 1000;

    private final OkHttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final Supplier<String> accessToken;
    private final InstrumentMaster instruments;
    private final ZoneId marketZone;

    public SmartApiClient(OkHttpClient http, ObjectMapper mapper, String baseUrl, String apiKey,
                          Supplier<String> accessToken, InstrumentMaster instruments, ZoneId marketZone) {
        this.http = http;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.accessToken = accessToken;
        this.instruments = instruments;
        this.marketZone = marketZone;
    }

    @Override
    public List<BarRecord> fetchOhlcv(String symbol, String exchange, Interval interval,
                                      LocalDate from, LocalDate to) throws MarketDataException {
        SeriesKey key = SeriesKey.of(symbol, exchange, interval);
        String token = instruments.resolveToken(key.symbol(), key.exchange());
        if (token == null) {
            throw new InvalidSymbolException(key.symbol(), "No instrument token for " + key.symbol() + " on " + key.exchange());
        }

        ObjectNode body = mapper.createObjectNode();
        body.put("exchange", key.exchange());
        body.put("symboltoken", token);
        body.put("interval", interval.name());
        body.put("fromdate", from.atTime(0, 0).format(REQUEST_FORMAT));
        body.put("todate", to.atTime(23, 59).format(REQUEST_FORMAT));

        Request request = new Request.Builder()
            .url(baseUrl + CANDLE_PATH)
            .post(RequestBody.create(body.toString(), JSON))
            .header("Accept", "application/json")
            .header("X-UserType", "USER")
            .header("X-SourceID", "WEB")
            .header("X-PrivateKey", apiKey)
            .header("Authorization", "Bearer " + accessToken.get())
            .build();

        log.debug("Requesting {} bars for {} {} .. {}", interval, key, from, to);

        try (Response response = http.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";

            if (response.code() == 429) {
                throw new RateLimitException("Rate limited fetching " + key, parseRetryAfter(response.header("Retry-After")));
            }
            if (!response.isSuccessful()) {
                throw new MarketDataException("Provider error " + response.code() + " fetching " + key + ": " + text);
            }
            return parseCandles(key, text, from, to);
        } catch (IOException e) {
            throw new MarketDataException("I/O error fetching " + key + ": " + e.getMessage(), e);
        }
    }

    private List<BarRecord> parseCandles(SeriesKey key, String text, LocalDate from, LocalDate to)
            throws MarketDataException, IOException {
        JsonNode root = mapper.readTree(text);

        if (!root.path("status").asBoolean(false)) {
            String message = root.path("message").asText("");
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("exceeding access rate") || lower.contains("rate limit")) {
                throw new RateLimitException("Rate limited fetching " + key + ": " + message, DEFAULT_RETRY_AFTER_MS);
            }
            if (lower.contains("invalid symbol") || lower.contains("invalid token")) {
                throw new InvalidSymbolException(key.symbol(), "Provider rejected " + key + ": " + message);
            }
            throw new MarketDataException("Provider error fetching " + key + ": "
                + root.path("errorcode").asText("") + " " + message);
        }

        List<BarRecord> bars = new ArrayList<>();
        JsonNode data = root.path("data");
        if (!data.isArray()) {
            return bars;
        }

        for (JsonNode candle : data) {
            // Each candle: [timestamp, open, high, low, close, volume]
            if (!candle.isArray() || candle.size() < 6) {
                throw new MarketDataException("Malformed candle for " + key + ": " + candle);
            }
            Instant timestamp;
            try {
                timestamp = OffsetDateTime.parse(candle.get(0).asText()).toInstant();
            } catch (DateTimeParseException e) {
                throw new MarketDataException("Bad candle timestamp for " + key + ": " + candle.get(0), e);
            }
            BarRecord bar = BarRecord.of(key, timestamp, marketZone,
                candle.get(1).asDouble(),
                candle.get(2).asDouble(),
                candle.get(3).asDouble(),
                candle.get(4).asDouble(),
                candle.get(5).asLong());
            if (!bar.tradeDate().isBefore(from) && !bar.tradeDate().isAfter(to)) {
                bars.add(bar);
            }
        }

        log.debug("Received {} bars for {}", bars.size(), key);
        return bars;
    }

    private static long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return DEFAULT_RETRY_AFTER_MS;
        }
        try {
            return Long.parseLong(header.trim()) * 1000L;
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After header: {}", header);
            return DEFAULT_RETRY_AFTER_MS;
        }
    }
}
