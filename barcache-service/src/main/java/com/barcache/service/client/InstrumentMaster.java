package com.barcache.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Symbol to provider instrument token lookup, loaded from the provider's scrip master JSON:
 * <pre>
 * [ { "token": "2885", "symbol": "RELIANCE-EQ", "name": "RELIANCE INDUSTRIES", "exch_seg": "NSE" }, ... ]
 * </pre>
 * Equity symbols carry a "-EQ" suffix which is stripped from the lookup key.
 */
public class InstrumentMaster {

    private static final Logger log = LoggerFactory.getLogger(InstrumentMaster.class);

    private static final String EQUITY_SUFFIX = "-EQ";

    // exchange -> symbol -> token
    private final Map<String, Map<String, String>> tokenByExchange;

    private InstrumentMaster(Map<String, Map<String, String>> tokenByExchange) {
        this.tokenByExchange = tokenByExchange;
    }

    /**
     * Build from explicit (exchange -> symbol -> token) entries.
     */
    public static InstrumentMaster of(Map<String, Map<String, String>> tokens) {
        Map<String, Map<String, String>> normalized = new HashMap<>();
        tokens.forEach((exchange, bySymbol) -> bySymbol.forEach((symbol, token) ->
            normalized.computeIfAbsent(exchange.toUpperCase(), k -> new HashMap<>())
                .put(symbol.toUpperCase(), token)));
        return new InstrumentMaster(normalized);
    }

    public static InstrumentMaster load(Path file, ObjectMapper mapper) throws IOException {
        if (!Files.exists(file)) {
            log.warn("Instrument master {} not found, no symbols can be resolved", file);
            return new InstrumentMaster(new HashMap<>());
        }
        try (InputStream in = Files.newInputStream(file)) {
            InstrumentMaster master = parse(mapper.readTree(in));
            log.info("Loaded {} instruments from {}", master.size(), file);
            return master;
        }
    }

    static InstrumentMaster parse(JsonNode root) throws IOException {
        if (!root.isArray()) {
            throw new IOException("Instrument master must be a JSON array");
        }
        Map<String, Map<String, String>> tokens = new HashMap<>();
        for (JsonNode entry : root) {
            String exchange = entry.path("exch_seg").asText("").trim().toUpperCase();
            String rawSymbol = entry.path("symbol").asText("").trim().toUpperCase();
            String token = entry.path("token").asText("").trim();
            if (exchange.isEmpty() || rawSymbol.isEmpty() || token.isEmpty()) continue;

            String symbol = rawSymbol.endsWith(EQUITY_SUFFIX)
                ? rawSymbol.substring(0, rawSymbol.length() - EQUITY_SUFFIX.length())
                : rawSymbol;
            Map<String, String> bySymbol = tokens.computeIfAbsent(exchange, k -> new HashMap<>());
            // Prefer the equity listing when a symbol appears in several segments
            if (rawSymbol.endsWith(EQUITY_SUFFIX) || !bySymbol.containsKey(symbol)) {
                bySymbol.put(symbol, token);
            }
        }
        return new InstrumentMaster(tokens);
    }

    /**
     * Provider token for a symbol, or null when unknown.
     */
    public String resolveToken(String symbol, String exchange) {
        Map<String, String> bySymbol = tokenByExchange.get(exchange.trim().toUpperCase());
        return bySymbol == null ? null : bySymbol.get(symbol.trim().toUpperCase());
    }

    public int size() {
        return tokenByExchange.values().stream().mapToInt(Map::size).sum();
    }
}
