package com.barcache.service.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Shared HTTP client and JSON mapper instances.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;

    static {
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(5, 5, TimeUnit.MINUTES))
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        SHARED_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    private HttpClientFactory() {
    }

    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    /**
     * Mapper with JavaTimeModule, ISO date output and lenient unknown property handling.
     */
    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }
}
