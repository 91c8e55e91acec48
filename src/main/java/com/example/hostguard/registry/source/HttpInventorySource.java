package com.example.hostguard.registry.source;

import com.example.hostguard.registry.HostSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Cloud or CMDB inventory exposed as a JSON host list over HTTP. The payload
 * may be a list of host objects or an object with a {@code hosts} list; field
 * names follow {@link HostRecordMapper}.
 */
@Slf4j
public class HttpInventorySource implements InventorySource {

    private final String name;
    private final String endpoint;
    private final String token;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpInventorySource(String name, String endpoint, String token, Duration timeout,
                               OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.name = name;
        this.endpoint = endpoint;
        this.token = token;
        this.httpClient = httpClient.newBuilder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return type().getTag() + ":" + name;
    }

    @Override
    public HostSource type() {
        return HostSource.CLOUD;
    }

    @Override
    public List<RawHostRecord> parse() {
        Request request;
        try {
            Request.Builder builder = new Request.Builder()
                    .url(endpoint)
                    .header("Accept", "application/json");
            if (token != null && !token.isBlank()) {
                builder.header("Authorization", "Bearer " + token);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid inventory endpoint {}: {}", endpoint, e.getMessage());
            return List.of();
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Inventory endpoint {} returned HTTP {}", endpoint, response.code());
                return List.of();
            }
            JsonNode root = objectMapper.readTree(response.body().string());
            List<RawHostRecord> records = StructuredFileInventorySource.fromTree(root, name());
            log.info("Loaded {} hosts from {}", records.size(), name());
            return records;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load inventory from {}: {}", endpoint, e.getMessage());
            return List.of();
        }
    }
}
