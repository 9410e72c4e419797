package com.hilo.market.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.concurrent.TimeUnit;

/**
 * Reads the settlement value from a JSON endpoint, e.g. {@code {"data":{"value":"14.50"}}}
 * with field path {@code data.value}. Decimal readings are scaled to 2 implied decimals.
 */
@Slf4j
public class HttpOutcomeSource implements OutcomeSource {

    private static final int RETRIES = 3;

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String url;
    private final String fieldPath;

    public HttpOutcomeSource(ObjectMapper objectMapper, String url, String fieldPath) {
        this(new OkHttpClient.Builder()
                .readTimeout(30, TimeUnit.SECONDS)
                .connectTimeout(10, TimeUnit.SECONDS)
                .retryOnConnectionFailure(true)
                .build(), objectMapper, url, fieldPath);
    }

    HttpOutcomeSource(OkHttpClient httpClient, ObjectMapper objectMapper, String url, String fieldPath) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.url = url;
        this.fieldPath = fieldPath;
    }

    @Override
    public long currentOutcome() {
        return parseOutcome(fetch());
    }

    long parseOutcome(JsonNode root) {
        JsonNode node = root;
        for (String segment : fieldPath.split("\\.")) {
            node = node.path(segment);
        }
        if (node.isMissingNode() || node.isNull()) {
            throw new OutcomeUnavailableException("Field '" + fieldPath + "' missing in outcome response");
        }
        try {
            BigDecimal reading = new BigDecimal(node.asText().trim());
            return reading.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new OutcomeUnavailableException("Unreadable outcome value '" + node.asText() + "'", e);
        }
    }

    private JsonNode fetch() {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "application/json")
                .build();

        for (int i = 0; i < RETRIES; i++) {
            try (Response response = httpClient.newCall(request).execute()) {
                if (!response.isSuccessful()) {
                    if (response.code() == 429 && i < RETRIES - 1) {
                        backoff(1000L * (i + 1));
                        continue;
                    }
                    throw new OutcomeUnavailableException(
                            "Outcome request failed: " + response.code() + " " + response.message());
                }
                if (response.body() == null) {
                    throw new OutcomeUnavailableException("Empty outcome response from " + url);
                }
                return objectMapper.readTree(response.body().string());
            } catch (IOException e) {
                if (i == RETRIES - 1) {
                    throw new OutcomeUnavailableException("Failed to read outcome after retries: " + url, e);
                }
                log.warn("Outcome request to {} failed ({}), retrying", url, e.getMessage());
                backoff(500);
            }
        }
        throw new OutcomeUnavailableException("Outcome source exhausted retries: " + url);
    }

    private void backoff(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OutcomeUnavailableException("Interrupted while waiting to retry " + url, e);
        }
    }
}
