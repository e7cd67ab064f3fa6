package com.g2e.brokerage.infrastructure.broker.http;

import com.g2e.brokerage.broker.exception.VendorUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Shared outbound HTTP client for vendor adapters.
 *
 * Every request carries the configured timeout; transport failures are converted to
 * {@link VendorUnavailableException}. Status handling is left to the adapter.
 */
public class VendorHttpClient {
    private static final Logger log = LoggerFactory.getLogger(VendorHttpClient.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public VendorHttpClient(Duration timeout) {
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
        this.requestTimeout = timeout;
    }

    public HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri).timeout(requestTimeout);
    }

    public VendorResponse send(String brokerCode, HttpRequest request) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("[{}] {} {} -> {}", brokerCode, request.method(), request.uri().getPath(), response.statusCode());
            return new VendorResponse(response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            throw new VendorUnavailableException(brokerCode,
                "Request timed out: " + request.method() + " " + request.uri().getPath(), e);
        } catch (IOException e) {
            throw new VendorUnavailableException(brokerCode,
                "Request failed: " + request.method() + " " + request.uri().getPath() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VendorUnavailableException(brokerCode, "Request interrupted", e);
        }
    }

    /**
     * application/x-www-form-urlencoded body or query string. Null values are skipped.
     */
    public static String formEncode(Map<String, String> params) {
        return params.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    public static Map<String, String> formDecode(String body) {
        Map<String, String> result = new LinkedHashMap<>();
        if (body == null || body.isBlank()) {
            return result;
        }
        for (String pair : body.trim().split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            result.put(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return result;
    }

    public static URI uri(String base, String path, Map<String, String> query) {
        String encoded = query == null ? "" : formEncode(query);
        return URI.create(base + path + (encoded.isEmpty() ? "" : "?" + encoded));
    }
}
