package com.pulsesentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pulsesentinel.core.config.JsonSupport;
import com.pulsesentinel.core.health.ServiceProbe;
import com.pulsesentinel.core.metrics.MetricProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * HTTP-backed health and metric probes.
 */
public class HttpProbes {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProbes.class);
    private static final ObjectMapper MAPPER = JsonSupport.mapper();

    private final HttpClient client;
    private final Duration timeout;

    public HttpProbes(HttpClient client, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * A service is up when {@code GET url} answers 2xx.
     */
    public ServiceProbe service(String url) {
        return () -> {
            HttpResponse<String> response = get(url);
            requireSuccess(url, response);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("url", url);
            details.put("status_code", response.statusCode());
            return details;
        };
    }

    /**
     * Response time of {@code GET url} in milliseconds. A non-2xx answer
     * counts as a failed probe.
     */
    public MetricProbe responseTime(String url) {
        return () -> {
            long start = System.nanoTime();
            requireSuccess(url, get(url));
            return TimeUnit.NANOSECONDS.toMicros(System.nanoTime() - start) / 1000.0;
        };
    }

    /**
     * Read one numeric field from a JSON stats document, e.g.
     * {@code {"active_users":12,"db_connections":4,"api_calls":310}}.
     */
    public MetricProbe statsField(String url, String field) {
        return () -> {
            HttpResponse<String> response = get(url);
            requireSuccess(url, response);
            JsonNode node = MAPPER.readTree(response.body()).path(field);
            if (!node.isNumber()) {
                throw new IllegalStateException("Stats field '" + field + "' missing or not numeric");
            }
            return node.asDouble();
        };
    }

    private HttpResponse<String> get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static void requireSuccess(String url, HttpResponse<String> response) throws IOException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            LOG.debug("GET {} answered {}", url, status);
            throw new IOException("HTTP " + status + " from " + url);
        }
    }
}
