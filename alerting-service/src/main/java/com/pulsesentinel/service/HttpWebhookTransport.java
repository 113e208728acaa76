package com.pulsesentinel.service;

import com.pulsesentinel.core.notify.ChannelDeliveryException;
import com.pulsesentinel.core.notify.WebhookTransport;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * {@link WebhookTransport} over the JDK {@link HttpClient}, wrapped in a
 * Resilience4j {@link Retry}.
 *
 * <p>
 * A 2xx response is success. 5xx and 429 responses and I/O errors are retried
 * per the retry policy; other statuses fail immediately.
 * </p>
 */
public class HttpWebhookTransport implements WebhookTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpWebhookTransport.class);

    private final HttpClient client;
    private final Duration requestTimeout;
    private final Retry retry;

    public HttpWebhookTransport(HttpClient client, Duration requestTimeout, Retry retry) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
    }

    @Override
    public void post(String url, Map<String, String> headers, String jsonBody) throws ChannelDeliveryException {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8));
            headers.forEach(builder::setHeader);
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new ChannelDeliveryException("Invalid webhook URL '" + url + "': " + e.getMessage(), e);
        }

        try {
            int status = retry.executeCheckedSupplier(() -> send(request));
            LOG.debug("POST {} answered {}", url, status);
        } catch (ChannelDeliveryException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelDeliveryException("Interrupted while posting to " + url, e);
        } catch (Throwable t) {
            throw new ChannelDeliveryException("POST " + url + " failed after "
                    + retry.getRetryConfig().getMaxAttempts() + " attempt(s): " + t.getMessage(), t);
        }
    }

    private int send(HttpRequest request) throws IOException, InterruptedException, ChannelDeliveryException {
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return status;
        }
        String message = "HTTP " + status + " from " + request.uri();
        if (status >= 500 || status == 429) {
            throw new HttpRetry.RetryableStatusException(message);
        }
        throw new ChannelDeliveryException(message);
    }
}
