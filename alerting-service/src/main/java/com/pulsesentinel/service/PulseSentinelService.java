package com.pulsesentinel.service;

import com.pulsesentinel.core.config.AlertingConfig;
import com.pulsesentinel.core.config.AlertingConfigLoader;
import com.pulsesentinel.core.engine.AlertingEngine;
import com.pulsesentinel.core.metrics.MetricsCollector;
import com.pulsesentinel.core.model.MetricSnapshot;
import com.pulsesentinel.core.notify.MessageTransport;
import com.pulsesentinel.core.notify.WebhookTransport;
import com.pulsesentinel.core.notify.channel.ChannelSenders;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Pulse Sentinel alerting service.
 *
 * <h3>Wiring</h3>
 *
 * <pre>
 *   JVM / HTTP probes ─► MetricsCollector ─► AlertRuleEngine ─► AlertStore
 *                                                                  │
 *            HTTP transports (+ retry) ◄─ NotificationDispatcher ◄─┘
 *   HTTP service probes ─► HealthChecker ─► /health
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Process settings come from environment variables via
 * {@link ServiceConfig}; seed rules, channels and templates from
 * {@link AlertingConfigLoader}. State lives in JSON files under
 * {@code STORE_DIR}.
 * </p>
 *
 * @since 1.0.0
 */
public final class PulseSentinelService {

    private static final Logger LOG = LoggerFactory.getLogger(PulseSentinelService.class);

    private PulseSentinelService() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Pulse Sentinel with config: {}", config);

        // 2. Load seed rules, channels and templates
        AlertingConfig seed = AlertingConfigLoader.load();

        // 3. Assemble and start the engine
        AlertingEngine engine = buildEngine(config, seed, HttpClient.newBuilder()
                .connectTimeout(config.getProbeTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
        engine.start();

        // 4. Start health server with shutdown hook
        HealthServer healthServer = new HealthServer(engine::getSystemStatus, engine::isRunning);
        healthServer.start(config.getHealthPort());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            healthServer.stop();
            engine.stop();
            stopped.countDown();
        }, "pulse-shutdown"));

        // 5. Block until the JVM is asked to stop
        stopped.await();
    }

    // ---------------------------------------------------------------
    // Assembly (extracted for readability and testability)
    // ---------------------------------------------------------------

    /**
     * Build an engine from process configuration. Probes and relays whose
     * endpoint is not configured are left out.
     */
    static AlertingEngine buildEngine(ServiceConfig config, AlertingConfig seed, HttpClient client) {
        Clock clock = Clock.systemUTC();
        RetryRegistry retries = HttpRetry.registry();
        Duration requestTimeout = HttpRetry.requestTimeout(config.getDispatchTimeout());
        WebhookTransport webhooks = new HttpWebhookTransport(client, requestTimeout,
                HttpRetry.retry(retries, "webhook"));
        MessageTransport email = config.getEmailRelayUrl()
                .<MessageTransport>map(url -> new HttpRelayMessageTransport(
                        new HttpWebhookTransport(client, requestTimeout, HttpRetry.retry(retries, "email")),
                        url))
                .orElseGet(() -> new UnconfiguredMessageTransport("EMAIL_RELAY_URL"));
        MessageTransport sms = config.getSmsRelayUrl()
                .<MessageTransport>map(url -> new HttpRelayMessageTransport(
                        new HttpWebhookTransport(client, requestTimeout, HttpRetry.retry(retries, "sms")),
                        url))
                .orElseGet(() -> new UnconfiguredMessageTransport("SMS_RELAY_URL"));

        AlertingEngine.Builder builder = AlertingEngine.builder()
                .clock(clock)
                .stateStore(new JsonFileStateStore(Path.of(config.getStoreDir())))
                .seed(seed)
                .zone(config.getDisplayZone())
                .senders(ChannelSenders.standard(webhooks, email, sms, clock))
                .metricsInterval(config.getMetricsInterval())
                .healthInterval(config.getHealthInterval())
                .escalationInterval(config.getEscalationInterval())
                .dispatchTimeout(config.getDispatchTimeout())
                .shutdownGrace(config.getShutdownGrace())
                .metricProbe(MetricSnapshot.CPU_USAGE, JvmMetricProbes.cpuUsage())
                .metricProbe(MetricSnapshot.MEMORY_USAGE, JvmMetricProbes.memoryUsage());

        HttpProbes http = new HttpProbes(client, config.getProbeTimeout());
        config.getInternalApiUrl().ifPresent(url -> builder
                .metricProbe(MetricSnapshot.RESPONSE_TIME, http.responseTime(url),
                        MetricsCollector.DEGRADED_RESPONSE_TIME_MS)
                .serviceCheck("internal_api", true, config.getProbeTimeout(), http.service(url)));
        config.getDatabaseHealthUrl().ifPresent(url -> builder
                .serviceCheck("database", true, config.getProbeTimeout(), http.service(url)));
        config.getExternalApiUrl().ifPresent(url -> builder
                .serviceCheck("external_api", false, config.getProbeTimeout(), http.service(url)));
        config.getStatsUrl().ifPresent(url -> builder
                .metricProbe(MetricSnapshot.ACTIVE_USERS, http.statsField(url, MetricSnapshot.ACTIVE_USERS))
                .metricProbe(MetricSnapshot.DB_CONNECTIONS, http.statsField(url, MetricSnapshot.DB_CONNECTIONS))
                .metricProbe(MetricSnapshot.API_CALLS, http.statsField(url, MetricSnapshot.API_CALLS)));

        return builder.build();
    }
}
