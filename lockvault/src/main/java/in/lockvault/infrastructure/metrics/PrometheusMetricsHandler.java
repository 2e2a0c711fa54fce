package in.lockvault.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves GET /metrics for Prometheus scraping.
 *
 * Before each scrape the {@code beforeScrape} hook re-reads gauges that mirror store state
 * (total locked), so a restarted node reports the persisted value rather than zero.
 * {@code ?name[]=vault_total_locked} limits the output to the named families, and an
 * OpenMetrics Accept header gets OpenMetrics text.
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;
    private final Runnable beforeScrape;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this(registry, () -> { });
    }

    public PrometheusMetricsHandler(CollectorRegistry registry, Runnable beforeScrape) {
        this.registry = registry;
        this.beforeScrape = beforeScrape;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            // The gauge refresh reads the store.
            exchange.dispatch(this);
            return;
        }

        try {
            beforeScrape.run();
        } catch (RuntimeException e) {
            log.warn("Gauge refresh failed, serving last recorded values: {}", e.getMessage());
        }

        String contentType = TextFormat.chooseContentType(
            exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        try {
            StringWriter writer = new StringWriter();
            TextFormat.writeFormat(contentType, writer, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
            exchange.setStatusCode(200);
            exchange.getResponseSender().send(writer.toString());
        } catch (IOException e) {
            log.error("Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
