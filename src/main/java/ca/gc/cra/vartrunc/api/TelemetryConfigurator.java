package ca.gc.cra.vartrunc.api;

import ca.gc.cra.vartrunc.application.port.MetricsPort;
import ca.gc.cra.vartrunc.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.vartrunc.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related CLI settings and creates the matching {@link MetricsPort}.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Validates {@code metricsExporter} and {@code otelEndpoint}, exports them as {@code otel.*} system properties
   * and returns the adapter to use.
   *
   * @param config effective configuration
   * @return no-op adapter for {@code none}, otherwise an OpenTelemetry adapter
   * @throws IllegalArgumentException if the exporter or endpoint is invalid
   */
  static MetricsPort configureMetrics(Map<String, String> config) {
    String exporter = config.getOrDefault("metricsExporter", "none").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    if (exporter.equals("none")) {
      return new NoOpMetricsAdapter();
    }
    String endpoint = config.get("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      validateEndpoint(endpoint.trim());
      log.debug("Configuring OTLP endpoint: {}", endpoint.trim());
      System.setProperty("otel.exporter.otlp.endpoint", endpoint.trim());
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);
    return new OpenTelemetryMetricsAdapter();
  }

  static void close(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.forceFlush();
      otel.close();
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
