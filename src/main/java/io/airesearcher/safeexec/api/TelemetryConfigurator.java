package io.airesearcher.safeexec.api;

import io.airesearcher.safeexec.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related settings to the JVM system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from
   * {@code settings}.
   *
   * @param settings mutable effective settings; telemetry keys are removed
   * @throws IllegalArgumentException if a telemetry value is malformed
   */
  static void configureMetrics(Map<String, String> settings) {
    if (settings == null || settings.isEmpty()) {
      return;
    }
    String exporter = trimToEmpty(settings.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty()) {
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
      System.setProperty("otel.metrics.exporter", exporter);
    }

    String endpoint = trimToEmpty(settings.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trimToEmpty(settings.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", resourceAttributes);
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

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
