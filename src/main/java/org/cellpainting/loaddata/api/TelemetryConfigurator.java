package org.cellpainting.loaddata.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.cellpainting.loaddata.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves telemetry settings out of the effective configuration and into the system properties read by
 * {@code OpenTelemetryBootstrap}.
 *
 * <p>The keys are removed from {@code args} so that {@code BindConfig}/{@code CombineConfig} only see
 * pipeline settings. Blank values leave the corresponding property untouched.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  static final String EXPORTER_KEY = "metricsExporter";
  static final String ENDPOINT_KEY = "otelEndpoint";
  static final String RESOURCE_ATTRIBUTES_KEY = "otelResourceAttributes";
  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_ATTRIBUTES_PROPERTY = "otel.resource.attributes";
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies and strips telemetry keys.
   *
   * @param args mutable effective configuration
   * @return normalized exporter name, {@code otlp} when not configured
   * @throws IllegalArgumentException when the exporter, endpoint or resource attributes are invalid
   */
  static String configureMetrics(Map<String, String> args) {
    if (args == null) {
      return "otlp";
    }
    String exporter = trimmed(args.remove(EXPORTER_KEY)).toLowerCase(Locale.ROOT);
    String endpoint = trimmed(args.remove(ENDPOINT_KEY));
    String attributes = trimmed(args.remove(RESOURCE_ATTRIBUTES_KEY));

    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException(EXPORTER_KEY + " must be 'otlp' or 'none'");
    }
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii(RESOURCE_ATTRIBUTES_KEY, attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    apply(EXPORTER_PROPERTY, exporter);
    apply(ENDPOINT_PROPERTY, endpoint);
    apply(RESOURCE_ATTRIBUTES_PROPERTY, attributes);
    return exporter.isEmpty() ? "otlp" : exporter;
  }

  private static void apply(String property, String value) {
    if (!value.isEmpty()) {
      log.debug("Setting {}={}", property, value);
      System.setProperty(property, value);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException(ENDPOINT_KEY + " must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(ENDPOINT_KEY + " must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(ENDPOINT_KEY + " must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
