package org.cellpainting.loaddata.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private final Map<String, String> saved = new HashMap<>();

  @BeforeEach
  void saveProperties() {
    for (String property : properties()) {
      saved.put(property, System.getProperty(property));
      System.clearProperty(property);
    }
  }

  @AfterEach
  void restoreProperties() {
    saved.forEach((property, value) -> {
      if (value == null) {
        System.clearProperty(property);
      } else {
        System.setProperty(property, value);
      }
    });
  }

  @Test
  void movesTelemetryKeysIntoSystemProperties() {
    Map<String, String> args = new HashMap<>();
    args.put("metricsExporter", " OTLP ");
    args.put("otelEndpoint", "http://collector:4317");
    args.put("otelResourceAttributes", "env=lab");
    args.put("images", "a.ndjson");

    String exporter = TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", exporter);
    assertEquals("otlp", System.getProperty(TelemetryConfigurator.EXPORTER_PROPERTY));
    assertEquals("http://collector:4317", System.getProperty(TelemetryConfigurator.ENDPOINT_PROPERTY));
    assertEquals("env=lab", System.getProperty(TelemetryConfigurator.RESOURCE_ATTRIBUTES_PROPERTY));
    assertEquals(Map.of("images", "a.ndjson"), args);
  }

  @Test
  void blankValuesLeavePropertiesUntouched() {
    Map<String, String> args = new HashMap<>();
    args.put("metricsExporter", "none");
    args.put("otelEndpoint", "");

    assertEquals("none", TelemetryConfigurator.configureMetrics(args));
    assertNull(System.getProperty(TelemetryConfigurator.ENDPOINT_PROPERTY));
    assertFalse(args.containsKey("otelEndpoint"));
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http://"))));
  }

  private static String[] properties() {
    return new String[] {
      TelemetryConfigurator.EXPORTER_PROPERTY,
      TelemetryConfigurator.ENDPOINT_PROPERTY,
      TelemetryConfigurator.RESOURCE_ATTRIBUTES_PROPERTY
    };
  }
}
