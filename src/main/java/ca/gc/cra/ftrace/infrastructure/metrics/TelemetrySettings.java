package ca.gc.cra.ftrace.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * OpenTelemetry exporter settings resolved from configuration.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint; ignored when the exporter is {@link ExporterMode#NONE}
 * @param resourceAttributes extra {@code key=value,key=value} resource attributes; may be blank
 * @param exportInterval period between metric exports
 * @since 0.1.0
 */
public record TelemetrySettings(
    ExporterMode exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Validates the settings.
   */
  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    Objects.requireNonNull(exportInterval, "exportInterval");
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Returns settings with exporting disabled.
   *
   * @return settings for {@link ExporterMode#NONE}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(ExporterMode.NONE, DEFAULT_ENDPOINT, "", Duration.ofSeconds(30));
  }

  /** Supported metric exporters. */
  public enum ExporterMode {
    /** Push metrics to an OTLP gRPC collector. */
    OTLP,
    /** Do not export; counters stay in process. */
    NONE;

    /**
     * Parses a configured exporter name.
     *
     * @param raw configured value
     * @return exporter mode
     * @throws IllegalArgumentException if the value is not {@code otlp} or {@code none}
     */
    public static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was " + raw + ")");
      };
    }
  }
}
