package ca.gc.cra.ftrace.config;

import ca.gc.cra.ftrace.application.pipeline.UnsupportedClockPolicy;
import ca.gc.cra.ftrace.application.tokenizer.CompactSchedClockPolicy;
import ca.gc.cra.ftrace.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.ftrace.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for one {@code tokenize} run.
 * <p><strong>Why:</strong> Collects CLI, YAML and default values into one validated value so the composition root
 * never sees raw strings.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input trace file to import
 * @param outputDirectory directory receiving {@code events.ndjson}
 * @param compactSchedClockFailure reaction to a compact row whose timestamp cannot be converted
 * @param unsupportedClock reaction to a bundle with an unsupported clock domain
 * @param includeEventPayload whether raw ftrace events are written as hex
 * @param telemetry OpenTelemetry exporter settings
 * @since 0.1.0
 */
public record TokenizeConfig(
    Path input,
    Path outputDirectory,
    CompactSchedClockPolicy compactSchedClockFailure,
    UnsupportedClockPolicy unsupportedClock,
    boolean includeEventPayload,
    TelemetrySettings telemetry) {

  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  /**
   * Normalizes paths and fills defaults for missing policies.
   */
  public TokenizeConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    input = input.toAbsolutePath().normalize();
    outputDirectory = outputDirectory.toAbsolutePath().normalize();
    compactSchedClockFailure = Objects.requireNonNullElse(compactSchedClockFailure, CompactSchedClockPolicy.ABORT_BATCH);
    unsupportedClock = Objects.requireNonNullElse(unsupportedClock, UnsupportedClockPolicy.FAIL);
    telemetry = Objects.requireNonNullElse(telemetry, TelemetrySettings.disabled());
  }

  /**
   * Builds a configuration from a flattened key/value map.
   *
   * @param options merged settings; {@code in} is required
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static TokenizeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = options.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("in is required (path to a trace file)");
    }
    String out = options.getOrDefault("out", "");
    Path outputDirectory = out.isBlank() ? ConfigDefaults.defaultOutputDirectory() : parsePath("out", out);

    CompactSchedClockPolicy compactPolicy = blank(options.get("compactSchedClockFailure"))
        ? CompactSchedClockPolicy.ABORT_BATCH
        : CompactSchedClockPolicy.fromString(options.get("compactSchedClockFailure"));
    UnsupportedClockPolicy clockPolicy = blank(options.get("unsupportedClock"))
        ? UnsupportedClockPolicy.FAIL
        : UnsupportedClockPolicy.fromString(options.get("unsupportedClock"));
    boolean includePayload =
        Strings.parseBoolean("includeEventPayload", options.get("includeEventPayload"), false);

    return new TokenizeConfig(
        parsePath("in", in),
        outputDirectory,
        compactPolicy,
        clockPolicy,
        includePayload,
        telemetryFrom(options));
  }

  private static TelemetrySettings telemetryFrom(Map<String, String> options) {
    TelemetrySettings.ExporterMode exporter = TelemetrySettings.ExporterMode.from(options.get("metricsExporter"));
    String endpoint = options.get("otelEndpoint");
    if (!blank(endpoint)) {
      endpoint = Strings.requirePrintableAscii("otelEndpoint", endpoint, 2_048);
      if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
    }
    String attributes = options.get("otelResourceAttributes");
    if (!blank(attributes)) {
      attributes = Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    Duration interval = Duration.ofSeconds(30);
    String intervalRaw = options.get("otelExportIntervalSeconds");
    if (!blank(intervalRaw)) {
      try {
        interval = Duration.ofSeconds(Long.parseLong(intervalRaw.trim()));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("otelExportIntervalSeconds must be an integer", ex);
      }
    }
    return new TelemetrySettings(exporter, endpoint, attributes, interval);
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static boolean blank(String value) {
    return value == null || value.isBlank();
  }
}
