package ca.gc.cra.ftrace.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattened default settings for the {@code tokenize} command.
 *
 * <p>Every key a YAML file or the command line may set appears here, so the defaults double as the list of
 * recognized keys.</p>
 */
public final class ConfigDefaults {
  private ConfigDefaults() {}

  /**
   * Returns defaults for {@code tokenize}.
   *
   * @return immutable flat map
   */
  public static Map<String, String> forTokenize() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", defaultOutputDirectory().toString());
    map.put("compactSchedClockFailure", "ABORT_BATCH");
    map.put("unsupportedClock", "FAIL");
    map.put("includeEventPayload", "false");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("otelExportIntervalSeconds", "30");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  static Path defaultOutputDirectory() {
    return Path.of(System.getProperty("user.home", "."), ".ftrace", "out");
  }
}
