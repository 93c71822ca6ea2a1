package ca.gc.cra.ftrace.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and command-line settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective settings.
   *
   * @param yaml settings loaded from YAML, if any
   * @param cli command-line settings; may be {@code null}
   * @param defaults default settings; may be {@code null}
   * @param warn receives one message per key the command line overrides from YAML; may be {@code null}
   * @return immutable merged settings
   * @throws IllegalArgumentException if a key is unknown to {@code defaults}
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> base = defaults == null ? Map.of() : defaults;
    Map<String, String> fromYaml = yaml.orElse(Map.of());
    Map<String, String> fromCli = cli == null ? Map.of() : cli;

    requireKnownKeys("YAML", fromYaml, base);
    requireKnownKeys("argument", fromCli, base);

    Map<String, String> merged = new LinkedHashMap<>(base);
    merged.putAll(fromYaml);
    fromCli.forEach((key, value) -> {
      if (fromYaml.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    });
    return Map.copyOf(merged);
  }

  private static void requireKnownKeys(String source, Map<String, String> values, Map<String, String> defaults) {
    if (defaults.isEmpty()) {
      return;
    }
    for (String key : values.keySet()) {
      if (!defaults.containsKey(key)) {
        throw new IllegalArgumentException("Unknown " + source + " key: " + key);
      }
    }
  }
}
