package ca.gc.cra.ftrace.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndCommandSections() throws Exception {
    Path yaml = tempDir.resolve("ftrace.yaml");
    Files.writeString(yaml, String.join("\n",
        "common:",
        "  metricsExporter: otlp",
        "  includeEventPayload: false",
        "tokenize:",
        "  in: /traces/boot.pftrace",
        "  includeEventPayload: true",
        "other:",
        "  ignored: yes"));

    Optional<Map<String, String>> loaded = YamlConfigLoader.load(yaml, "tokenize");

    Map<String, String> values = loaded.orElseThrow();
    assertEquals("otlp", values.get("metricsExporter"));
    assertEquals("/traces/boot.pftrace", values.get("in"));
    assertEquals("true", values.get("includeEventPayload"));
    assertEquals(3, values.size());
  }

  @Test
  void nestedMappingsAreFlattenedAndNullsBecomeBlank() throws Exception {
    Path yaml = tempDir.resolve("nested.yaml");
    Files.writeString(yaml, "tokenize:\n  otel:\n    endpoint: http://collector:4317\n  out:\n");

    Map<String, String> values = YamlConfigLoader.load(yaml, "TOKENIZE").orElseThrow();

    assertEquals("http://collector:4317", values.get("otel.endpoint"));
    assertEquals("", values.get("out"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertTrue(YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "tokenize").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "tokenize"));
  }

  @Test
  void listsAreRejected() throws Exception {
    Path yaml = tempDir.resolve("list.yaml");
    Files.writeString(yaml, "tokenize:\n  in:\n    - a\n    - b\n");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "tokenize"));
    assertTrue(ex.getMessage().contains("in"));
  }

  @Test
  void invalidYamlIsRejected() throws Exception {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "tokenize: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "tokenize"));
  }

  @Test
  void scalarRootIsRejected() throws Exception {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "just-a-string");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "tokenize"));
  }
}
