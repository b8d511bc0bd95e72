package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadSplitsSettingsAndNodesInDocumentOrder() throws IOException {
    Path yaml = tempDir.resolve("relay.yaml");
    Files.writeString(yaml, """
        relay:
          flushInterval: 5
          metricsExporter: none
          nodes:
            zeta:
              Host: broker-z.example
              Port: 1883
              StoreRates: true
            alpha:
              Host: broker-a.example
              ProtocolVersion: 3.1
        """);

    YamlConfigLoader.Document document = YamlConfigLoader.load(yaml).orElseThrow();

    assertEquals("5", document.settings().get("flushInterval"));
    assertEquals("none", document.settings().get("metricsExporter"));
    assertFalse(document.settings().containsKey("nodes"));
    assertEquals(List.of("zeta", "alpha"), List.copyOf(document.nodes().keySet()));
    assertEquals(Map.of("Host", "broker-z.example", "Port", "1883", "StoreRates", "true"),
        document.nodes().get("zeta"));
    assertEquals("3.1", document.nodes().get("alpha").get("ProtocolVersion"));
  }

  @Test
  void nodeWithoutSettingsYieldsEmptyBlock() {
    YamlConfigLoader.Document document = YamlConfigLoader.parse(new StringReader("""
        relay:
          nodes:
            bare:
        """), "inline");

    assertTrue(document.nodes().get("bare").isEmpty());
  }

  @Test
  void flattensNestedSettings() {
    YamlConfigLoader.Document document = YamlConfigLoader.parse(new StringReader("""
        relay:
          otel:
            endpoint: http://collector:4317
        """), "inline");

    assertEquals("http://collector:4317", document.settings().get("otel.endpoint"));
  }

  @Test
  void emptyDocumentYieldsNothing() {
    YamlConfigLoader.Document document = YamlConfigLoader.parse(new StringReader(""), "inline");

    assertTrue(document.settings().isEmpty());
    assertTrue(document.nodes().isEmpty());
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml")).isPresent());
  }

  @Test
  void missingRootSectionThrows() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(new StringReader("""
        collectd:
          nodes: {}
        """), "inline"));
  }

  @Test
  void invalidStructureThrows() {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(new StringReader("""
        - relay:
            flushInterval: 5
        """), "inline"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.parse(new StringReader("""
        relay:
          nodes:
            main:
              Host: [a, b]
        """), "inline"));
  }

  @Test
  void malformedYamlThrows() {
    assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.parse(new StringReader("relay: [unclosed"), "inline"));
  }
}
