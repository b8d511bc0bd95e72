package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"config=/etc/relay.yaml", "flushInterval=5"});
    assertEquals("/etc/relay.yaml", map.get("config"));
    assertEquals("5", map.get("flushInterval"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=prod,team=ops"});
    assertEquals("env=prod,team=ops", map.get("otelResourceAttributes"));
  }

  @Test
  void laterOccurrenceWins() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"flushTimeout=1", "flushTimeout=2"});
    assertEquals("2", map.get("flushTimeout"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9key=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0007b"}));
  }

  @Test
  void flagsAreSeparatedFromPairs() {
    CliInput input = CliInput.parse(new String[] {"config=a.yaml", "-h", "--dry-run"});
    assertTrue(input.help());
    assertFalse(input.verbose());
    assertArrayEquals(new String[] {"config=a.yaml"}, input.keyValueArgs());
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, input::requireKnownFlags);
    assertEquals("unknown option: --dry-run", ex.getMessage());
  }

  @Test
  void aliasesFoldIntoKnownFlags() {
    CliInput input = CliInput.parse(new String[] {"--DEBUG", "help", "-Dkey=value"});
    assertTrue(input.help());
    assertTrue(input.verbose());
    input.requireKnownFlags();
    assertArrayEquals(new String[] {"-Dkey=value"}, input.keyValueArgs());
  }
}
