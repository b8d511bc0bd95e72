package ca.gc.cra.relay.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.config.NodeConfigParser;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CheckCliTest {
  @TempDir Path tempDir;

  private final NodeConfigParser parser = new NodeConfigParser(() -> "collector01");
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsPlanForValidConfiguration() throws Exception {
    Path ca = Path.of(CheckCliTest.class.getResource("/tls/ca.pem").toURI());
    Path cert = Path.of(CheckCliTest.class.getResource("/tls/client.pem").toURI());
    Path key = Path.of(CheckCliTest.class.getResource("/tls/client-key.pem").toURI());
    Path yaml = write("""
        relay:
          flushInterval: 15
          nodes:
            local:
              Host: localhost
              Port: 1883
            secure:
              Host: broker.example
              CAPath: %s
              ClientCert: %s
              ClientKey: %s
              StoreRates: true
        """.formatted(ca, cert, key));

    ExitCode code = CheckCli.run(new String[] {"config=" + yaml, "metricsExporter=none"}, parser);

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains(" Flush interval   : 15s"));
    assertTrue(out.contains(" Metrics exporter : none"));
    assertTrue(out.contains(" Node local (write_mqtt/local)"));
    assertTrue(out.contains("localhost:1883 MQTT 3.1.1"));
    assertTrue(out.contains("Client id      : collector01"));
    assertTrue(out.contains("Client key     : [REDACTED]"));
    assertFalse(out.contains(key.toString()));
  }

  @Test
  void invalidNodeIsReportedAndFailsCheck() throws Exception {
    Path yaml = write("""
        relay:
          nodes:
            good:
              Host: localhost
            bad:
              Port: 1883
            GOOD:
              Host: other.example
        """);

    ExitCode code = CheckCli.run(new String[] {"config=" + yaml}, parser);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    String out = buffer.toString();
    assertTrue(out.contains(" Node good (write_mqtt/good)"));
    assertTrue(out.contains(" Node bad : INVALID"));
    assertTrue(out.contains(" Node GOOD : INVALID (duplicate node name"));
  }

  @Test
  void configurationWithoutNodesFails() throws Exception {
    Path yaml = write("""
        relay:
          flushInterval: 10
        """);

    assertEquals(ExitCode.CONFIG_ERROR, CheckCli.run(new String[] {"config=" + yaml}, parser));
    assertTrue(buffer.toString().contains(" No nodes configured"));
  }

  @Test
  void unknownOptionIsInvalidArgs() throws Exception {
    Path yaml = write("relay: {}\n");

    assertEquals(ExitCode.INVALID_ARGS, CheckCli.run(new String[] {"config=" + yaml, "retain=true"}, parser));
    assertTrue(buffer.toString().contains("usage: relay check"));
  }

  @Test
  void unknownFlagIsInvalidArgs() throws Exception {
    Path yaml = write("relay: {}\n");

    assertEquals(ExitCode.INVALID_ARGS, CheckCli.run(new String[] {"config=" + yaml, "--dry-run"}, parser));
  }

  @Test
  void missingConfigurationFileIsConfigError() {
    ExitCode code = CheckCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")}, parser);

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void invalidOverrideIsConfigError() throws Exception {
    Path yaml = write("relay: {}\n");

    assertEquals(ExitCode.CONFIG_ERROR, CheckCli.run(new String[] {"config=" + yaml, "flushInterval=0"}, parser));
  }

  private Path write(String content) throws Exception {
    return Files.writeString(tempDir.resolve("relay.yaml"), content);
  }
}
