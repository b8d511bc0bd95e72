package ca.gc.cra.relay.application.publish;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.port.TransportSettings;
import ca.gc.cra.relay.application.port.TransportSettings.ProtocolVersion;
import ca.gc.cra.relay.domain.error.ConnectionException;
import ca.gc.cra.relay.domain.error.PublishException;
import ca.gc.cra.relay.testutil.FakeTransportClient;
import ca.gc.cra.relay.testutil.FakeTransportClient.FakeSession;
import ca.gc.cra.relay.testutil.LogCapture;
import ca.gc.cra.relay.testutil.ManualClock;
import ca.gc.cra.relay.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {
  private static final TransportSettings SETTINGS =
      new TransportSettings("broker.example", 8883, "relay-test", 60, ProtocolVersion.V3_1_1, Optional.empty());

  private final ManualClock clock = new ManualClock(0);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final FakeTransportClient transport = new FakeTransportClient();
  private LogCapture logs;
  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    logs = LogCapture.of(ConnectionManager.class);
    manager = new ConnectionManager("n1", SETTINGS, "collectd/metrics", 1, transport, clock, metrics);
  }

  @AfterEach
  void tearDown() {
    logs.close();
  }

  @Test
  void connectsLazilyAndOnlyOnce() throws Exception {
    assertEquals(0, transport.connectAttempts());
    assertFalse(manager.hasSession());

    manager.ensureConnected();
    manager.ensureConnected();

    assertEquals(1, transport.connectAttempts());
    assertTrue(manager.isConnected());
    assertTrue(transport.lastSession().loopStarted());
    assertEquals(SETTINGS, transport.lastSession().settings());
  }

  @Test
  void failedConnectLeavesNoSessionAndIsRetried() throws Exception {
    transport.failNextConnects(1);

    assertThrows(ConnectionException.class, manager::ensureConnected);
    assertFalse(manager.isConnected());
    assertFalse(manager.hasSession());
    assertEquals(1, metrics.counter("relay.n1.connect.failure"));

    manager.ensureConnected();
    assertEquals(2, transport.connectAttempts());
    assertTrue(manager.isConnected());
  }

  @Test
  void failedBackgroundLoopDiscardsHalfBuiltSession() {
    transport.failStartLoop(true);

    assertThrows(ConnectionException.class, manager::ensureConnected);

    FakeSession session = transport.lastSession();
    assertEquals(1, session.disconnects());
    assertTrue(session.destroyed());
    assertFalse(manager.hasSession());
  }

  @Test
  void repeatedConnectFailuresLogOneError() {
    transport.failNextConnects(3);
    for (int i = 0; i < 3; i++) {
      assertThrows(ConnectionException.class, manager::ensureConnected);
    }

    assertEquals(1, logs.messages(Level.ERROR).size());
    assertTrue(logs.contains(Level.ERROR, "cannot connect to broker \"broker.example:8883\""));
    assertEquals(3, metrics.counter("relay.n1.connect.failure"));
  }

  @Test
  void publishSendsOnTopicWithoutRetain() throws Exception {
    manager.ensureConnected();
    manager.publish(new byte[] {'[', ']'});

    FakeTransportClient.Message message = transport.lastSession().published().get(0);
    assertEquals("collectd/metrics", message.topic());
    assertEquals(1, message.qos());
    assertFalse(message.retain());
    assertArrayEquals(new byte[] {'[', ']'}, message.payload());
  }

  @Test
  void publishBeforeConnectIsRejected() {
    assertThrows(IllegalStateException.class, () -> manager.publish(new byte[] {'[', ']'}));
  }

  @Test
  void publishFailureMarksDisconnectedAndNextCallReconnectsSameSession() throws Exception {
    manager.ensureConnected();
    FakeSession session = transport.lastSession();
    session.failNextPublishes(1);

    assertThrows(PublishException.class, () -> manager.publish(new byte[] {'[', ']'}));
    assertFalse(manager.isConnected());
    assertTrue(manager.hasSession());
    assertEquals(1, session.disconnects());

    manager.ensureConnected();
    assertEquals(1, session.reconnects());
    assertEquals(1, transport.connectAttempts());
    assertTrue(manager.isConnected());
  }

  @Test
  void failedReconnectStaysDisconnected() throws Exception {
    manager.ensureConnected();
    FakeSession session = transport.lastSession();
    session.failNextPublishes(1).failNextReconnects(1);
    assertThrows(PublishException.class, () -> manager.publish(new byte[] {'[', ']'}));

    assertThrows(ConnectionException.class, manager::ensureConnected);

    assertFalse(manager.isConnected());
    assertEquals(1, metrics.counter("relay.n1.connect.failure"));
  }

  @Test
  void reconnectAloneKeepsComplaintActive() throws Exception {
    manager.ensureConnected();
    transport.lastSession().failNextPublishes(1);
    assertThrows(PublishException.class, () -> manager.publish(new byte[] {'[', ']'}));

    manager.ensureConnected();

    assertTrue(manager.isConnected());
    assertEquals(1, logs.messages(Level.ERROR).size());
    assertEquals(0, logs.messages(Level.INFO).size());
    assertTrue(manager.complaint().isActive());
  }

  @Test
  void successfulPublishAfterFailureLogsOneRecoveryLine() throws Exception {
    manager.ensureConnected();
    transport.lastSession().failNextPublishes(1);
    assertThrows(PublishException.class, () -> manager.publish(new byte[] {'[', ']'}));

    manager.ensureConnected();
    manager.publish(new byte[] {'[', ']'});
    manager.publish(new byte[] {'[', ']'});

    assertEquals(1, logs.messages(Level.INFO).size());
    assertTrue(logs.contains(Level.INFO, "publishing again to broker \"broker.example:8883\""));
    assertFalse(manager.complaint().isActive());
  }

  @Test
  void closeReleasesSessionOnce() throws Exception {
    manager.ensureConnected();
    FakeSession session = transport.lastSession();

    manager.close();
    manager.close();

    assertEquals(1, session.disconnects());
    assertTrue(session.loopStopped());
    assertTrue(session.destroyed());
    assertFalse(manager.hasSession());
    assertFalse(manager.isConnected());
  }

  @Test
  void closeWithoutSessionIsNoOp() {
    manager.close();
    assertEquals(0, transport.connectAttempts());
  }
}
