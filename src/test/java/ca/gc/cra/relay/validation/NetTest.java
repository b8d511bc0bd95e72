package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void validateHostHandlesHostname() {
    assertEquals("mqtt.example.com", Net.validateHost(" mqtt.example.com "));
  }

  @Test
  void validateHostHandlesIpv4() {
    assertEquals("10.0.0.1", Net.validateHost("10.0.0.1"));
  }

  @Test
  void validateHostUnwrapsBracketedIpv6() {
    assertEquals("2001:db8::1", Net.validateHost("[2001:db8::1]"));
    assertEquals("2001:db8::1", Net.validateHost("2001:db8::1"));
    assertTrue(Net.isIpv6Literal("2001:db8::1"));
    assertFalse(Net.isIpv6Literal("10.0.0.1"));
  }

  @Test
  void validateHostRejectsOutOfRangeOctet() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("10.0.0.256"));
  }

  @Test
  void validateHostRejectsUnclosedBracket() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("[2001:db8::1"));
  }

  @Test
  void validateHostRejectsMalformedLabels() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("-broker.example"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("broker..example"));
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("broker example"));
  }

  @Test
  void validateHostRejectsBogusIpv6() {
    assertThrows(IllegalArgumentException.class, () -> Net.validateHost("2001:zz::1"));
  }
}
