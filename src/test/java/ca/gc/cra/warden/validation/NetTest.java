package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void acceptsHostnamesAndIpLiterals() {
    assertTrue(Net.isValidHost("api.fabric.microsoft.com"));
    assertTrue(Net.isValidHost("my_host-01.internal"));
    assertTrue(Net.isValidHost("localhost"));
    assertTrue(Net.isValidHost("192.168.1.10"));
    assertTrue(Net.isValidHost("2001:db8::1"));
    assertTrue(Net.isValidHost("[::1]"));
  }

  @Test
  void rejectsMalformedHosts() {
    assertFalse(Net.isValidHost(""));
    assertFalse(Net.isValidHost(null));
    assertFalse(Net.isValidHost("-lead.example.com"));
    assertFalse(Net.isValidHost("trail-.example.com"));
    assertFalse(Net.isValidHost("a..b"));
    assertFalse(Net.isValidHost("example.com."));
    assertFalse(Net.isValidHost("999.1.1.1"));
    assertFalse(Net.isValidHost("has space.com"));
    assertFalse(Net.isValidHost("a".repeat(64) + ".com"));
  }

  @Test
  void ipLiteralDetection() {
    assertTrue(Net.isIpLiteral("10.0.0.1"));
    assertTrue(Net.isIpLiteral("fe80::1"));
    assertFalse(Net.isIpLiteral("example.com"));
    assertFalse(Net.isIpLiteral("256.0.0.1"));
    assertFalse(Net.isIpLiteral("abc:def:ghi"));
  }

  @Test
  void requireHostReturnsHostOrThrows() {
    assertEquals("example.com", Net.requireHost("host", "example.com"));
    assertThrows(IllegalArgumentException.class, () -> Net.requireHost("host", "exa mple.com"));
  }
}
