package ca.gc.cra.warden.application.classify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.events.ConnectionReference;
import ca.gc.cra.warden.domain.log.StreamKind;
import ca.gc.cra.warden.domain.report.ClassifiedConnection;
import ca.gc.cra.warden.domain.trust.TrustCatalog;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class EndpointClassifierTest {

  private final EndpointClassifier classifier = new EndpointClassifier();
  private final TrustCatalog catalog =
      TrustCatalog.load(List.of("api.fabric.microsoft.com", "*.notebook.windows.net"));

  private static ConnectionReference ref(String host) {
    return new ConnectionReference(host, Optional.of(443), Optional.of("https"), "line", 3, StreamKind.LIVY);
  }

  @Test
  void trustedHostCarriesMatchedPattern() {
    ClassifiedConnection connection = classifier.classify(ref("exec.eastus.notebook.windows.net"), catalog);

    assertTrue(connection.trusted());
    assertEquals("*.notebook.windows.net", connection.matchedPattern().orElseThrow().pattern());
    assertEquals(1, connection.occurrences());
  }

  @Test
  void unknownHostIsExternal() {
    ClassifiedConnection connection = classifier.classify(ref("evil-exfil.io"), catalog);

    assertFalse(connection.trusted());
    assertTrue(connection.matchedPattern().isEmpty());
  }

  @Test
  void hostIsNormalizedBeforeLookup() {
    ClassifiedConnection connection = classifier.classify(ref("API.FABRIC.MICROSOFT.COM."), catalog);

    assertTrue(connection.trusted());
    assertEquals("api.fabric.microsoft.com", connection.host());
    assertEquals(3, connection.reference().lineNumber());
  }

  @Test
  void classificationIsIdempotent() {
    ClassifiedConnection first = classifier.classify(ref("evil-exfil.io"), catalog);
    ClassifiedConnection second = classifier.classify(first.reference(), catalog);

    assertEquals(first, second);
  }
}
