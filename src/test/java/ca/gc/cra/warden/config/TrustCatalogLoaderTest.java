package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.trust.TrustCatalog;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TrustCatalogLoaderTest {

  @TempDir Path tempDir;

  @Test
  void bundledCatalogTrustsFabricInfrastructure() throws IOException {
    TrustCatalog catalog = TrustCatalogLoader.load(Optional.empty(), List.of());

    assertTrue(catalog.classify("api.fabric.microsoft.com").trusted());
    assertTrue(catalog.classify("exec.westus.notebook.windows.net").trusted());
    assertTrue(catalog.classify("localhost").trusted());
    assertFalse(catalog.classify("evil-exfil.io").trusted());
  }

  @Test
  void fileReplacesBundledPatternsAndAdditionsAreAppended() throws IOException {
    Path file = tempDir.resolve("trusted.yaml");
    Files.writeString(file, """
        trustedDomains:
          - corp.example.com
          - "*.lab.example.com"
        """);

    TrustCatalog catalog = TrustCatalogLoader.load(Optional.of(file), List.of("pypi.org"));

    assertEquals(3, catalog.size());
    assertTrue(catalog.classify("gpu.lab.example.com").trusted());
    assertTrue(catalog.classify("pypi.org").trusted());
    assertFalse(catalog.classify("api.fabric.microsoft.com").trusted());
  }

  @Test
  void documentWithoutListIsRejected() throws IOException {
    Path file = tempDir.resolve("bad.yaml");
    Files.writeString(file, "trustedDomains: corp.example.com\n");

    assertThrows(IllegalArgumentException.class, () -> TrustCatalogLoader.load(Optional.of(file), List.of()));
  }

  @Test
  void emptyListIsRejected() throws IOException {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "trustedDomains: []\n");

    assertThrows(IllegalArgumentException.class, () -> TrustCatalogLoader.load(Optional.of(file), List.of()));
  }

  @Test
  void invalidAdditionIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TrustCatalogLoader.load(Optional.empty(), List.of("not a host")));
  }
}
