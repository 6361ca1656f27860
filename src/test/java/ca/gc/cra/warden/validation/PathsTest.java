package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void readableFileIsResolved() throws IOException {
    Path file = Files.writeString(tempDir.resolve("index.json"), "{}");

    assertEquals(file.toRealPath(), Paths.requireReadableFile("in", file));
  }

  @Test
  void missingFileOrDirectoryIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile("in", tempDir.resolve("missing.json")));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile("in", tempDir));
  }

  @Test
  void writableFileCreatesParentsWhenAsked() {
    Path target = tempDir.resolve("reports/nested/report.json");

    Path validated = Paths.validateWritableFile("jsonOut", target, true, false);

    assertEquals(target.toAbsolutePath().normalize(), validated);
    assertTrue(Files.isDirectory(target.getParent()));
  }

  @Test
  void missingParentIsNotCreatedDuringDryRun() {
    Path target = tempDir.resolve("later/report.txt");

    Paths.validateWritableFile("textOut", target, false, false);

    assertTrue(Files.notExists(target.getParent()));
  }

  @Test
  void existingFileNeedsOverwritePermission() throws IOException {
    Path existing = Files.writeString(tempDir.resolve("report.txt"), "old");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile("textOut", existing, true, false));
    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateWritableFile("textOut", existing, true, true));
  }

  @Test
  void directoryTargetIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile("jsonOut", tempDir, true, true));
  }
}
