package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void validateReadableFileReturnsRealPath() throws Exception {
    Path ca = Files.writeString(tempDir.resolve("ca.pem"), "pem");

    assertEquals(ca.toRealPath(), Paths.validateReadableFile("CAPath", ca.toString()));
  }

  @Test
  void validateReadableFileRejectsMissingFile() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateReadableFile("CAPath", tempDir.resolve("missing.pem").toString()));
  }

  @Test
  void validateReadableFileRejectsDirectory() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("CAPath", tempDir.toString()));
  }
}
