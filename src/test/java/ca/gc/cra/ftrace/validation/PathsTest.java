package ca.gc.cra.ftrace.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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
  void validateWritableDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    Path validated = Paths.validateWritableDir(dir, false, true);
    assertEquals(dir.toRealPath(), validated);
  }

  @Test
  void validateWritableDirRejectsNonEmptyDirectoryWithoutAllowOverwrite() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("nonEmpty"));
    Files.createFile(dir.resolve("events.ndjson"));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(dir, false, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
  }

  @Test
  void validateWritableDirAllowsCreationWhenRequested() {
    Path dir = tempDir.resolve("missing");
    Path validated = Paths.validateWritableDir(dir, true, false);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirAllowsFutureCreationDuringDryRun() {
    Path dir = tempDir.resolve("future/child");
    Path validated = Paths.validateWritableDir(dir, false, false);
    assertTrue(validated.endsWith(Path.of("future", "child")));
    assertFalse(Files.exists(validated));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("file.txt"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, false, true));
  }

  @Test
  void validateReadableFileAcceptsRegularFile() throws IOException {
    Path trace = Files.write(tempDir.resolve("trace.pftrace"), new byte[] {1});
    assertEquals(trace.toAbsolutePath().normalize(), Paths.validateReadableFile("in", trace));
  }

  @Test
  void validateReadableFileRejectsMissingAndDirectories() {
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateReadableFile("in", tempDir.resolve("absent")));
    assertTrue(missing.getMessage().startsWith("in does not exist"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("in", tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile("in", null));
  }
}
