package org.danilorossi.mailguard.helpers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemUtilsTest {

  @TempDir Path dir;

  @AfterEach
  void clearHome() {
    System.clearProperty("mailguard.home");
  }

  @Test
  @DisplayName("-Dmailguard.home decide la cartella data; i nomi restano dentro")
  void dataFileUnderHome() {
    assumeTrue(System.getenv("DEV") == null);
    System.setProperty("mailguard.home", dir.resolve("home").toString());

    Path log = FileSystemUtils.dataFile("application.log");

    assertThat(log.getParent()).isEqualTo(dir.resolve("home").toAbsolutePath().normalize());
    assertThat(Files.isDirectory(log.getParent())).isTrue();
    assertThatThrownBy(() -> FileSystemUtils.dataFile("../escape.lock"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Scrittura atomica: sostituisce il contenuto e non lascia temporanei")
  void atomicWriteReplaces() throws Exception {
    Path file = dir.resolve("nested").resolve("state.json");

    FileSystemUtils.writeUtf8Atomic(file, "[1]");
    FileSystemUtils.writeUtf8Atomic(file, "[1,2,\"è\"]");

    assertThat(FileSystemUtils.readUtf8(file)).isEqualTo("[1,2,\"è\"]");
    assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo("[1,2,\"è\"]");
    try (Stream<Path> files = Files.list(file.getParent())) {
      assertThat(files).containsExactly(file);
    }
  }

  @Test
  @DisplayName("Scrittura su un percorso occupato da una cartella: errore, cartella intatta")
  void atomicWriteOntoDirectoryFails() throws Exception {
    Path target = dir.resolve("busy.json");
    Files.createDirectories(target);
    Files.writeString(target.resolve("child"), "x");

    assertThatThrownBy(() -> FileSystemUtils.writeUtf8Atomic(target, "[]"))
        .isInstanceOf(UncheckedIOException.class);
    assertThat(Files.isDirectory(target)).isTrue();
    try (Stream<Path> files = Files.list(dir)) {
      assertThat(files).containsExactly(target);
    }
  }
}
