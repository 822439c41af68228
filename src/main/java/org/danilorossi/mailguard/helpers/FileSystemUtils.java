package org.danilorossi.mailguard.helpers;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Percorsi sotto data/ e I/O di testo per i file JSON, il log e il lockfile.
 *
 * <p>La cartella data/ si risolve, nell'ordine: variabile DEV (cwd/data), proprietà {@code
 * -Dmailguard.home}, cartella dell'eseguibile, cwd/data. Viene ricalcolata a ogni chiamata.
 */
@UtilityClass
public class FileSystemUtils {

  private static final String PROP_HOME = "mailguard.home";
  private static final String DIR_DATA = "data";

  public static Path getDataDir() {
    val dir =
        devDataDir()
            .or(FileSystemUtils::homeProperty)
            .or(FileSystemUtils::besideExecutable)
            .orElseGet(() -> absolute(Paths.get(DIR_DATA)));
    return ensureDir(dir);
  }

  /** File (log, lock) direttamente sotto data/; il nome non può uscire dalla cartella. */
  public static Path dataFile(@NonNull final String name) {
    val dir = getDataDir();
    val file = dir.resolve(name).normalize();
    if (!dir.equals(file.getParent()))
      throw new IllegalArgumentException(LangUtils.s("Not a plain file name: {}", name));
    return file;
  }

  private static Optional<Path> devDataDir() {
    return LangUtils.empty(System.getenv("DEV"))
        ? Optional.empty()
        : Optional.of(absolute(Paths.get(DIR_DATA)));
  }

  private static Optional<Path> homeProperty() {
    val home = System.getProperty(PROP_HOME);
    return LangUtils.empty(home) ? Optional.empty() : Optional.of(absolute(Paths.get(home)));
  }

  /** jar: cartella che lo contiene; target/classes: target; altrimenti nessuna indicazione. */
  private static Optional<Path> besideExecutable() {
    try {
      val source = FileSystemUtils.class.getProtectionDomain().getCodeSource();
      if (source == null) return Optional.empty();
      val location = absolute(Paths.get(source.getLocation().toURI()));
      val base =
          Files.isRegularFile(location) || location.endsWith("classes")
              ? location.getParent()
              : location;
      return Optional.ofNullable(base).map(b -> b.resolve(DIR_DATA));
    } catch (URISyntaxException | SecurityException ex) {
      System.err.println(LangUtils.s("Posizione eseguibile non risolta: {}", LangUtils.exMsg(ex)));
      return Optional.empty();
    }
  }

  private static Path absolute(final Path p) {
    return p.toAbsolutePath().normalize();
  }

  public static Path ensureDir(@NonNull final Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot create directory: {}", dir), e);
    }
    if (!Files.isDirectory(dir))
      throw new UncheckedIOException(
          new IOException(LangUtils.s("Path exists but is not a directory: {}", dir)));
    return dir;
  }

  /**
   * Sostituisce il contenuto di {@code target}: il testo va su un file temporaneo accanto, forzato
   * su disco, poi rinominato sopra il vecchio. Un lettore vede il file vecchio o quello nuovo.
   */
  public static void writeUtf8Atomic(@NonNull final Path target, @NonNull final String content) {
    val file = absolute(target);
    val dir = ensureDir(file.getParent());
    Path tmp = null;
    try {
      tmp = Files.createTempFile(dir, file.getFileName() + "-", ".tmp");
      try (val ch = FileChannel.open(tmp, WRITE, TRUNCATE_EXISTING)) {
        val buf = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
        while (buf.hasRemaining()) ch.write(buf);
        ch.force(true);
      }
      try {
        Files.move(tmp, file, REPLACE_EXISTING, ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException notAtomic) {
        Files.move(tmp, file, REPLACE_EXISTING);
      }
      tmp = null;
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot write file: {}", file), e);
    } finally {
      if (tmp != null) deleteQuietly(tmp);
    }
  }

  public static String readUtf8(@NonNull final Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(LangUtils.s("Cannot read file: {}", file), e);
    }
  }

  private static void deleteQuietly(final Path tmp) {
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      System.err.println(LangUtils.s("Temporaneo non rimosso {}: {}", tmp, LangUtils.exMsg(e)));
    }
  }
}
