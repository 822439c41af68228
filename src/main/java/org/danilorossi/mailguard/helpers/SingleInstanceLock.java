package org.danilorossi.mailguard.helpers;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;

/** Impedisce a due scheduler di girare sullo stesso data/ (doppio conteggio delle statistiche). */
@Log
public final class SingleInstanceLock implements AutoCloseable {

  /** Nome predefinito del lockfile sotto data/. */
  public static final String LOCK_FILENAME = "mailguard.lock";

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Path lockPath;
  private final FileChannel channel;
  private final FileLock lock;

  private SingleInstanceLock(
      @NonNull final Path lockPath, @NonNull final FileChannel channel, @NonNull final FileLock lock) {
    this.lockPath = lockPath;
    this.channel = channel;
    this.lock = lock;
  }

  /** Lock esclusivo non bloccante sul percorso predefinito. */
  public static SingleInstanceLock acquire() throws IOException {
    return acquire(defaultLockPath());
  }

  /** Prova ad acquisire un lock esclusivo (non bloccante) su un percorso specifico. */
  public static SingleInstanceLock acquire(@NonNull final Path lockPath) throws IOException {
    val ch =
        FileChannel.open(
            lockPath, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
    final FileLock fl;
    try {
      fl = ch.tryLock(); // non-blocking
    } catch (OverlappingFileLockException ex) {
      // lock già tenuto da questa stessa JVM
      ch.close();
      throw new AlreadyRunningException(LangUtils.s("Lock already held in this process: {}", lockPath));
    } catch (IOException | RuntimeException ex) {
      ch.close();
      throw ex;
    }
    if (fl == null) {
      ch.close();
      throw new AlreadyRunningException(LangUtils.s("Lock held by another process: {}", lockPath));
    }

    // Lock ottenuto: nota informativa per chi trova il file
    ch.truncate(0);
    ch.write(ByteBuffer.wrap(buildLockNote().getBytes(StandardCharsets.UTF_8)));
    ch.force(true);
    return new SingleInstanceLock(lockPath, ch, fl);
  }

  /** Percorso predefinito del lockfile sotto data/. */
  public static Path defaultLockPath() {
    // Consente override con -Dmailguard.lock=nomefile.lock (sempre dentro data/)
    val override = System.getProperty("mailguard.lock", "");
    return FileSystemUtils.dataFile(!LangUtils.empty(override) ? override : LOCK_FILENAME);
  }

  private static String buildLockNote() {
    return LangUtils.s(
        "pid={} startedAt={} cmd={}",
        ProcessHandle.current().pid(),
        Instant.now(),
        ManagementFactory.getRuntimeMXBean().getInputArguments());
  }

  @Override
  public void close() {
    try {
      lock.release();
      channel.close();
      Files.deleteIfExists(lockPath);
    } catch (IOException ex) {
      LangUtils.warn(log, "Rilascio lock {} incompleto: {}", lockPath, LangUtils.exMsg(ex));
    }
  }

  /** Throw quando è già in esecuzione un'altra istanza. */
  public static final class AlreadyRunningException extends IOException {
    public AlreadyRunningException(final String msg) {
      super(msg);
    }
  }
}
