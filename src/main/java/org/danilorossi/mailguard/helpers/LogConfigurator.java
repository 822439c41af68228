package org.danilorossi.mailguard.helpers;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Configurazione centralizzata di java.util.logging: un solo handler condiviso (file a rotazione
 * sotto data/, console come ripiego) e livello letto dalla property LOG_LEVEL.
 */
@UtilityClass
public class LogConfigurator {

  protected static final String LOG_FILE = "application.log";
  private static final Handler LOG_HANDLER;
  private static final AtomicBoolean ONCE = new AtomicBoolean(false);

  // nomi "amichevoli" in stile slf4j
  private static final Map<String, Level> ALIASES =
      Map.of("DEBUG", Level.FINE, "TRACE", Level.FINEST, "WARN", Level.WARNING, "ERROR", Level.SEVERE);

  static {
    Handler handler;
    try {
      handler =
          new FileHandler(
              FileSystemUtils.dataFile(LOG_FILE).toString(),
              1_000_000,
              5,
              true); // 1MB, 5 file
    } catch (IOException | RuntimeException ex) {
      System.err.println(
          LangUtils.s("Impossibile aprire il file di log, uso la console: {}", LangUtils.exMsg(ex)));
      handler = new ConsoleHandler();
    }
    handler.setFormatter(new SimpleFormatter());
    try {
      handler.setEncoding("UTF-8");
    } catch (IOException ex) {
      System.err.println(LangUtils.s("Encoding UTF-8 non applicabile: {}", LangUtils.exMsg(ex)));
    }

    LOG_HANDLER = handler;
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOG_HANDLER.flush();
                  LOG_HANDLER.close();
                },
                "log-handler-shutdown"));
  }

  public static void configLog(@NonNull final Logger logger) {
    // rimuove eventuali handler già presenti
    for (val h : logger.getHandlers()) logger.removeHandler(h);
    logger.addHandler(LOG_HANDLER);
    logger.setLevel(resolveLogLevel(System.getProperty("LOG_LEVEL", "INFO")));
    logger.setUseParentHandlers(false); // Disabilita console logging predefinito
    if (ONCE.compareAndSet(false, true))
      LogManager.getLogManager().getLogger("").setLevel(logger.getLevel());
  }

  static Level resolveLogLevel(@NonNull final String levelName) {
    val upper = levelName.trim().toUpperCase();
    if (ALIASES.containsKey(upper)) return ALIASES.get(upper);
    try {
      return Level.parse(upper);
    } catch (IllegalArgumentException e) {
      return Level.INFO;
    }
  }
}
