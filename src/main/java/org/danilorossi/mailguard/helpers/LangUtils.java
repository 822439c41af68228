package org.danilorossi.mailguard.helpers;

import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.NonNull;
import lombok.experimental.UtilityClass;

@UtilityClass
public class LangUtils {

  public static boolean empty(final String s) {
    return s == null || s.isBlank();
  }

  /** null-safe: null diventa stringa vuota, altrimenti trim. */
  public static String nz(final String s) {
    return s == null ? "" : s.trim();
  }

  public static String nullToEmpty(final String s) {
    return s == null ? "" : s;
  }

  public static String nz(final Object o) {
    return o == null ? "" : nz(String.valueOf(o));
  }

  public static long parseLongOr(final String s, final long def) {
    try {
      return Long.parseLong(s == null ? "" : s.trim());
    } catch (Exception ignored) {
      return def;
    }
  }

  public static String abbreviate(final String s, final int max) {
    if (s == null) return "";
    return s.length() <= max ? s : s.substring(0, Math.max(0, max)) + "...";
  }

  public static String exMsg(@NonNull final Throwable t) {
    return empty(t.getMessage()) ? t.toString() : t.getMessage();
  }

  public static String rootCauseMsg(final Throwable t) {
    if (t == null) return "Null Throwable"; // Errore raro ma possibile
    if (t.getCause() != null) return rootCauseMsg(t.getCause());
    return exMsg(t);
  }

  public static String s(final String format, final Object... values) {
    if (values == null || values.length == 0) return nz(format);
    return String.format(format.replace("%", "%%").replace("{}", "%s"), values);
  }

  public static void l(Logger logger, Level level, String format, Throwable t, Object... values) {
    if (logger == null || level == null) return;
    if (!logger.isLoggable(level)) return;
    if (t == null) logger.log(level, s(format, values));
    else logger.log(level, s(format, values), t);
  }

  public static void l(Logger logger, Level level, String format, Object... values) {
    l(logger, level, format, null, values);
  }

  public static void info(Logger logger, String format, Object... values) {
    l(logger, Level.INFO, format, values);
  }

  public static void warn(Logger logger, String format, Object... values) {
    l(logger, Level.WARNING, format, values);
  }

  public static void err(Logger logger, String format, Object... values) {
    l(logger, Level.SEVERE, format, values);
  }

  public static void debug(Logger logger, String format, Object... values) {
    l(logger, Level.FINE, format, values);
  }

  public static void warn(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.WARNING, format, t, values);
  }

  public static void err(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.SEVERE, format, t, values);
  }

  public static void debug(Logger logger, String format, Throwable t, Object... values) {
    l(logger, Level.FINE, format, t, values);
  }
}
