package org.danilorossi.mailguard.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.val;

/**
 * Politica che decide quale sottoinsieme della casella restituisce un fetch. Scelta a ogni
 * invocazione, non per account.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RetrievalStrategy {

  public enum Kind {
    ALL, // tutta la casella, ultimi N
    RECENT, // ricevuti negli ultimi daysBack giorni, ultimi N
    DEFAULT // ibrida: non letti recenti + letti recentissimi
  }

  Kind kind;

  /** RECENT: finestra in giorni. DEFAULT: finestra dei non letti. */
  int daysBack;

  /** DEFAULT: finestra dei letti. */
  int readDaysBack;

  public static RetrievalStrategy all() {
    return new RetrievalStrategy(Kind.ALL, 0, 0);
  }

  public static RetrievalStrategy recent(final int daysBack) {
    if (daysBack <= 0) throw new IllegalArgumentException("daysBack must be > 0");
    return new RetrievalStrategy(Kind.RECENT, daysBack, 0);
  }

  public static RetrievalStrategy hybrid(final int unreadDaysBack, final int readDaysBack) {
    if (unreadDaysBack <= 0 || readDaysBack <= 0)
      throw new IllegalArgumentException("day windows must be > 0");
    return new RetrievalStrategy(Kind.DEFAULT, unreadDaysBack, readDaysBack);
  }

  public static Kind parseKind(final String s) {
    if (s == null) return null;
    val n = s.trim().replace('-', '_').toUpperCase();
    return switch (n) {
      case "ALL", "FULL" -> Kind.ALL;
      case "RECENT", "SINCE" -> Kind.RECENT;
      case "DEFAULT", "HYBRID" -> Kind.DEFAULT;
      default -> null;
    };
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ALL -> "ALL";
      case RECENT -> "RECENT(" + daysBack + "d)";
      case DEFAULT -> "DEFAULT(unread " + daysBack + "d, read " + readDaysBack + "d)";
    };
  }
}
