package org.danilorossi.mailguard.imap;

import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;
import lombok.experimental.UtilityClass;
import lombok.val;

/**
 * Selezione del batch nell'ordine restituito dal server (crescente per sequenza/UID, quindi gli
 * ultimi sono i più recenti).
 */
@UtilityClass
public class BatchWindow {

  /** Gli ultimi {@code limit} elementi, nell'ordine originale. */
  public static <T> List<T> last(@NonNull final List<T> items, final int limit) {
    if (limit <= 0) return List.of();
    if (items.size() <= limit) return List.copyOf(items);
    return List.copyOf(items.subList(items.size() - limit, items.size()));
  }

  /**
   * Strategia ibrida: prima i non letti, poi i letti. I letti non superano mai limit/2 né lo
   * spazio lasciato libero dai non letti; il risultato è troncato agli ultimi {@code limit}.
   */
  public static <T> List<T> hybrid(
      @NonNull final List<T> unread, @NonNull final List<T> read, final int limit) {
    if (limit <= 0) return List.of();
    val unreadPart = last(unread, limit);
    val readCap = Math.min(limit / 2, Math.max(0, limit - unreadPart.size()));
    val out = new ArrayList<T>(unreadPart);
    out.addAll(last(read, readCap));
    return last(out, limit);
  }
}
