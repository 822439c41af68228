package org.danilorossi.mailguard.analysis;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.experimental.UtilityClass;
import lombok.val;

/** Liste fisse usate dall'estrattore. Cambiarle altera i punteggi storici. */
@UtilityClass
public class SpamLexicon {

  public static final List<String> URGENT_WORDS =
      List.of("urgente", "urgent", "important", "importante", "actúa", "actua");

  public static final List<String> SPAM_WORDS =
      List.of("gratis", "free", "gana", "win", "dinero", "money", "oferta", "offer");

  public static final Set<String> SUSPICIOUS_DOMAINS =
      Set.of(
          "spam.com",
          "malware.com",
          "virus.com",
          "fake.com",
          "suspicious.com",
          "scam.com",
          "phishing.com");

  public static final Pattern URL =
      Pattern.compile("https?://(?:[a-zA-Z0-9$\\-_@.&+!*(),/?=#~;:']|%[0-9a-fA-F]{2})+");

  /** Numero di voci della lista presenti come sottostringa (testo già in minuscolo). */
  public static int countPresent(final String lowerText, final List<String> words) {
    int n = 0;
    for (val w : words) if (lowerText.contains(w)) n++;
    return n;
  }

  /** Dominio in denylist o sottodominio di uno in denylist. */
  public static boolean isSuspiciousDomain(final String domain) {
    if (domain == null || domain.isBlank()) return false;
    val d = domain.trim().toLowerCase(Locale.ROOT);
    if (SUSPICIOUS_DOMAINS.contains(d)) return true;
    for (val bad : SUSPICIOUS_DOMAINS) if (d.endsWith("." + bad)) return true;
    return false;
  }
}
