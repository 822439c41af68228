package org.danilorossi.mailguard.analysis;

import java.util.Locale;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.model.DecodedMessage;
import org.danilorossi.mailguard.model.FeatureVector;

/**
 * Calcola il vettore di feature di un messaggio. Funzione pura e totale: input vuoto produce
 * tutti zeri/false.
 */
public class FeatureExtractor {

  public FeatureVector extract(@NonNull final DecodedMessage msg) {
    val subject = LangUtils.nullToEmpty(msg.getSubject());
    val body = LangUtils.nullToEmpty(msg.getBody());
    val text = combine(subject, body);
    val lower = text.toLowerCase(Locale.ROOT);

    return FeatureVector.builder()
        .subjectLength(subject.length())
        .contentLength(body.length())
        .totalLength(text.length())
        .uppercaseRatio(uppercaseRatio(text))
        .exclamationCount(count(text, '!'))
        .questionCount(count(text, '?'))
        .dollarCount(count(text, '$'))
        .urgentWordCount(SpamLexicon.countPresent(lower, SpamLexicon.URGENT_WORDS))
        .spamWordCount(SpamLexicon.countPresent(lower, SpamLexicon.SPAM_WORDS))
        .suspiciousSenderDomain(SpamLexicon.isSuspiciousDomain(msg.getSenderDomain()))
        .linkCount(countLinks(body))
        .hasAttachments(msg.isHasAttachments())
        .build();
  }

  static String combine(final String subject, final String body) {
    if (subject.isEmpty()) return body;
    if (body.isEmpty()) return subject;
    return subject + " " + body;
  }

  static double uppercaseRatio(final String text) {
    if (text.isEmpty()) return 0.0;
    long upper = text.chars().filter(Character::isUpperCase).count();
    return (double) upper / text.length();
  }

  private static int count(final String text, final char c) {
    int n = 0;
    for (int i = 0; i < text.length(); i++) if (text.charAt(i) == c) n++;
    return n;
  }

  private static int countLinks(final String body) {
    val m = SpamLexicon.URL.matcher(body);
    int n = 0;
    while (m.find()) n++;
    return n;
  }
}
