package org.danilorossi.mailguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

/**
 * Messaggio analizzato e persistito. Al massimo uno per coppia (accountId, messageId); dopo la
 * creazione cambiano solo spam/confidence tramite riclassificazione manuale.
 */
@Data
@Builder
@With
@NoArgsConstructor
@AllArgsConstructor
public class StoredEmail {

  /** Chiave tecnica assegnata dallo store (0 finché non salvato). */
  private long id;

  private long accountId;
  private String messageId;

  private String subject;
  private String sender;
  private String senderDomain;
  private String recipient;
  private String body;
  private long size;
  private boolean hasAttachments;
  private Long receivedAtEpochMs;

  private FeatureVector features;

  private double spamScore;
  private boolean spam;
  private double confidence;

  private long processedAtEpochMs;

  public String key() {
    return keyOf(accountId, messageId);
  }

  public static String keyOf(final long accountId, final String messageId) {
    return accountId + ":" + (messageId == null ? "" : messageId);
  }

  public static StoredEmail of(
      final long accountId,
      final DecodedMessage msg,
      final FeatureVector features,
      final ClassificationResult result,
      final long processedAtEpochMs) {
    return StoredEmail.builder()
        .accountId(accountId)
        .messageId(msg.getMessageId())
        .subject(msg.getSubject())
        .sender(msg.getSender())
        .senderDomain(msg.getSenderDomain())
        .recipient(msg.getRecipient())
        .body(msg.getBody())
        .size(msg.getSize())
        .hasAttachments(msg.isHasAttachments())
        .receivedAtEpochMs(msg.getReceivedAtEpochMs())
        .features(features)
        .spamScore(result.getSpamScore())
        .spam(result.isSpam())
        .confidence(result.getConfidence())
        .processedAtEpochMs(processedAtEpochMs)
        .build();
  }
}
