package org.danilorossi.mailguard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DecodedMessage {
  String messageId;
  @Builder.Default String subject = "";
  @Builder.Default String sender = "";

  /** Dominio del mittente in minuscolo, vuoto se non ricavabile. */
  @Builder.Default String senderDomain = "";

  @Builder.Default String recipient = "";
  @Builder.Default String body = "";

  /** Dimensione del messaggio grezzo in byte. */
  long size;

  boolean hasAttachments;
  Long receivedAtEpochMs;
}
