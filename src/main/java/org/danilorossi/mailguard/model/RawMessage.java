package org.danilorossi.mailguard.model;

import lombok.NonNull;
import lombok.Value;

/** Messaggio appena scaricato: identificativo lato server + byte RFC822 non decodificati. */
@Value
public class RawMessage {
  @NonNull String messageId;
  @NonNull byte[] payload;

  /** INTERNALDATE riportata dal protocollo, se presente. */
  Long receivedAtEpochMs;
}
