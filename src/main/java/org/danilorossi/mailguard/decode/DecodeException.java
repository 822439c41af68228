package org.danilorossi.mailguard.decode;

import jakarta.mail.MessagingException;
import lombok.Getter;

/** Un singolo messaggio illeggibile: si salta, il batch continua. */
public class DecodeException extends MessagingException {

  @Getter private final String messageId;

  public DecodeException(final String messageId, final String reason) {
    super(reason);
    this.messageId = messageId;
  }

  public DecodeException(final String messageId, final String reason, final Exception cause) {
    super(reason, cause);
    this.messageId = messageId;
  }
}
