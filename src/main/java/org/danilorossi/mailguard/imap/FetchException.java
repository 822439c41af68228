package org.danilorossi.mailguard.imap;

import jakarta.mail.MessagingException;
import lombok.Getter;

/** Select/search/retrieve fallito a metà batch: interrompe il resto del batch dell'account. */
public class FetchException extends MessagingException {

  @Getter private final long accountId;

  /** Messaggio in lavorazione al momento dell'errore, null se l'errore è nella search. */
  @Getter private final String messageId;

  public FetchException(final long accountId, final String reason, final Exception cause) {
    this(accountId, null, reason, cause);
  }

  public FetchException(
      final long accountId, final String messageId, final String reason, final Exception cause) {
    super(reason, cause);
    this.accountId = accountId;
    this.messageId = messageId;
  }
}
