package org.danilorossi.mailguard.imap;

import jakarta.mail.MessagingException;
import lombok.Getter;

/** Apertura o autenticazione fallita: fatale per la passata, non per lo scheduler. */
public class ConnectionException extends MessagingException {

  @Getter private final long accountId;
  @Getter private final boolean authenticationFailure;

  public ConnectionException(final long accountId, final String reason) {
    this(accountId, reason, null, false);
  }

  public ConnectionException(
      final long accountId,
      final String reason,
      final Exception cause,
      final boolean authenticationFailure) {
    super(reason, cause);
    this.accountId = accountId;
    this.authenticationFailure = authenticationFailure;
  }
}
