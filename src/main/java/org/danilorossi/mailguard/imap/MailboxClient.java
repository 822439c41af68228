package org.danilorossi.mailguard.imap;

import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.search.AndTerm;
import java.time.Clock;
import java.util.List;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.helpers.Deadline;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.model.Account;
import org.danilorossi.mailguard.model.MailboxDiagnosis;
import org.danilorossi.mailguard.model.MonitorConfig;
import org.danilorossi.mailguard.model.RawMessage;
import org.danilorossi.mailguard.model.RetrievalStrategy;

/**
 * Client IMAP: apre, interroga e chiude una casella. Nessun retry interno: un'autenticazione
 * fallita chiude il tentativo e il prossimo tick riproverà da capo.
 */
@Log
public class MailboxClient {

  static {
    LogConfigurator.configLog(log);
  }

  public static final String DEFAULT_FOLDER = "INBOX";

  private final StoreFactory storeFactory;
  private final Clock clock;

  public MailboxClient() {
    this(StoreFactory.jakarta(), Clock.systemUTC());
  }

  public MailboxClient(@NonNull final StoreFactory storeFactory, @NonNull final Clock clock) {
    this.storeFactory = storeFactory;
    this.clock = clock;
  }

  /** Connette e autentica; la connessione restituita è READY. */
  public MailboxConnection open(@NonNull final Account account) throws ConnectionException {
    if (!account.isImap())
      throw new ConnectionException(
          account.getId(), LangUtils.s("Unsupported protocol: {}", account.getProtocol()));
    try {
      account.validate();
    } catch (IllegalArgumentException ex) {
      throw new ConnectionException(account.getId(), ex.getMessage(), ex, false);
    }

    final MailboxConnection conn;
    try {
      conn = new MailboxConnection(account, storeFactory.create(account), clock);
    } catch (MessagingException ex) {
      throw new ConnectionException(
          account.getId(), "Cannot create mail store: " + LangUtils.exMsg(ex), ex, false);
    }

    try {
      conn.authenticate();
    } catch (AuthenticationFailedException ex) {
      throw new ConnectionException(
          account.getId(),
          LangUtils.s("Authentication failed for {}: {}", account.getAddress(), LangUtils.exMsg(ex)),
          ex,
          true);
    } catch (MessagingException | RuntimeException ex) {
      throw new ConnectionException(
          account.getId(),
          LangUtils.s(
              "Cannot connect to {}:{}: {}",
              account.getHost(),
              account.getPort(),
              LangUtils.rootCauseMsg(ex)),
          ex,
          false);
    }
    LangUtils.info(log, "Connessione IMAP riuscita: {}", account.getAddress());
    return conn;
  }

  public List<RawMessage> fetch(
      @NonNull final MailboxConnection conn,
      @NonNull final RetrievalStrategy strategy,
      final int limit)
      throws FetchException {
    return fetch(conn, DEFAULT_FOLDER, strategy, limit, Deadline.none());
  }

  public List<RawMessage> fetch(
      @NonNull final MailboxConnection conn,
      @NonNull final String folder,
      @NonNull final RetrievalStrategy strategy,
      final int limit,
      @NonNull final Deadline deadline)
      throws FetchException {
    return conn.select(folder).fetch(strategy, limit, deadline);
  }

  /** null-safe e idempotente. */
  public void close(final MailboxConnection conn) {
    if (conn != null) conn.close();
  }

  /** Conta non letti e letti recenti senza scaricare nulla. */
  public MailboxDiagnosis diagnose(@NonNull final Account account, @NonNull final MonitorConfig config)
      throws ConnectionException, FetchException {
    try (val conn = open(account)) {
      val box = conn.select(config.getMailboxFolder());
      return MailboxDiagnosis.builder()
          .accountId(account.getId())
          .address(account.getAddress())
          .totalMessages(box.totalMessages())
          .unreadRecent(
              box.count(
                  new AndTerm(SelectedMailbox.seen(false), box.since(config.getUnreadDaysBack()))))
          .readRecent(
              box.count(
                  new AndTerm(SelectedMailbox.seen(true), box.since(config.getReadDaysBack()))))
          .lastCheckAtEpochMs(account.getLastCheckAtEpochMs())
          .totalChecked(account.getTotalChecked())
          .totalSpam(account.getTotalSpam())
          .build();
    }
  }
}
