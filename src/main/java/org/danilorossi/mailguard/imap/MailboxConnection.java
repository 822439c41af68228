package org.danilorossi.mailguard.imap;

import jakarta.mail.Folder;
import jakarta.mail.MessagingException;
import jakarta.mail.Store;
import java.time.Clock;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.helpers.MailUtils;
import org.danilorossi.mailguard.model.Account;

/**
 * Connessione autenticata a una casella, posseduta in esclusiva dalla passata che l'ha aperta.
 * Si ottiene solo da {@link MailboxClient#open} (già READY); search e fetch sono possibili solo
 * tramite il {@link SelectedMailbox} restituito da {@link #select}. close() è idempotente.
 */
@Log
public final class MailboxConnection implements AutoCloseable {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Account account;
  private final Store store;
  private final Clock clock;

  @Getter private ConnectionState state = ConnectionState.DISCONNECTED;
  private Folder selected;

  MailboxConnection(@NonNull final Account account, @NonNull final Store store, final Clock clock) {
    this.account = account;
    this.store = store;
    this.clock = clock;
  }

  /** DISCONNECTED → AUTHENTICATING → READY; qualunque errore porta a CLOSED. */
  synchronized void authenticate() throws MessagingException {
    if (state != ConnectionState.DISCONNECTED)
      throw new IllegalStateException("authenticate() on " + state + " connection");
    state = ConnectionState.AUTHENTICATING;
    try {
      store.connect(account.getHost(), account.getPort(), account.getAddress(), account.getPassword());
      state = ConnectionState.READY;
    } catch (MessagingException | RuntimeException ex) {
      close();
      throw ex;
    }
  }

  /** Apre la cartella in sola lettura (READY/SELECTED → SELECTED). */
  public synchronized SelectedMailbox select(@NonNull final String folderName)
      throws FetchException {
    if (!state.canSelect())
      throw new IllegalStateException("select() on " + state + " connection");
    try {
      if (selected != null && selected.isOpen()) {
        if (folderName.equals(selected.getFullName()))
          return new SelectedMailbox(this, selected, clock);
        selected.close(false);
      }
      val folder = store.getFolder(folderName);
      MailUtils.ensureOpenRO(folder);
      selected = folder;
      state = ConnectionState.SELECTED;
      return new SelectedMailbox(this, folder, clock);
    } catch (MessagingException ex) {
      throw new FetchException(
          account.getId(), LangUtils.s("Cannot select '{}': {}", folderName, LangUtils.exMsg(ex)), ex);
    }
  }

  synchronized void requireSelected(final Folder folder) {
    if (state != ConnectionState.SELECTED || selected != folder)
      throw new IllegalStateException("fetch() on " + state + " connection");
  }

  public synchronized boolean isClosed() {
    return state == ConnectionState.CLOSED;
  }

  /** Sicura anche dopo un fallimento parziale; la seconda chiamata non fa nulla. */
  @Override
  public synchronized void close() {
    if (state == ConnectionState.CLOSED) return;
    state = ConnectionState.CLOSED;
    if (selected != null) {
      try {
        if (selected.isOpen()) selected.close(false);
      } catch (MessagingException | IllegalStateException ex) {
        LangUtils.debug(log, "Chiusura cartella ({}): {}", account.getAddress(), LangUtils.exMsg(ex));
      }
      selected = null;
    }
    try {
      if (store.isConnected()) store.close();
    } catch (MessagingException ex) {
      LangUtils.warn(log, "Chiusura connessione {} fallita: {}", account.getAddress(), LangUtils.exMsg(ex));
    }
    LangUtils.debug(log, "Connessione IMAP chiusa: {}", account.getAddress());
  }
}
