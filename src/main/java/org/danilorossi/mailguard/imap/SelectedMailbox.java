package org.danilorossi.mailguard.imap;

import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessageRemovedException;
import jakarta.mail.MessagingException;
import jakarta.mail.UIDFolder;
import jakarta.mail.search.AndTerm;
import jakarta.mail.search.ComparisonTerm;
import jakarta.mail.search.FlagTerm;
import jakarta.mail.search.ReceivedDateTerm;
import jakarta.mail.search.SearchTerm;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.helpers.Deadline;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.helpers.MailUtils;
import org.danilorossi.mailguard.model.RawMessage;
import org.danilorossi.mailguard.model.RetrievalStrategy;

/** Cartella selezionata: l'unico punto da cui si cerca e si scarica. */
@Log
public final class SelectedMailbox {

  static {
    LogConfigurator.configLog(log);
  }

  private final MailboxConnection connection;
  private final Folder folder;
  private final Clock clock;

  SelectedMailbox(final MailboxConnection connection, final Folder folder, final Clock clock) {
    this.connection = connection;
    this.folder = folder;
    this.clock = clock;
  }

  private long accountId() {
    return connection.getAccount().getId();
  }

  public List<RawMessage> fetch(@NonNull final RetrievalStrategy strategy, final int limit)
      throws FetchException {
    return fetch(strategy, limit, Deadline.none());
  }

  /**
   * Applica la strategia e scarica il batch. Un errore di rete interrompe tutto il batch
   * (FetchException); un messaggio espunto nel frattempo viene solo saltato.
   */
  public List<RawMessage> fetch(
      @NonNull final RetrievalStrategy strategy, final int limit, @NonNull final Deadline deadline)
      throws FetchException {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0: " + limit);
    connection.requireSelected(folder);

    final List<Message> picked;
    try {
      picked =
          switch (strategy.getKind()) {
            case ALL -> BatchWindow.last(Arrays.asList(folder.getMessages()), limit);
            case RECENT -> BatchWindow.last(search(since(strategy.getDaysBack())), limit);
            case DEFAULT -> BatchWindow.hybrid(
                search(new AndTerm(seen(false), since(strategy.getDaysBack()))),
                search(new AndTerm(seen(true), since(strategy.getReadDaysBack()))),
                limit);
          };
      prefetch(picked);
    } catch (MessagingException ex) {
      throw new FetchException(
          accountId(), LangUtils.s("Search {} failed: {}", strategy, LangUtils.exMsg(ex)), ex);
    }
    LangUtils.info(
        log,
        "{}: {} messaggi selezionati con strategia {} (limite {})",
        connection.getAccount().getAddress(),
        picked.size(),
        strategy,
        limit);

    val out = new ArrayList<RawMessage>(picked.size());
    for (val m : picked) {
      deadline.check();
      String id = null;
      try {
        id = messageId(m);
        val received = m.getReceivedDate();
        out.add(
            new RawMessage(
                id, MailUtils.toRfc822Bytes(m), received == null ? null : received.getTime()));
      } catch (MessageRemovedException ex) {
        LangUtils.debug(log, "Messaggio {} espunto durante il fetch, salto", id);
      } catch (MessagingException | IOException ex) {
        throw new FetchException(
            accountId(), id, LangUtils.s("Retrieve of {} failed: {}", id, LangUtils.exMsg(ex)), ex);
      }
    }
    return out;
  }

  /** Numero di messaggi che soddisfano il criterio, senza scaricarli. */
  public int count(@NonNull final SearchTerm term) throws FetchException {
    connection.requireSelected(folder);
    try {
      return search(term).size();
    } catch (MessagingException ex) {
      throw new FetchException(accountId(), "Search failed: " + LangUtils.exMsg(ex), ex);
    }
  }

  public int totalMessages() throws FetchException {
    connection.requireSelected(folder);
    try {
      return folder.getMessageCount();
    } catch (MessagingException ex) {
      throw new FetchException(accountId(), "Message count failed: " + LangUtils.exMsg(ex), ex);
    }
  }

  /* =================== Helpers =================== */

  private List<Message> search(final SearchTerm term) throws MessagingException {
    val found = folder.search(term);
    return found == null ? List.of() : Arrays.asList(found);
  }

  ReceivedDateTerm since(final int daysBack) {
    val from = clock.instant().minus(Duration.ofDays(daysBack));
    return new ReceivedDateTerm(ComparisonTerm.GE, Date.from(from));
  }

  static FlagTerm seen(final boolean seen) {
    return new FlagTerm(new Flags(Flags.Flag.SEEN), seen);
  }

  private void prefetch(final List<Message> messages) throws MessagingException {
    if (messages.isEmpty()) return;
    // Prefetch per ridurre roundtrip
    val fp = new FetchProfile();
    fp.add(UIDFolder.FetchProfileItem.UID);
    fp.add(FetchProfile.Item.ENVELOPE);
    folder.fetch(messages.toArray(new Message[0]), fp);
  }

  /** UID se la cartella li supporta, altrimenti numero di sequenza. */
  private String messageId(final Message m) throws MessagingException {
    if (folder instanceof UIDFolder uf) {
      val uid = uf.getUID(m);
      if (uid > 0) return String.valueOf(uid);
    }
    return String.valueOf(m.getMessageNumber());
  }
}
