package org.danilorossi.mailguard.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.Callable;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.analysis.FeatureExtractor;
import org.danilorossi.mailguard.analysis.SpamScorer;
import org.danilorossi.mailguard.db.JsonDb;
import org.danilorossi.mailguard.decode.DecodeException;
import org.danilorossi.mailguard.decode.MessageDecoder;
import org.danilorossi.mailguard.helpers.Deadline;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.imap.ConnectionException;
import org.danilorossi.mailguard.imap.FetchException;
import org.danilorossi.mailguard.imap.MailboxClient;
import org.danilorossi.mailguard.imap.MailboxConnection;
import org.danilorossi.mailguard.model.Account;
import org.danilorossi.mailguard.model.AccountRunReport;
import org.danilorossi.mailguard.model.AccountRunReport.Outcome;
import org.danilorossi.mailguard.model.RetrievalStrategy;
import org.danilorossi.mailguard.model.SaveOutcome;
import org.danilorossi.mailguard.model.StoredEmail;

/**
 * Una passata su un account: fetch → decode → extract → score → store, in sequenza.
 *
 * <p>I messaggi analizzati restano in memoria fino alla fine; salvataggio e contatori avvengono
 * insieme solo se la passata arriva in fondo entro il budget. Un errore o un timeout lasciano
 * lastCheckAt e contatori invariati, così il tick successivo riprova.
 */
@Log
@Builder
public class AccountPass implements Callable<AccountRunReport> {

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final long accountId;
  @Getter @NonNull private final RetrievalStrategy strategy;
  @NonNull private final String folder;
  @NonNull private final Duration timeout;

  @NonNull private final JsonDb db;
  @NonNull private final MailboxClient client;
  @NonNull private final MessageDecoder decoder;
  @NonNull private final FeatureExtractor extractor;
  @NonNull private final SpamScorer scorer;
  @NonNull private final AccountLocks locks;
  @NonNull private final Clock clock;

  @Override
  public AccountRunReport call() {
    if (!locks.tryAcquire(accountId)) {
      LangUtils.warn(log, "Account {}: passata precedente ancora in corso, salto", accountId);
      return AccountRunReport.skipped(accountId, null, "pass already in flight");
    }
    try {
      return run();
    } finally {
      locks.release(accountId);
    }
  }

  private AccountRunReport run() {
    val startedAt = clock.instant();
    val deadline = Deadline.in(timeout, "account " + accountId);

    // riletto qui: può essere stato disattivato o cancellato dopo la decisione del tick
    val account = db.accounts().findById(accountId);
    if (account == null) return AccountRunReport.skipped(accountId, null, "account not found");
    if (!account.isActive())
      return AccountRunReport.skipped(accountId, account.getAddress(), "account disabled");

    val report =
        AccountRunReport.builder()
            .accountId(accountId)
            .address(account.getAddress())
            .strategy(strategy.toString());

    MailboxConnection conn = null;
    try {
      conn = client.open(account);
      deadline.check();

      val raws = client.fetch(conn, folder, strategy, account.getMaxBatchSize(), deadline);
      report.fetched(raws.size());

      val batch = new ArrayList<StoredEmail>();
      int duplicates = 0;
      int decodeErrors = 0;
      for (val raw : raws) {
        deadline.check();
        if (db.emails().exists(accountId, raw.getMessageId())) {
          duplicates++;
          continue;
        }
        try {
          val decoded = decoder.decode(raw);
          val features = extractor.extract(decoded);
          val result = scorer.score(features);
          LangUtils.debug(
              log,
              "Messaggio {} punteggio {} ({}): {}",
              raw.getMessageId(),
              result.getSpamScore(),
              result.isSpam() ? "SPAM" : "HAM",
              LangUtils.abbreviate(decoded.getSubject(), 80));
          batch.add(StoredEmail.of(accountId, decoded, features, result, clock.millis()));
        } catch (DecodeException ex) {
          decodeErrors++;
          LangUtils.warn(
              log,
              "Account {} [{}]: messaggio {} non decodificabile, salto: {}",
              account.getAddress(),
              strategy,
              ex.getMessageId(),
              LangUtils.exMsg(ex));
        }
      }

      // ultimo punto di cancellazione: dopo questo si scrive tutto
      deadline.check();
      conn.close();

      val outcomes = db.emails().saveAll(batch);
      int stored = 0;
      int spam = 0;
      for (int i = 0; i < outcomes.size(); i++) {
        if (outcomes.get(i) == SaveOutcome.ALREADY_EXISTS) {
          duplicates++;
          continue;
        }
        stored++;
        if (batch.get(i).isSpam()) spam++;
      }

      if (!db.accounts().recordPass(accountId, startedAt.toEpochMilli(), stored, spam))
        LangUtils.warn(log, "Account {} rimosso durante la passata", accountId);

      LangUtils.info(
          log,
          "Account {} [{}]: {} scaricati, {} nuovi ({} spam), {} già presenti, {} errori",
          account.getAddress(),
          strategy,
          raws.size(),
          stored,
          spam,
          duplicates,
          decodeErrors);
      return report
          .outcome(Outcome.SUCCESS)
          .stored(stored)
          .duplicates(duplicates)
          .decodeErrors(decodeErrors)
          .spam(spam)
          .ham(stored - spam)
          .duration(elapsed(startedAt))
          .build();

    } catch (ConnectionException ex) {
      LangUtils.err(
          log,
          "Account {} [{}]: connessione fallita{}: {}",
          account.getAddress(),
          strategy,
          ex.isAuthenticationFailure() ? " (credenziali)" : "",
          LangUtils.exMsg(ex));
      return failed(report, startedAt, ex);
    } catch (FetchException ex) {
      LangUtils.err(
          log,
          "Account {} [{}]: recupero interrotto al messaggio {}: {}",
          account.getAddress(),
          strategy,
          LangUtils.nz(ex.getMessageId()),
          LangUtils.rootCauseMsg(ex));
      return failed(report, startedAt, ex);
    } catch (Deadline.ExceededException ex) {
      LangUtils.err(
          log, "Account {} [{}]: passata annullata: {}", account.getAddress(), strategy, ex.getMessage());
      return failed(report, startedAt, ex);
    } catch (RuntimeException ex) {
      LangUtils.err(
          log,
          "Account {} [{}]: errore inatteso: {}",
          ex,
          account.getAddress(),
          strategy,
          LangUtils.exMsg(ex));
      return failed(report, startedAt, ex);
    } finally {
      client.close(conn);
    }
  }

  private AccountRunReport failed(
      final AccountRunReport.AccountRunReportBuilder report,
      final Instant startedAt,
      final Exception ex) {
    return report
        .outcome(Outcome.FAILED)
        .duration(elapsed(startedAt))
        .message(LangUtils.exMsg(ex))
        .build();
  }

  private Duration elapsed(final Instant startedAt) {
    val d = Duration.between(startedAt, clock.instant());
    return d.isNegative() ? Duration.ZERO : d;
  }
}
