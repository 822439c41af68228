package org.danilorossi.mailguard;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.NonNull;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.db.JsonDb;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.helpers.SingleInstanceLock;
import org.danilorossi.mailguard.helpers.SingleInstanceLock.AlreadyRunningException;
import org.danilorossi.mailguard.imap.ConnectionException;
import org.danilorossi.mailguard.imap.FetchException;
import org.danilorossi.mailguard.imap.MailboxClient;
import org.danilorossi.mailguard.model.AccountRunReport;
import org.danilorossi.mailguard.model.RetrievalStrategy;
import org.danilorossi.mailguard.scheduler.Scheduler;

/** Punto di ingresso: monitoraggio periodico delle caselle configurate in accounts.json. */
@Log
public class MailGuard {

  static {
    LogConfigurator.configLog(log);
  }

  private final JsonDb db;
  private final Scheduler scheduler;
  private final PrintStream out;

  public MailGuard(@NonNull final JsonDb db, @NonNull final PrintStream out) {
    this(db, new Scheduler(db), out);
  }

  MailGuard(
      @NonNull final JsonDb db, @NonNull final Scheduler scheduler, @NonNull final PrintStream out) {
    this.db = db;
    this.scheduler = scheduler;
    this.out = out;
  }

  public static void main(String[] args) throws IOException {

    try (val ignored = SingleInstanceLock.acquire()) {
      LangUtils.info(log, "Lock acquisito su {}", SingleInstanceLock.defaultLockPath());
      new MailGuard(new JsonDb(), System.out).run(args);

    } catch (AlreadyRunningException busy) {
      // Se un'altra istanza è già attiva, usciamo senza fare nulla
      LangUtils.warn(log, "MailGuard già in esecuzione: {}", busy.getMessage());
    }
  }

  /** Esegue il comando indicato dagli argomenti; ritorna il codice di uscita. */
  public int run(final String... args) {
    val opts = Arrays.asList(args);

    if (opts.contains("-help") || opts.contains("--help") || opts.contains("-h")) {
      printHelp();
      return 0;
    }
    if (opts.contains("-once")) {
      printReports(scheduler.tick(Instant.now()));
      return 0;
    }
    if (opts.contains("-dedup")) {
      val r = db.emails().removeDuplicates();
      out.println(
          LangUtils.s(
              "Duplicati rimossi: {} (prima {}, dopo {})",
              r.getRemoved(),
              r.getTotalBefore(),
              r.getTotalAfter()));
      r.getRemainingByAccount()
          .forEach((id, n) -> out.println(LangUtils.s("  account {}: {} messaggi", id, n)));
      return 0;
    }
    if (opts.contains("-check")) {
      val i = opts.indexOf("-check");
      return check(argAt(opts, i + 1), argAt(opts, i + 2));
    }
    if (opts.contains("-diagnose")) return diagnose(argAt(opts, opts.indexOf("-diagnose") + 1));

    loop();
    return 0;
  }

  private int check(final String idArg, final String kindArg) {
    val id = LangUtils.parseLongOr(idArg, -1L);
    if (id < 0) {
      out.println("Uso: -check <id> [all|recent|default]");
      return 2;
    }
    val kind =
        kindArg == null || kindArg.startsWith("-")
            ? RetrievalStrategy.Kind.DEFAULT
            : RetrievalStrategy.parseKind(kindArg);
    if (kind == null) {
      out.println(LangUtils.s("Strategia sconosciuta: {} (all|recent|default)", kindArg));
      return 2;
    }
    val report = scheduler.runNow(id, db.monitor().load().strategyOf(kind));
    printReports(List.of(report));
    return report.getOutcome() == AccountRunReport.Outcome.FAILED ? 1 : 0;
  }

  private int diagnose(final String idArg) {
    val account = db.accounts().findById(LangUtils.parseLongOr(idArg, -1L));
    if (account == null) {
      out.println(LangUtils.s("Account non trovato: {}", LangUtils.nz(idArg)));
      return 2;
    }
    try {
      val d = new MailboxClient().diagnose(account, db.monitor().load());
      out.println(LangUtils.s("Account {} <{}>", d.getAccountId(), d.getAddress()));
      out.println(LangUtils.s("  messaggi totali:     {}", d.getTotalMessages()));
      out.println(LangUtils.s("  non letti recenti:   {}", d.getUnreadRecent()));
      out.println(LangUtils.s("  letti recenti:       {}", d.getReadRecent()));
      out.println(LangUtils.s("  totale analizzati:   {}", d.getTotalChecked()));
      out.println(LangUtils.s("  totale spam:         {}", d.getTotalSpam()));
      return 0;
    } catch (ConnectionException | FetchException ex) {
      LangUtils.err(log, "Diagnosi fallita per {}: {}", account.getAddress(), LangUtils.rootCauseMsg(ex));
      out.println("Diagnosi fallita: " + LangUtils.exMsg(ex));
      return 1;
    }
  }

  /** Tick periodico finché la JVM non viene fermata. */
  private void loop() {
    val tick = db.monitor().load().getTickSeconds();
    val stopped = new CountDownLatch(1);
    val timer = Executors.newSingleThreadScheduledExecutor();
    timer.scheduleWithFixedDelay(
        () -> {
          try {
            printReports(scheduler.tick(Instant.now()));
          } catch (RuntimeException ex) {
            // il loop non deve morire per un tick andato male
            LangUtils.err(log, "Tick fallito: {}", ex, LangUtils.exMsg(ex));
          }
        },
        0,
        Math.max(1, tick),
        TimeUnit.SECONDS);

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LangUtils.info(log, "Arresto in corso...");
                  timer.shutdownNow();
                  stopped.countDown();
                }));

    LangUtils.info(log, "Monitoraggio avviato, tick ogni {}s", tick);
    try {
      stopped.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      timer.shutdownNow();
    }
  }

  private void printReports(final List<AccountRunReport> reports) {
    for (val r : reports) {
      if (r.getOutcome() == AccountRunReport.Outcome.SKIPPED) {
        LangUtils.debug(log, "Account {}: saltato ({})", r.getAccountId(), r.getMessage());
        continue;
      }
      out.println(
          LangUtils.s(
              "[{}] account {} {} strategia={} scaricati={} nuovi={} spam={} ham={} duplicati={}"
                  + " errori={} durata={}ms{}",
              r.getOutcome(),
              r.getAccountId(),
              LangUtils.nz(r.getAddress()),
              LangUtils.nz(r.getStrategy()),
              r.getFetched(),
              r.getStored(),
              r.getSpam(),
              r.getHam(),
              r.getDuplicates(),
              r.getDecodeErrors(),
              r.getDuration() == null ? 0 : r.getDuration().toMillis(),
              LangUtils.empty(r.getMessage()) ? "" : " - " + r.getMessage()));
    }
  }

  private void printHelp() {
    out.println("Utilizzo: java -jar mailguard.jar [opzione]");
    out.println("Opzioni:");
    out.println("  -help                              Mostra questo messaggio di aiuto");
    out.println("  -once                              Esegue un solo tick ed esce");
    out.println("  -check <id> [all|recent|default]   Controllo immediato di un account");
    out.println("  -diagnose <id>                     Conta non letti/letti recenti");
    out.println("  -dedup                             Rimuove i messaggi duplicati");
    out.println("  (nessuna)                          Monitoraggio periodico degli account");
  }

  private static String argAt(final List<String> args, final int i) {
    return i < args.size() ? args.get(i) : null;
  }
}
