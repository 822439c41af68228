package org.danilorossi.mailguard.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.AccessLevel;
import lombok.NonNull;
import lombok.Setter;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.analysis.FeatureExtractor;
import org.danilorossi.mailguard.analysis.SpamScorer;
import org.danilorossi.mailguard.db.JsonDb;
import org.danilorossi.mailguard.decode.MessageDecoder;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.imap.MailboxClient;
import org.danilorossi.mailguard.model.AccountRunReport;
import org.danilorossi.mailguard.model.AccountRunReport.Outcome;
import org.danilorossi.mailguard.model.MonitorConfig;
import org.danilorossi.mailguard.model.RetrievalStrategy;

/**
 * Decide quali account sono dovuti e li elabora in parallelo, una passata per account.
 *
 * <p>Un account è dovuto se non è mai stato controllato oppure se {@code now - lastCheckAt >=
 * intervallo}. Dopo una passata riuscita lastCheckAt diventa l'istante di <em>inizio</em> della
 * passata, così fetch lenti non fanno scivolare gli intervalli; dopo un fallimento resta com'è e il
 * tick successivo riprova.
 */
@Log
public class Scheduler {

  static {
    LogConfigurator.configLog(log);
  }

  /** Tempo concesso oltre il budget, dall'inizio della passata, prima di interromperla. */
  static final Duration GRACE = Duration.ofSeconds(30);

  @Setter(AccessLevel.PACKAGE)
  @NonNull
  private volatile Duration grace = GRACE;

  private final JsonDb db;
  private final MailboxClient client;
  private final MessageDecoder decoder;
  private final FeatureExtractor extractor;
  private final SpamScorer scorer;
  private final AccountLocks locks;
  private final Clock clock;

  public Scheduler(@NonNull final JsonDb db) {
    this(db, new MailboxClient(), Clock.systemUTC());
  }

  public Scheduler(
      @NonNull final JsonDb db, @NonNull final MailboxClient client, @NonNull final Clock clock) {
    this(
        db,
        client,
        new MessageDecoder(),
        new FeatureExtractor(),
        new SpamScorer(),
        new AccountLocks(),
        clock);
  }

  public Scheduler(
      @NonNull final JsonDb db,
      @NonNull final MailboxClient client,
      @NonNull final MessageDecoder decoder,
      @NonNull final FeatureExtractor extractor,
      @NonNull final SpamScorer scorer,
      @NonNull final AccountLocks locks,
      @NonNull final Clock clock) {
    this.db = db;
    this.client = client;
    this.decoder = decoder;
    this.extractor = extractor;
    this.scorer = scorer;
    this.locks = locks;
    this.clock = clock;
  }

  /** Un tick: un report per ogni account configurato, nello stesso ordine di accounts.json. */
  public List<AccountRunReport> tick(@NonNull final Instant now) {
    val config = loadConfig();
    val strategy = config.tickStrategy();

    val reports = new ArrayList<AccountRunReport>();
    val due = new ArrayList<AccountPass>();
    val dueIndex = new ArrayList<Integer>();

    for (val account : db.accounts().findAll()) {
      if (!account.isActive()) {
        reports.add(AccountRunReport.skipped(account.getId(), account.getAddress(), "disabled"));
        continue;
      }
      if (!account.isDue(now)) {
        reports.add(AccountRunReport.skipped(account.getId(), account.getAddress(), "not due"));
        continue;
      }
      dueIndex.add(reports.size());
      reports.add(null); // riempito dopo
      due.add(pass(account.getId(), strategy, config));
    }

    LangUtils.info(log, "Tick {}: {} account dovuti su {}", now, due.size(), reports.size());
    if (due.isEmpty()) return reports;

    val results = runAll(due, Math.min(due.size(), config.getMaxThreads()), config);
    for (int i = 0; i < results.size(); i++) reports.set(dueIndex.get(i), results.get(i));
    return reports;
  }

  /** Passata immediata su un account, senza guardare la scadenza. */
  public AccountRunReport runNow(final long accountId, @NonNull final RetrievalStrategy strategy) {
    val config = loadConfig();
    return runAll(List.of(pass(accountId, strategy, config)), 1, config).get(0);
  }

  private MonitorConfig loadConfig() {
    val config = db.monitor().load();
    try {
      config.validate();
      return config;
    } catch (IllegalArgumentException ex) {
      LangUtils.warn(log, "monitor.json non valido ({}), uso i default", ex.getMessage());
      return MonitorConfig.builder().build();
    }
  }

  private AccountPass pass(
      final long accountId, final RetrievalStrategy strategy, final MonitorConfig config) {
    return AccountPass.builder()
        .accountId(accountId)
        .strategy(strategy)
        .folder(config.getMailboxFolder())
        .timeout(config.getPassTimeout())
        .db(db)
        .client(client)
        .decoder(decoder)
        .extractor(extractor)
        .scorer(scorer)
        .locks(locks)
        .clock(clock)
        .build();
  }

  /**
   * Esegue le passate su un pool dedicato e attende tutte. Ogni passata controlla da sola il proprio
   * budget; in più, quando parte, arma un watchdog che la annulla (interrompendo il thread) dopo
   * budget + grace. Le passate in coda non consumano budget finché non partono.
   */
  private List<AccountRunReport> runAll(
      final List<AccountPass> passes, final int threads, final MonitorConfig config) {
    val pool = Executors.newFixedThreadPool(Math.max(1, threads), daemonThreads("mailguard-pass-"));
    val watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("mailguard-watchdog-"));
    val limitMs = config.getPassTimeout().plus(grace).toMillis();
    val tasks = new ArrayList<FutureTask<AccountRunReport>>(passes.size());
    val reports = new ArrayList<AccountRunReport>(passes.size());
    try {
      for (val pass : passes) {
        val task = new FutureTask<>(pass);
        tasks.add(task);
        pool.execute(() -> runWatched(task, watchdog, limitMs));
      }
      for (int i = 0; i < tasks.size(); i++) reports.add(collect(tasks.get(i), passes.get(i)));
    } finally {
      if (Thread.currentThread().isInterrupted()) for (val t : tasks) t.cancel(true);
      pool.shutdownNow();
      watchdog.shutdownNow();
    }
    return reports;
  }

  private static void runWatched(
      final FutureTask<AccountRunReport> task,
      final ScheduledExecutorService watchdog,
      final long limitMs) {
    if (task.isDone()) return;
    final ScheduledFuture<?> alarm;
    try {
      alarm = watchdog.schedule(() -> task.cancel(true), limitMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      task.cancel(false);
      return;
    }
    try {
      task.run();
    } finally {
      alarm.cancel(false);
    }
  }

  private AccountRunReport collect(final Future<AccountRunReport> f, final AccountPass pass) {
    try {
      return f.get();
    } catch (CancellationException ex) {
      LangUtils.err(log, "Account {}: passata oltre il tempo massimo, interrotta", pass.getAccountId());
      return failed(pass, "pass timed out");
    } catch (ExecutionException ex) {
      LangUtils.err(log, "Account {}: errore nella passata", ex.getCause(), pass.getAccountId());
      return failed(pass, LangUtils.rootCauseMsg(ex));
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      f.cancel(true);
      return failed(pass, "interrupted");
    }
  }

  private static AccountRunReport failed(final AccountPass pass, final String message) {
    return AccountRunReport.builder()
        .accountId(pass.getAccountId())
        .outcome(Outcome.FAILED)
        .strategy(pass.getStrategy().toString())
        .duration(Duration.ZERO)
        .message(message)
        .build();
  }

  private static ThreadFactory daemonThreads(final String prefix) {
    val seq = new AtomicInteger();
    return r -> {
      final Thread t = new Thread(r, prefix + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
