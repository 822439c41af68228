package org.danilorossi.mailguard.db;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import lombok.Getter;
import lombok.NonNull;
import lombok.Synchronized;
import lombok.extern.java.Log;
import lombok.val;
import org.danilorossi.mailguard.helpers.FileSystemUtils;
import org.danilorossi.mailguard.helpers.LangUtils;
import org.danilorossi.mailguard.helpers.LogConfigurator;
import org.danilorossi.mailguard.model.Account;
import org.danilorossi.mailguard.model.AccountStats;
import org.danilorossi.mailguard.model.DedupReport;
import org.danilorossi.mailguard.model.EmailFilter;
import org.danilorossi.mailguard.model.MonitorConfig;
import org.danilorossi.mailguard.model.SaveOutcome;
import org.danilorossi.mailguard.model.StoredEmail;

/**
 * Layer di persistenza basato su file JSON sotto la cartella data/. Ogni "repository" gestisce un
 * file: configurazione globale, account, messaggi analizzati.
 *
 * <p>Thread-safety: ogni repository ha un proprio lock e tutti i metodi pubblici che toccano il
 * file sono annotati con @Synchronized. Le scritture sono atomiche (tmp + move). Un file presente
 * ma corrotto fa fallire l'operazione ({@link UnreadableFileException}) e non viene sovrascritto.
 */
@Log
public class JsonDb {

  public static final String MONITOR_JSON = "monitor.json";
  public static final String ACCOUNTS_JSON = "accounts.json";
  public static final String EMAILS_JSON = "analyzed-emails.json";

  private static final Gson GSON =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  static {
    LogConfigurator.configLog(log);
  }

  @Getter private final Path dataDir;
  private final MonitorConfigStore monitor;
  private final AccountRepository accounts;
  private final EmailRepository emails;

  public JsonDb() {
    this(FileSystemUtils.getDataDir());
  }

  public JsonDb(@NonNull final Path dataDir) {
    this.dataDir = FileSystemUtils.ensureDir(dataDir);
    this.monitor = new MonitorConfigStore(dataDir.resolve(MONITOR_JSON));
    this.accounts = new AccountRepository(dataDir.resolve(ACCOUNTS_JSON));
    this.emails = new EmailRepository(dataDir.resolve(EMAILS_JSON));
  }

  public static Gson gson() {
    return GSON;
  }

  public MonitorConfigStore monitor() {
    return monitor;
  }

  public AccountRepository accounts() {
    return accounts;
  }

  public EmailRepository emails() {
    return emails;
  }

  // ---------- Metodi comuni ----------

  /**
   * Legge un file JSON; se il file non esiste (o contiene null) restituisce il default. Un file
   * illeggibile o corrotto non viene mai trattato come vuoto: la prossima scrittura lo
   * cancellerebbe. Si logga e si lancia {@link UnreadableFileException}, lasciando il file intatto.
   */
  private static <T> T readOrDefault(
      @NonNull final Path file, @NonNull final Type type, @NonNull final Supplier<T> def) {
    if (!Files.exists(file)) return def.get();
    try {
      final T obj = gson().fromJson(FileSystemUtils.readUtf8(file), type);
      return obj != null ? obj : def.get();
    } catch (JsonParseException | UncheckedIOException ex) {
      LangUtils.err(
          log, "File {} illeggibile, non verrà sovrascritto: {}", ex, file, LangUtils.rootCauseMsg(ex));
      throw new UnreadableFileException(file, ex);
    }
  }

  /** Scrive un oggetto su file JSON in maniera atomica (tmp + move). */
  private static <T> void writeAtomic(@NonNull final Path file, @NonNull final T payload) {
    try {
      FileSystemUtils.writeUtf8Atomic(file, gson().toJson(payload));
    } catch (UncheckedIOException ex) {
      LangUtils.err(log, "Errore scrittura {}: {}", ex, file, LangUtils.rootCauseMsg(ex));
      throw ex;
    }
  }

  /** Il file esiste ma non si riesce a leggerlo o interpretarlo. */
  public static class UnreadableFileException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    @Getter private final transient Path file;

    public UnreadableFileException(final Path file, final Throwable cause) {
      super("Unreadable data file " + file + ": " + LangUtils.rootCauseMsg(cause), cause);
      this.file = file;
    }
  }

  // ===================================== STORES =====================================

  /** File singolo: configurazione globale dello scheduler. */
  public static class MonitorConfigStore {
    private final Object monitorLock = new Object();
    private final Path file;

    MonitorConfigStore(final Path file) {
      this.file = file;
    }

    /** Configurazione di sola lettura per lo scheduler: se il file è corrotto valgono i default. */
    @Synchronized("monitorLock")
    public MonitorConfig load() {
      try {
        return readOrDefault(file, MonitorConfig.class, () -> MonitorConfig.builder().build());
      } catch (UnreadableFileException ex) {
        LangUtils.warn(log, "Uso la configurazione di default al posto di {}", file);
        return MonitorConfig.builder().build();
      }
    }

    @Synchronized("monitorLock")
    public void save(@NonNull final MonitorConfig cfg) {
      cfg.validate();
      writeAtomic(file, cfg);
    }
  }

  /**
   * Lista di account. Il file appartiene al collaboratore di configurazione e viene riletto a ogni
   * chiamata; il core scrive solo lastCheckAt e contatori tramite {@link #recordPass}.
   */
  public static class AccountRepository {
    private static final Type LIST_ACCOUNT = new TypeToken<List<Account>>() {}.getType();
    private final Object accountsLock = new Object();
    private final Path file;

    AccountRepository(final Path file) {
      this.file = file;
    }

    private List<Account> read() {
      return new ArrayList<>(readOrDefault(file, LIST_ACCOUNT, List::<Account>of));
    }

    @Synchronized("accountsLock")
    public List<Account> findAll() {
      return List.copyOf(read());
    }

    /** null se l'account non esiste (cancellato tra la decisione e l'esecuzione). */
    @Synchronized("accountsLock")
    public Account findById(final long id) {
      return read().stream().filter(a -> a.getId() == id).findFirst().orElse(null);
    }

    /** Inserisce o aggiorna in base all'id. */
    @Synchronized("accountsLock")
    public Account upsert(@NonNull final Account account) {
      account.validate();
      val all = read();
      val idx = indexOf(all, account.getId());
      if (idx >= 0) all.set(idx, account);
      else all.add(account);
      writeAtomic(file, all);
      return account;
    }

    @Synchronized("accountsLock")
    public boolean delete(final long id) {
      val all = read();
      if (all.removeIf(a -> a.getId() == id)) {
        writeAtomic(file, all);
        return true;
      }
      return false;
    }

    /** Incrementa i contatori cumulativi; false se l'account non esiste più. */
    @Synchronized("accountsLock")
    public boolean updateStats(final long id, final int processed, final int spam) {
      return update(
          id,
          a ->
              a.withTotalChecked(a.getTotalChecked() + processed)
                  .withTotalSpam(a.getTotalSpam() + spam));
    }

    /**
     * Esito di una passata riuscita: lastCheckAt e contatori in un'unica scrittura. Il chiamante
     * garantisce una sola passata in corso per account.
     */
    @Synchronized("accountsLock")
    public boolean recordPass(
        final long id, final long lastCheckAtEpochMs, final int processed, final int spam) {
      return update(
          id,
          a ->
              a.withLastCheckAtEpochMs(lastCheckAtEpochMs)
                  .withTotalChecked(a.getTotalChecked() + processed)
                  .withTotalSpam(a.getTotalSpam() + spam));
    }

    private boolean update(final long id, final UnaryOperator<Account> change) {
      val all = read();
      val idx = indexOf(all, id);
      if (idx < 0) return false;
      all.set(idx, change.apply(all.get(idx)));
      writeAtomic(file, all);
      return true;
    }

    private static int indexOf(final List<Account> list, final long id) {
      for (int i = 0; i < list.size(); i++) if (list.get(i).getId() == id) return i;
      return -1;
    }
  }

  /**
   * Messaggi analizzati, al massimo uno per coppia (accountId, messageId).
   *
   * <p>{@link #save} fa controllo-esistenza e inserimento sotto lo stesso lock, quindi è un'unica
   * operazione logica. Questo basta con un solo processo scrittore; un'implementazione con più
   * scrittori concorrenti (per esempio su database SQL condiviso) deve avere anche un vincolo
   * UNIQUE(account_id, message_id) come rete di sicurezza.
   *
   * <p>Il file viene caricato una volta in memoria; i duplicati eventualmente presenti su disco
   * (import, modifiche esterne) sono tollerati in lettura e rimossi da {@link #removeDuplicates}.
   */
  public static class EmailRepository {
    private static final Type LIST_EMAIL = new TypeToken<List<StoredEmail>>() {}.getType();
    private final Object emailsLock = new Object();
    private final Path file;

    private List<StoredEmail> records; // ordinati per id
    private Map<String, StoredEmail> byKey;
    private long nextId;

    EmailRepository(final Path file) {
      this.file = file;
    }

    /** Un archivio corrotto lascia records a null: ogni chiamata successiva ritenta e fallisce. */
    private void ensureLoaded() {
      if (records != null) return;
      val loaded = new ArrayList<StoredEmail>(readOrDefault(file, LIST_EMAIL, List::<StoredEmail>of));
      loaded.sort(Comparator.comparingLong(StoredEmail::getId));
      records = loaded;
      reindex();
      LangUtils.debug(log, "Caricati {} messaggi analizzati da {}", records.size(), file);
    }

    private void reindex() {
      byKey = new HashMap<>();
      nextId = 1;
      for (val e : records) {
        byKey.put(e.key(), e); // a parità di chiave vince l'id più alto
        nextId = Math.max(nextId, e.getId() + 1);
      }
    }

    /**
     * Scrive lo stato corrente; se la scrittura fallisce ripristina la copia presa prima della
     * modifica, così memoria e disco restano allineati.
     */
    private void persistOrRollback(final List<StoredEmail> snapshot, final long snapshotNextId) {
      try {
        writeAtomic(file, records);
      } catch (RuntimeException ex) {
        records = snapshot;
        reindex();
        nextId = snapshotNextId;
        throw ex;
      }
    }

    private List<StoredEmail> snapshot() {
      return new ArrayList<>(records);
    }

    @Synchronized("emailsLock")
    public boolean exists(final long accountId, final String messageId) {
      ensureLoaded();
      return byKey.containsKey(StoredEmail.keyOf(accountId, messageId));
    }

    /** Salva se la coppia (account, messaggio) è nuova; altrimenti ALREADY_EXISTS, senza errori. */
    @Synchronized("emailsLock")
    public SaveOutcome save(@NonNull final StoredEmail email) {
      ensureLoaded();
      val before = snapshot();
      val beforeNextId = nextId;
      val outcome = insert(email);
      if (outcome == SaveOutcome.SAVED) persistOrRollback(before, beforeNextId);
      return outcome;
    }

    /** Come {@link #save} per un intero batch, con una sola scrittura su disco. */
    @Synchronized("emailsLock")
    public List<SaveOutcome> saveAll(@NonNull final List<StoredEmail> batch) {
      ensureLoaded();
      val before = snapshot();
      val beforeNextId = nextId;
      val outcomes = new ArrayList<SaveOutcome>(batch.size());
      try {
        for (val e : batch) outcomes.add(insert(e));
      } catch (IllegalArgumentException ex) {
        records = before;
        reindex();
        nextId = beforeNextId;
        throw ex;
      }
      if (outcomes.contains(SaveOutcome.SAVED)) persistOrRollback(before, beforeNextId);
      return outcomes;
    }

    private SaveOutcome insert(final StoredEmail email) {
      if (LangUtils.empty(email.getMessageId()))
        throw new IllegalArgumentException("messageId is blank");
      if (byKey.containsKey(email.key())) return SaveOutcome.ALREADY_EXISTS;
      val stored = email.withId(nextId++);
      records.add(stored);
      byKey.put(stored.key(), stored);
      return SaveOutcome.SAVED;
    }

    @Synchronized("emailsLock")
    public StoredEmail findById(final long id) {
      ensureLoaded();
      return records.stream().filter(e -> e.getId() == id).findFirst().orElse(null);
    }

    @Synchronized("emailsLock")
    public int count() {
      ensureLoaded();
      return records.size();
    }

    @Synchronized("emailsLock")
    public List<StoredEmail> find(@NonNull final EmailFilter filter) {
      ensureLoaded();
      return records.stream()
          .filter(matcher(filter))
          .sorted(comparator(filter))
          .limit(Math.max(0, filter.getLimit()))
          .toList();
    }

    /**
     * Riclassificazione manuale: cambia solo spam e confidence (1.0, decisione umana). false se
     * l'id non esiste.
     */
    @Synchronized("emailsLock")
    public boolean override(final long id, final boolean spam) {
      ensureLoaded();
      for (int i = 0; i < records.size(); i++) {
        val e = records.get(i);
        if (e.getId() != id) continue;
        val before = snapshot();
        val updated = e.withSpam(spam).withConfidence(1.0);
        records.set(i, updated);
        if (byKey.get(e.key()) == e) byKey.put(e.key(), updated);
        persistOrRollback(before, nextId);
        LangUtils.info(log, "Messaggio {} riclassificato come {}", id, spam ? "SPAM" : "HAM");
        return true;
      }
      return false;
    }

    @Synchronized("emailsLock")
    public boolean delete(final long id) {
      ensureLoaded();
      val before = snapshot();
      val beforeNextId = nextId;
      if (!records.removeIf(e -> e.getId() == id)) return false;
      reindex();
      persistOrRollback(before, beforeNextId);
      return true;
    }

    /** Tiene, per ogni coppia (account, messaggio), solo il record con id più alto. */
    @Synchronized("emailsLock")
    public DedupReport removeDuplicates() {
      ensureLoaded();
      val snapshot = snapshot();
      val snapshotNextId = nextId;
      val before = records.size();
      val keep = new HashSet<>(byKey.values());
      records.removeIf(e -> !keep.contains(e));
      reindex();
      if (records.size() != before) persistOrRollback(snapshot, snapshotNextId);

      val remaining = new TreeMap<Long, Integer>();
      for (val e : records) remaining.merge(e.getAccountId(), 1, Integer::sum);
      LangUtils.info(
          log, "Pulizia duplicati: {} rimossi, {} rimasti", before - records.size(), records.size());
      return new DedupReport(before, records.size(), Collections.unmodifiableMap(remaining));
    }

    @Synchronized("emailsLock")
    public AccountStats statsFor(final long accountId) {
      ensureLoaded();
      int stored = 0;
      int spam = 0;
      double scoreSum = 0;
      for (val e : records) {
        if (e.getAccountId() != accountId) continue;
        stored++;
        if (e.isSpam()) spam++;
        scoreSum += e.getSpamScore();
      }
      return new AccountStats(accountId, stored, spam, stored - spam, stored == 0 ? 0 : scoreSum / stored);
    }

    // ---------- filtri ----------

    private static Predicate<StoredEmail> matcher(final EmailFilter f) {
      Predicate<StoredEmail> p = e -> true;
      if (f.getAccountId() != null) p = p.and(e -> e.getAccountId() == f.getAccountId());
      if (f.getSpam() != null) p = p.and(e -> e.isSpam() == f.getSpam());
      if (f.getConfidenceMin() != null) p = p.and(e -> e.getConfidence() >= f.getConfidenceMin());
      if (f.getConfidenceMax() != null) p = p.and(e -> e.getConfidence() <= f.getConfidenceMax());
      if (f.getScoreMin() != null) p = p.and(e -> e.getSpamScore() >= f.getScoreMin());
      if (f.getScoreMax() != null) p = p.and(e -> e.getSpamScore() <= f.getScoreMax());
      if (!LangUtils.empty(f.getSenderDomain())) {
        val d = f.getSenderDomain().trim().toLowerCase(Locale.ROOT);
        p = p.and(e -> LangUtils.nz(e.getSenderDomain()).toLowerCase(Locale.ROOT).contains(d));
      }
      if (!LangUtils.empty(f.getSearchText())) {
        val t = f.getSearchText().trim().toLowerCase(Locale.ROOT);
        p = p.and(
            e ->
                containsIgnoreCase(e.getSubject(), t)
                    || containsIgnoreCase(e.getSender(), t)
                    || containsIgnoreCase(e.getBody(), t));
      }
      if (f.getProcessedFromEpochMs() != null)
        p = p.and(e -> e.getProcessedAtEpochMs() >= f.getProcessedFromEpochMs());
      if (f.getProcessedToEpochMs() != null)
        p = p.and(e -> e.getProcessedAtEpochMs() <= f.getProcessedToEpochMs());
      if (f.getReceivedFromEpochMs() != null)
        p = p.and(
            e -> e.getReceivedAtEpochMs() != null
                && e.getReceivedAtEpochMs() >= f.getReceivedFromEpochMs());
      if (f.getReceivedToEpochMs() != null)
        p = p.and(
            e -> e.getReceivedAtEpochMs() != null
                && e.getReceivedAtEpochMs() <= f.getReceivedToEpochMs());
      return p;
    }

    private static boolean containsIgnoreCase(final String s, final String lowerNeedle) {
      return s != null && s.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    private static Comparator<StoredEmail> comparator(final EmailFilter f) {
      Comparator<StoredEmail> c =
          switch (f.getOrderBy()) {
            case PROCESSED_AT -> Comparator.comparingLong(StoredEmail::getProcessedAtEpochMs);
            case RECEIVED_AT -> Comparator.comparing(
                StoredEmail::getReceivedAtEpochMs, Comparator.nullsFirst(Comparator.naturalOrder()));
            case SPAM_SCORE -> Comparator.comparingDouble(StoredEmail::getSpamScore);
            case CONFIDENCE -> Comparator.comparingDouble(StoredEmail::getConfidence);
          };
      c = c.thenComparingLong(StoredEmail::getId);
      return f.isDescending() ? c.reversed() : c;
    }
  }
}
