package org.danilorossi.mailguard.db;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import org.danilorossi.mailguard.model.Account;
import org.danilorossi.mailguard.model.AccountStats;
import org.danilorossi.mailguard.model.DedupReport;
import org.danilorossi.mailguard.model.EmailFilter;
import org.danilorossi.mailguard.model.MonitorConfig;
import org.danilorossi.mailguard.model.RetrievalStrategy;
import org.danilorossi.mailguard.model.SaveOutcome;
import org.danilorossi.mailguard.model.StoredEmail;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonDbTest {

  @TempDir Path dir;

  private JsonDb db;

  @BeforeEach
  void setUp() {
    db = new JsonDb(dir);
  }

  private static StoredEmail email(long account, String messageId, double score, boolean spam) {
    return StoredEmail.builder()
        .accountId(account)
        .messageId(messageId)
        .subject("subject " + messageId)
        .sender("someone@" + (spam ? "scam.com" : "example.com"))
        .senderDomain(spam ? "scam.com" : "example.com")
        .body("body " + messageId)
        .spamScore(score)
        .spam(spam)
        .confidence(Math.min(score * 1.5, 1.0))
        .receivedAtEpochMs(1_000L * Long.parseLong(messageId))
        .processedAtEpochMs(10_000L + Long.parseLong(messageId))
        .build();
  }

  // ---------- messaggi ----------

  @Test
  @DisplayName("Stessa coppia (account, messaggio) salvata una sola volta")
  void saveIsIdempotent() {
    JsonDb.EmailRepository repo = db.emails();

    assertThat(repo.save(email(1, "10", 0.2, false))).isEqualTo(SaveOutcome.SAVED);
    assertThat(repo.save(email(1, "10", 0.9, true))).isEqualTo(SaveOutcome.ALREADY_EXISTS);
    assertThat(repo.save(email(2, "10", 0.2, false))).isEqualTo(SaveOutcome.SAVED);

    assertThat(db.emails().count()).isEqualTo(2);
    assertThat(db.emails().exists(1, "10")).isTrue();
    assertThat(db.emails().exists(1, "11")).isFalse();
  }

  @Test
  @DisplayName("saveAll: un esito per elemento, duplicati interni al batch inclusi")
  void saveAllReportsOutcomes() {
    db.emails().save(email(1, "1", 0.1, false));

    List<SaveOutcome> outcomes =
        db.emails().saveAll(List.of(email(1, "1", 0.1, false), email(1, "2", 0.1, false), email(1, "2", 0.1, false)));

    assertThat(outcomes)
        .containsExactly(SaveOutcome.ALREADY_EXISTS, SaveOutcome.SAVED, SaveOutcome.ALREADY_EXISTS);
    assertThat(db.emails().count()).isEqualTo(2);
  }

  @Test
  @DisplayName("I dati sopravvivono alla riapertura e gli id proseguono")
  void persistsAcrossInstances() {
    db.emails().save(email(1, "1", 0.1, false));
    db.emails().save(email(1, "2", 0.1, false));

    JsonDb reopened = new JsonDb(dir);

    assertThat(reopened.emails().count()).isEqualTo(2);
    assertThat(reopened.emails().exists(1, "2")).isTrue();
    assertThat(reopened.emails().save(email(1, "3", 0.1, false))).isEqualTo(SaveOutcome.SAVED);
    assertThat(reopened.emails().find(EmailFilter.all()).get(0).getId()).isEqualTo(3L);
  }

  @Test
  @DisplayName("Override cambia solo spam e confidence")
  void overrideChangesOnlyVerdict() {
    db.emails().save(email(1, "5", 0.2, false));
    StoredEmail before = db.emails().find(EmailFilter.all()).get(0);

    assertThat(db.emails().override(before.getId(), true)).isTrue();
    assertThat(db.emails().override(999, true)).isFalse();

    StoredEmail after = db.emails().findById(before.getId());
    assertThat(after.isSpam()).isTrue();
    assertThat(after.getConfidence()).isEqualTo(1.0);
    assertThat(after.withSpam(false).withConfidence(before.getConfidence())).isEqualTo(before);
  }

  @Test
  @DisplayName("Filtri: spam, account, dominio, testo, intervalli e ordinamento")
  void findWithFilters() {
    db.emails().save(email(1, "1", 0.10, false));
    db.emails().save(email(1, "2", 0.75, true));
    db.emails().save(email(2, "3", 0.90, true));
    db.emails().save(email(2, "4", 0.30, false));

    assertThat(db.emails().find(EmailFilter.builder().spam(true).build()))
        .extracting(StoredEmail::getMessageId)
        .containsExactly("3", "2");
    assertThat(db.emails().find(EmailFilter.builder().accountId(2L).build())).hasSize(2);
    assertThat(db.emails().find(EmailFilter.builder().senderDomain("SCAM").build())).hasSize(2);
    assertThat(db.emails().find(EmailFilter.builder().searchText("body 4").build()))
        .extracting(StoredEmail::getMessageId)
        .containsExactly("4");
    assertThat(db.emails().find(EmailFilter.builder().scoreMin(0.3).scoreMax(0.8).build()))
        .extracting(StoredEmail::getMessageId)
        .containsExactlyInAnyOrder("2", "4");
    assertThat(db.emails().find(EmailFilter.builder().confidenceMin(1.0).build()))
        .extracting(StoredEmail::getMessageId)
        .containsExactlyInAnyOrder("2", "3");
    assertThat(
            db.emails()
                .find(EmailFilter.builder().receivedFromEpochMs(2_000L).receivedToEpochMs(3_000L).build()))
        .hasSize(2);
    assertThat(
            db.emails()
                .find(
                    EmailFilter.builder()
                        .orderBy(EmailFilter.OrderBy.SPAM_SCORE)
                        .descending(false)
                        .limit(2)
                        .build()))
        .extracting(StoredEmail::getMessageId)
        .containsExactly("1", "4");
  }

  @Test
  @DisplayName("Pulizia duplicati: resta il record con id più alto")
  void removeDuplicatesKeepsHighestId() throws Exception {
    String json =
        "[{\"id\":1,\"accountId\":1,\"messageId\":\"7\",\"subject\":\"old\",\"processedAtEpochMs\":1},"
            + "{\"id\":2,\"accountId\":1,\"messageId\":\"7\",\"subject\":\"new\",\"processedAtEpochMs\":2},"
            + "{\"id\":3,\"accountId\":2,\"messageId\":\"7\",\"subject\":\"other\",\"processedAtEpochMs\":3}]";
    Files.writeString(dir.resolve(JsonDb.EMAILS_JSON), json, StandardCharsets.UTF_8);
    JsonDb loaded = new JsonDb(dir);

    DedupReport report = loaded.emails().removeDuplicates();

    assertThat(report.getTotalBefore()).isEqualTo(3);
    assertThat(report.getTotalAfter()).isEqualTo(2);
    assertThat(report.getRemoved()).isEqualTo(1);
    assertThat(report.getRemainingByAccount()).containsEntry(1L, 1).containsEntry(2L, 1);
    assertThat(loaded.emails().findById(1)).isNull();
    assertThat(loaded.emails().findById(2).getSubject()).isEqualTo("new");
    assertThat(new JsonDb(dir).emails().count()).isEqualTo(2);
  }

  @Test
  @DisplayName("Statistiche per account")
  void statsForAccount() {
    db.emails().save(email(1, "1", 0.2, false));
    db.emails().save(email(1, "2", 0.8, true));
    db.emails().save(email(2, "3", 0.9, true));

    AccountStats stats = db.emails().statsFor(1);

    assertThat(stats.getStored()).isEqualTo(2);
    assertThat(stats.getSpam()).isEqualTo(1);
    assertThat(stats.getHam()).isEqualTo(1);
    assertThat(stats.getAverageScore()).isCloseTo(0.5, within(1e-9));
    assertThat(db.emails().statsFor(99).getStored()).isZero();
  }

  @Test
  @DisplayName("delete rimuove e libera la chiave")
  void deleteFreesKey() {
    db.emails().save(email(1, "1", 0.2, false));
    long id = db.emails().find(EmailFilter.all()).get(0).getId();

    assertThat(db.emails().delete(id)).isTrue();
    assertThat(db.emails().exists(1, "1")).isFalse();
    assertThat(db.emails().delete(id)).isFalse();
  }

  // ---------- account ----------

  @Test
  @DisplayName("recordPass aggiorna lastCheckAt e contatori")
  void recordPass() {
    db.accounts().upsert(Account.builder().id(1).address("a@x.it").host("imap.x.it").build());

    assertThat(db.accounts().recordPass(1, 5_000L, 3, 1)).isTrue();
    assertThat(db.accounts().recordPass(1, 6_000L, 2, 0)).isTrue();
    assertThat(db.accounts().recordPass(42, 6_000L, 2, 0)).isFalse();

    Account a = db.accounts().findById(1);
    assertThat(a.getLastCheckAtEpochMs()).isEqualTo(6_000L);
    assertThat(a.getTotalChecked()).isEqualTo(5);
    assertThat(a.getTotalSpam()).isEqualTo(1);
    assertThat(a.getHost()).isEqualTo("imap.x.it");
  }

  @Test
  @DisplayName("Account: upsert, delete e updateStats")
  void accountCrud() {
    db.accounts().upsert(Account.builder().id(1).address("a@x.it").host("h").build());
    db.accounts().upsert(Account.builder().id(2).address("b@x.it").host("h").build());
    db.accounts().upsert(Account.builder().id(1).address("a2@x.it").host("h").build());

    assertThat(db.accounts().findAll()).extracting(Account::getAddress).containsExactly("a2@x.it", "b@x.it");
    assertThat(db.accounts().updateStats(2, 4, 2)).isTrue();
    assertThat(db.accounts().findById(2).getTotalSpam()).isEqualTo(2);
    assertThat(db.accounts().delete(2)).isTrue();
    assertThat(db.accounts().findById(2)).isNull();
  }

  @Test
  @DisplayName("Account letti da JSON con i default per i campi mancanti")
  void accountsJsonDefaults() throws Exception {
    Files.writeString(
        dir.resolve(JsonDb.ACCOUNTS_JSON),
        "[{\"id\":5,\"address\":\"c@x.it\",\"host\":\"imap.x.it\",\"checkIntervalMinutes\":10}]",
        StandardCharsets.UTF_8);

    Account a = db.accounts().findById(5);

    assertThat(a.getPort()).isEqualTo(993);
    assertThat(a.isActive()).isTrue();
    assertThat(a.getCheckIntervalMinutes()).isEqualTo(10);
    assertThat(a.getLastCheckAtEpochMs()).isNull();
  }

  // ---------- errori di I/O ----------

  private Path blockEmailsFile() throws Exception {
    Path file = dir.resolve(JsonDb.EMAILS_JSON);
    Files.delete(file);
    Files.createDirectories(file);
    Files.writeString(file.resolve("blocker"), "x");
    return file;
  }

  private static void unblock(Path file) throws Exception {
    Files.delete(file.resolve("blocker"));
    Files.delete(file);
  }

  @Test
  @DisplayName("Scrittura fallita: nessun record fantasma in memoria, poi si riprende")
  void failedWriteLeavesNoPhantomRow() throws Exception {
    JsonDb.EmailRepository repo = db.emails();
    repo.save(email(1, "41", 0.1, false));
    Path file = blockEmailsFile();

    assertThatThrownBy(() -> repo.save(email(1, "42", 0.9, true)))
        .isInstanceOf(UncheckedIOException.class);
    assertThatThrownBy(() -> repo.saveAll(List.of(email(1, "43", 0.1, false))))
        .isInstanceOf(UncheckedIOException.class);
    assertThatThrownBy(() -> repo.override(1, true)).isInstanceOf(UncheckedIOException.class);
    assertThatThrownBy(() -> repo.delete(1)).isInstanceOf(UncheckedIOException.class);

    assertThat(repo.exists(1, "42")).isFalse();
    assertThat(repo.exists(1, "43")).isFalse();
    assertThat(repo.count()).isEqualTo(1);
    assertThat(repo.findById(1).isSpam()).isFalse();

    unblock(file);
    assertThat(repo.save(email(1, "42", 0.9, true))).isEqualTo(SaveOutcome.SAVED);
    assertThat(repo.findById(2).getMessageId()).isEqualTo("42");
    assertThat(new JsonDb(dir).emails().count()).isEqualTo(2);
  }

  @Test
  @DisplayName("Archivio corrotto: errore a ogni accesso, file lasciato com'è")
  void corruptArchiveIsNotOverwritten() throws Exception {
    db.emails().save(email(1, "1", 0.1, false));
    db.emails().save(email(1, "2", 0.9, true));
    Path file = dir.resolve(JsonDb.EMAILS_JSON);
    Files.writeString(file, "garbage{", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    String corrupt = Files.readString(file, StandardCharsets.UTF_8);

    JsonDb.EmailRepository reopened = new JsonDb(dir).emails();

    assertThatThrownBy(() -> reopened.exists(1, "1"))
        .isInstanceOf(JsonDb.UnreadableFileException.class);
    assertThatThrownBy(() -> reopened.save(email(1, "3", 0.1, false)))
        .isInstanceOf(JsonDb.UnreadableFileException.class);
    assertThat(Files.readString(file, StandardCharsets.UTF_8)).isEqualTo(corrupt);

    Files.writeString(file, corrupt.substring(0, corrupt.lastIndexOf("garbage{")), StandardCharsets.UTF_8);
    assertThat(reopened.count()).isEqualTo(2);
  }

  @Test
  @DisplayName("accounts.json corrotto: errore, nessuna riscrittura; monitor.json corrotto: default")
  void corruptConfigFiles() throws Exception {
    Path accounts = dir.resolve(JsonDb.ACCOUNTS_JSON);
    Files.writeString(accounts, "[{\"id\":1,", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve(JsonDb.MONITOR_JSON), "{oops", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> db.accounts().findAll())
        .isInstanceOf(JsonDb.UnreadableFileException.class);
    assertThatThrownBy(
            () -> db.accounts().upsert(Account.builder().id(2).address("b@x.it").host("h").build()))
        .isInstanceOf(JsonDb.UnreadableFileException.class);
    assertThat(Files.readString(accounts, StandardCharsets.UTF_8)).isEqualTo("[{\"id\":1,");
    assertThat(db.monitor().load().getTickSeconds()).isEqualTo(60);
  }

  // ---------- configurazione ----------

  @Test
  @DisplayName("monitor.json mancante: valori di default; salvato e riletto")
  void monitorConfig() {
    assertThat(db.monitor().load().getTickSeconds()).isEqualTo(60);

    db.monitor().save(MonitorConfig.builder().maxThreads(2).defaultStrategy(RetrievalStrategy.Kind.RECENT).build());

    MonitorConfig loaded = new JsonDb(dir).monitor().load();
    assertThat(loaded.getMaxThreads()).isEqualTo(2);
    assertThat(loaded.getDefaultStrategy()).isEqualTo(RetrievalStrategy.Kind.RECENT);
  }
}
