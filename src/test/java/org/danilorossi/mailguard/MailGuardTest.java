package org.danilorossi.mailguard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.danilorossi.mailguard.db.JsonDb;
import org.danilorossi.mailguard.model.AccountRunReport;
import org.danilorossi.mailguard.model.RetrievalStrategy;
import org.danilorossi.mailguard.model.StoredEmail;
import org.danilorossi.mailguard.scheduler.Scheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MailGuardTest {

  @TempDir Path dir;

  @Mock private Scheduler scheduler;

  private JsonDb db;
  private ByteArrayOutputStream buffer;
  private MailGuard app;

  @BeforeEach
  void setUp() {
    db = new JsonDb(dir);
    buffer = new ByteArrayOutputStream();
    app = new MailGuard(db, scheduler, new PrintStream(buffer, true, StandardCharsets.UTF_8));
  }

  private String output() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  private static AccountRunReport report(AccountRunReport.Outcome outcome) {
    return AccountRunReport.builder()
        .accountId(3)
        .address("c@example.com")
        .outcome(outcome)
        .strategy("ALL")
        .stored(4)
        .spam(1)
        .ham(3)
        .duration(Duration.ofMillis(120))
        .build();
  }

  @Test
  @DisplayName("-help stampa le opzioni")
  void help() {
    assertThat(app.run("-help")).isZero();
    assertThat(output()).contains("-once").contains("-check").contains("-dedup");
    verifyNoInteractions(scheduler);
  }

  @Test
  @DisplayName("-check con strategia esplicita")
  void checkWithStrategy() {
    when(scheduler.runNow(anyLong(), any(RetrievalStrategy.class)))
        .thenReturn(report(AccountRunReport.Outcome.SUCCESS));

    assertThat(app.run("-check", "3", "all")).isZero();

    verify(scheduler).runNow(eq(3L), eq(RetrievalStrategy.all()));
    assertThat(output()).contains("[SUCCESS]").contains("nuovi=4");
  }

  @Test
  @DisplayName("-check fallito: codice di uscita 1")
  void checkFailed() {
    when(scheduler.runNow(anyLong(), any(RetrievalStrategy.class)))
        .thenReturn(report(AccountRunReport.Outcome.FAILED));

    assertThat(app.run("-check", "3")).isEqualTo(1);
  }

  @Test
  @DisplayName("-check con argomenti non validi")
  void checkBadArguments() {
    assertThat(app.run("-check", "abc")).isEqualTo(2);
    assertThat(app.run("-check", "3", "pop3")).isEqualTo(2);
    verifyNoInteractions(scheduler);
  }

  @Test
  @DisplayName("-once esegue un solo tick")
  void once() {
    when(scheduler.tick(any(Instant.class))).thenReturn(List.of(report(AccountRunReport.Outcome.SUCCESS)));

    assertThat(app.run("-once")).isZero();

    verify(scheduler, times(1)).tick(any(Instant.class));
  }

  @Test
  @DisplayName("-dedup riporta i duplicati rimossi")
  void dedup() {
    db.emails().save(StoredEmail.builder().accountId(1).messageId("1").build());

    assertThat(app.run("-dedup")).isZero();
    assertThat(output()).contains("Duplicati rimossi: 0").contains("account 1: 1");
  }

  @Test
  @DisplayName("-diagnose su account sconosciuto")
  void diagnoseUnknown() {
    assertThat(app.run("-diagnose", "77")).isEqualTo(2);
    assertThat(output()).contains("Account non trovato: 77");
  }
}
