package org.danilorossi.mailguard.model;

import java.time.Duration;
import lombok.*;
import lombok.experimental.Accessors;
import org.danilorossi.mailguard.helpers.LangUtils;

/** Configurazione globale dello scheduler, salvata in JSON a parte (monitor.json). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true)
public class MonitorConfig {

  /** Secondi tra due tick dello scheduler. */
  @Builder.Default private int tickSeconds = 60;

  /** Budget massimo di una passata per account. */
  @Builder.Default private int passTimeoutSeconds = 300;

  @Builder.Default private int maxThreads = 8;

  @Builder.Default private String mailboxFolder = "INBOX";

  /** Finestra della strategia RECENT. */
  @Builder.Default private int recentDaysBack = 7;

  /** Finestre della strategia ibrida: non letti / letti. */
  @Builder.Default private int unreadDaysBack = 7;

  @Builder.Default private int readDaysBack = 2;

  @Builder.Default private RetrievalStrategy.Kind defaultStrategy = RetrievalStrategy.Kind.DEFAULT;

  public Duration getPassTimeout() {
    return Duration.ofSeconds(passTimeoutSeconds);
  }

  /** Strategia usata dal tick periodico. */
  public RetrievalStrategy tickStrategy() {
    return strategyOf(defaultStrategy);
  }

  public RetrievalStrategy strategyOf(final RetrievalStrategy.Kind kind) {
    return switch (kind) {
      case ALL -> RetrievalStrategy.all();
      case RECENT -> RetrievalStrategy.recent(recentDaysBack);
      case DEFAULT -> RetrievalStrategy.hybrid(unreadDaysBack, readDaysBack);
    };
  }

  public void validate() throws IllegalArgumentException {
    if (tickSeconds <= 0) throw new IllegalArgumentException("tickSeconds must be > 0");
    if (passTimeoutSeconds <= 0)
      throw new IllegalArgumentException("passTimeoutSeconds must be > 0");
    if (maxThreads <= 0) throw new IllegalArgumentException("maxThreads must be > 0");
    if (LangUtils.empty(mailboxFolder))
      throw new IllegalArgumentException("mailboxFolder is blank");
    if (recentDaysBack <= 0 || unreadDaysBack <= 0 || readDaysBack <= 0)
      throw new IllegalArgumentException("day windows must be > 0");
    if (defaultStrategy == null) throw new IllegalArgumentException("defaultStrategy is null");
  }
}
