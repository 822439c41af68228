package org.danilorossi.mailguard.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Properties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.With;
import lombok.val;
import org.danilorossi.mailguard.helpers.LangUtils;

/**
 * Casella da monitorare. Creata e modificata dal collaboratore di configurazione; il core scrive
 * solo lastCheckAtEpochMs e i contatori cumulativi.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@With
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Account {

  public static final String PROTOCOL_IMAP = "IMAP";

  @ToString.Include(rank = 100)
  @EqualsAndHashCode.Include
  private long id;

  @Builder.Default
  @ToString.Include(rank = 99)
  private String address = "";

  @Builder.Default private String password = "";

  @Builder.Default
  @ToString.Include(rank = 98)
  private String host = "";

  @Builder.Default
  @ToString.Include(rank = 97)
  private int port = 993;

  @Builder.Default private String protocol = PROTOCOL_IMAP;

  @Builder.Default private boolean ssl = true; // IMAPS (implicit TLS)

  @Builder.Default private boolean active = true;

  /** Minuti tra due controlli, > 0. */
  @Builder.Default private int checkIntervalMinutes = 15;

  /** Massimo messaggi per passata, > 0. */
  @Builder.Default private int maxBatchSize = 50;

  /** null finché la casella non è mai stata controllata con successo. */
  private Long lastCheckAtEpochMs;

  private long totalChecked;
  private long totalSpam;

  // Timeouts (ms) con default prudenti
  @Builder.Default private int connectionTimeoutMs = 15_000;
  @Builder.Default private int readTimeoutMs = 30_000;
  @Builder.Default private int writeTimeoutMs = 15_000;

  public String getStoreProtocol() {
    return ssl ? "imaps" : "imap";
  }

  public boolean isImap() {
    return PROTOCOL_IMAP.equalsIgnoreCase(LangUtils.nz(protocol));
  }

  public Duration getCheckInterval() {
    return Duration.ofMinutes(checkIntervalMinutes);
  }

  public Instant getLastCheckAt() {
    return lastCheckAtEpochMs == null ? null : Instant.ofEpochMilli(lastCheckAtEpochMs);
  }

  /** Due se mai controllata, oppure se dall'ultimo controllo è passato almeno l'intervallo. */
  public boolean isDue(final Instant now) {
    val last = getLastCheckAt();
    if (last == null) return true;
    return Duration.between(last, now).compareTo(getCheckInterval()) >= 0;
  }

  /** Proprietà minime e robuste per Jakarta Mail. */
  public Properties toProperties() {
    validate(); // fail-fast

    val p = new Properties();
    val prefix = "mail." + getStoreProtocol();

    p.put(LangUtils.s("{}.host", prefix), host);
    p.put(LangUtils.s("{}.port", prefix), String.valueOf(port));
    p.put(LangUtils.s("{}.ssl.enable", prefix), String.valueOf(ssl));
    p.put(LangUtils.s("{}.starttls.enable", prefix), String.valueOf(!ssl));
    p.put(LangUtils.s("{}.connectiontimeout", prefix), String.valueOf(connectionTimeoutMs));
    p.put(LangUtils.s("{}.timeout", prefix), String.valueOf(readTimeoutMs));
    p.put(LangUtils.s("{}.writetimeout", prefix), String.valueOf(writeTimeoutMs));
    p.put(LangUtils.s("{}.partialfetch", prefix), "true");
    return p;
  }

  /** Validazione essenziale per errori precoci e messaggi chiari. */
  public void validate() throws IllegalArgumentException {
    if (LangUtils.empty(host)) throw new IllegalArgumentException("Account host is blank");
    if (LangUtils.empty(address)) throw new IllegalArgumentException("Account address is blank");
    if (port <= 0 || port > 65535)
      throw new IllegalArgumentException(LangUtils.s("Account port is invalid: {}", port));
    if (checkIntervalMinutes <= 0)
      throw new IllegalArgumentException(
          LangUtils.s("Check interval must be > 0: {}", checkIntervalMinutes));
    if (maxBatchSize <= 0)
      throw new IllegalArgumentException(LangUtils.s("Max batch size must be > 0: {}", maxBatchSize));
  }
}
