package org.danilorossi.mailguard.model;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Esito di una passata su un account, consumato dalla dashboard esterna. */
@Value
@Builder
public class AccountRunReport {

  public enum Outcome {
    SUCCESS,
    FAILED,
    SKIPPED // non dovuto, disattivato, sparito o già in corso
  }

  long accountId;
  String address;
  Outcome outcome;
  String strategy;

  int fetched;
  int stored;
  int duplicates;
  int decodeErrors;
  int spam;
  int ham;

  Duration duration;
  String message;

  public boolean isSuccess() {
    return outcome == Outcome.SUCCESS;
  }

  public static AccountRunReport skipped(
      final long accountId, final String address, final String reason) {
    return AccountRunReport.builder()
        .accountId(accountId)
        .address(address)
        .outcome(Outcome.SKIPPED)
        .duration(Duration.ZERO)
        .message(reason)
        .build();
  }
}
