package org.danilorossi.mailguard.model;

import lombok.Builder;
import lombok.Value;

/** Criteri di ricerca sui messaggi archiviati; i campi null non filtrano. */
@Value
@Builder
public class EmailFilter {

  public enum OrderBy {
    PROCESSED_AT,
    RECEIVED_AT,
    SPAM_SCORE,
    CONFIDENCE
  }

  Long accountId;
  Boolean spam;
  Double confidenceMin;
  Double confidenceMax;
  Double scoreMin;
  Double scoreMax;
  String senderDomain; // sottostringa, case-insensitive
  String searchText; // subject, sender o body
  Long processedFromEpochMs;
  Long processedToEpochMs;
  Long receivedFromEpochMs;
  Long receivedToEpochMs;

  @Builder.Default OrderBy orderBy = OrderBy.PROCESSED_AT;
  @Builder.Default boolean descending = true;
  @Builder.Default int limit = 1000;

  public static EmailFilter all() {
    return EmailFilter.builder().build();
  }
}
