package org.danilorossi.mailguard.model;

import java.util.Map;
import lombok.Value;

@Value
public class DedupReport {
  int totalBefore;
  int totalAfter;

  /** Record rimasti per account dopo la pulizia. */
  Map<Long, Integer> remainingByAccount;

  public int getRemoved() {
    return totalBefore - totalAfter;
  }
}
