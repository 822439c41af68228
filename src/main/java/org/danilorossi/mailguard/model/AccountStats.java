package org.danilorossi.mailguard.model;

import lombok.Value;

@Value
public class AccountStats {
  long accountId;
  int stored;
  int spam;
  int ham;
  double averageScore;
}
