package org.danilorossi.mailguard.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MailboxDiagnosis {
  long accountId;
  String address;
  int totalMessages;
  int unreadRecent;
  int readRecent;
  Long lastCheckAtEpochMs;
  long totalChecked;
  long totalSpam;

  public int getTotalRecent() {
    return unreadRecent + readRecent;
  }
}
