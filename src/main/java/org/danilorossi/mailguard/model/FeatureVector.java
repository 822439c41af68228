package org.danilorossi.mailguard.model;

import lombok.Builder;
import lombok.Value;

/** Riassunto numerico/booleano di un messaggio, input dello scorer. */
@Value
@Builder
public class FeatureVector {
  int subjectLength;
  int contentLength;
  int totalLength;
  double uppercaseRatio;
  int exclamationCount;
  int questionCount;
  int dollarCount;
  int urgentWordCount;
  int spamWordCount;
  boolean suspiciousSenderDomain;
  int linkCount;
  boolean hasAttachments;

  public static FeatureVector empty() {
    return FeatureVector.builder().build();
  }
}
