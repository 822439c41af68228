package org.danilorossi.mailguard.model;

import lombok.Value;

@Value
public class ClassificationResult {
  double spamScore;
  boolean spam;
  double confidence;
}
