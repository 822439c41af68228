package org.danilorossi.mailguard.analysis;

import java.util.function.Predicate;
import lombok.NonNull;
import lombok.Value;
import org.danilorossi.mailguard.model.FeatureVector;

/** Una riga della tabella euristica: se il predicato scatta, il punteggio cresce di weight. */
@Value
public class ScoringRule {
  @NonNull String name;
  @NonNull Predicate<FeatureVector> condition;
  double weight;

  public boolean matches(final FeatureVector features) {
    return condition.test(features);
  }
}
