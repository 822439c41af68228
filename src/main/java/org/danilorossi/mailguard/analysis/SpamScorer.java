package org.danilorossi.mailguard.analysis;

import java.util.List;
import lombok.Getter;
import lombok.NonNull;
import lombok.val;
import org.danilorossi.mailguard.model.ClassificationResult;
import org.danilorossi.mailguard.model.FeatureVector;

/**
 * Scorer euristico additivo. Le regole sono applicate nell'ordine della lista; l'ordine delle
 * somme fa parte del risultato (aritmetica double) e va mantenuto per la compatibilità con i
 * punteggi già archiviati.
 */
public class SpamScorer {

  public static final double SPAM_THRESHOLD = 0.6;
  public static final double CONFIDENCE_SCALE = 1.5;

  public static final List<ScoringRule> DEFAULT_RULES =
      List.of(
          new ScoringRule("uppercase-ratio", f -> f.getUppercaseRatio() > 0.3, 0.20),
          new ScoringRule("exclamations", f -> f.getExclamationCount() > 3, 0.15),
          new ScoringRule("urgent-words", f -> f.getUrgentWordCount() > 0, 0.25),
          new ScoringRule("spam-words", f -> f.getSpamWordCount() > 2, 0.20),
          new ScoringRule("suspicious-domain", FeatureVector::isSuspiciousSenderDomain, 0.30),
          new ScoringRule("many-links", f -> f.getLinkCount() > 5, 0.10));

  @Getter private final List<ScoringRule> rules;

  public SpamScorer() {
    this(DEFAULT_RULES);
  }

  public SpamScorer(@NonNull final List<ScoringRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public ClassificationResult score(@NonNull final FeatureVector features) {
    double score = 0.0;
    for (val rule : rules) if (rule.matches(features)) score += rule.getWeight();
    return new ClassificationResult(
        score, score > SPAM_THRESHOLD, Math.min(score * CONFIDENCE_SCALE, 1.0));
  }
}
