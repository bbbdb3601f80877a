package edu.jhu.hlt.nonproj.inference;

import edu.jhu.hlt.nonproj.features.StateFeatures;
import edu.jhu.hlt.nonproj.parse.ParseDecision;

/**
 * The features of one state paired with the decision the oracle took there.
 */
public final class TrainingExample {
  public final StateFeatures features;
  public final ParseDecision decision;

  public TrainingExample(StateFeatures features, ParseDecision decision) {
    this.features = features;
    this.decision = decision;
  }

  /** decision, a tab, then space separated feature names */
  public String toLine() {
    return decision.toShortString() + "\t" + features;
  }

  @Override
  public String toString() {
    return "(TrainingExample " + decision.toShortString() + " nFeat=" + features.size() + ")";
  }
}
