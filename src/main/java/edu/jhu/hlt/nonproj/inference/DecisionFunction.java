package edu.jhu.hlt.nonproj.inference;

import edu.jhu.hlt.nonproj.features.StateFeatures;
import edu.jhu.hlt.nonproj.parse.ParseDecision;
import edu.jhu.hlt.nonproj.parse.ParseState;

/**
 * Chooses the next transition. This is where a trained classifier plugs in
 * (or a {@link GoldOracle} when generating training data).
 *
 * The state is passed for implementations which need to know where the
 * cursors are (like the oracle); classifiers should only look at the features.
 * Implementations must not modify the state. The parser checks that the
 * returned decision is legal and abandons the sentence if it isn't.
 *
 * @author travis
 */
public interface DecisionFunction {

  ParseDecision decide(ParseState state, StateFeatures features);
}
