package edu.jhu.hlt.nonproj.inference;

import edu.jhu.hlt.nonproj.datatypes.DependencyParse;
import edu.jhu.hlt.nonproj.features.StateFeatures;
import edu.jhu.hlt.nonproj.parse.ParseDecision;
import edu.jhu.hlt.nonproj.parse.ParseDecision.Action;
import edu.jhu.hlt.nonproj.parse.ParseState;

/**
 * Static oracle for the list-based non-projective transition system: given the
 * gold tree and the current state, returns the decision which keeps the gold
 * tree reachable. Driving a {@link ParseState} with this reproduces the gold
 * arcs exactly, crossing arcs included.
 *
 * With s = stack top and b = input token:
 * <ol>
 * <li>head(s) = b: LEFT, then REDUCE unless s still has dependents after b (PASS)</li>
 * <li>head(b) = s: RIGHT, then SHIFT unless b still has business with a stack
 *     token below s (PASS)</li>
 * <li>otherwise no arc: REDUCE if s is done, PASS if b has business below s,
 *     else SHIFT</li>
 * </ol>
 * ROOT is never passed or reduced, and nothing is left below it on the stack,
 * so whenever s is ROOT the oracle shifts.
 *
 * Keeps no state besides the gold tree, so one instance serves one sentence.
 *
 * @author travis
 */
public class GoldOracle implements DecisionFunction {

  private final DependencyParse gold;

  public GoldOracle(DependencyParse gold) {
    if (!gold.isTree())
      throw new IllegalArgumentException("gold parse is not a tree: " + gold);
    this.gold = gold;
  }

  public DependencyParse getGold() {
    return gold;
  }

  @Override
  public ParseDecision decide(ParseState state, StateFeatures features) {
    if (state.size() != gold.size())
      throw new IllegalArgumentException("state.size=" + state.size() + " gold.size=" + gold.size());
    int s = state.getStack();
    int b = state.getInput();

    if (s > 0 && gold.getHead(s) == b && !state.hasHead(s)) {
      Action a = hasGoldDependentAtOrAfter(s, b + 1) ? Action.PASS : Action.REDUCE;
      return ParseDecision.left(a, gold.getLabel(s));
    }

    if (gold.getHead(b) == s && !state.hasHead(b)) {
      Action a = s > 0 && hasPendingRelationBelow(state, b, s) ? Action.PASS : Action.SHIFT;
      return ParseDecision.right(a, gold.getLabel(b));
    }

    if (s > 0 && state.hasHead(s) && !hasGoldDependentAtOrAfter(s, b))
      return ParseDecision.NO_REDUCE;
    if (s > 0 && hasPendingRelationBelow(state, b, s))
      return ParseDecision.NO_PASS;
    return ParseDecision.NO_SHIFT;
  }

  /** Does token h have a gold dependent at index >= from? */
  private boolean hasGoldDependentAtOrAfter(int h, int from) {
    int[] c = gold.getChildren(h);
    return c.length > 0 && c[c.length - 1] >= from;
  }

  /**
   * Is there a non-reduced token k < s which b still needs an arc with (in
   * either direction)?
   */
  private boolean hasPendingRelationBelow(ParseState state, int b, int s) {
    for (int k = s - 1; k >= 0; k--) {
      if (state.isReduced(k))
        continue;
      if (gold.getHead(b) == k && !state.hasHead(b))
        return true;
      if (k > 0 && gold.getHead(k) == b && !state.hasHead(k))
        return true;
    }
    return false;
  }
}
