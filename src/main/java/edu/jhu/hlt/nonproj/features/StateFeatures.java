package edu.jhu.hlt.nonproj.features;

import java.util.Collections;
import java.util.List;

import edu.jhu.hlt.nonproj.parse.ParseState;
import edu.jhu.hlt.nonproj.util.UniqList;

/**
 * The features of one {@link ParseState}, in generator order with duplicates
 * dropped. This is all a decision function gets to see besides the state.
 */
public class StateFeatures {

  public static final StateFeatures EMPTY = new StateFeatures(Collections.emptyList(), null);

  private final List<String> names;
  private final int[] indices;    // may be null

  private StateFeatures(List<String> names, int[] indices) {
    this.names = names;
    this.indices = indices;
  }

  public static StateFeatures extract(ParseState state, FeatureGenerator generator) {
    UniqList<String> u = new UniqList<>();
    for (String f : generator.generate(state))
      u.add(f);
    return new StateFeatures(Collections.unmodifiableList(u.getList()), null);
  }

  public List<String> getNames() {
    return names;
  }

  public int size() {
    return names.size();
  }

  /** The same features along with their indices in alph */
  public StateFeatures withIndices(FeatureAlphabet alph) {
    return new StateFeatures(names, toIndices(alph));
  }

  /**
   * Indices set by {@link #withIndices(FeatureAlphabet)}, or null if these
   * features were never looked up in an alphabet.
   */
  public int[] getIndices() {
    return indices;
  }

  /**
   * Indices of these features according to alph. Names the alphabet doesn't
   * know (it is frozen) are skipped.
   */
  public int[] toIndices(FeatureAlphabet alph) {
    int[] idx = new int[names.size()];
    int k = 0;
    for (String f : names) {
      int i = alph.lookupIndex(f);
      if (i >= 0)
        idx[k++] = i;
    }
    if (k == idx.length)
      return idx;
    int[] trimmed = new int[k];
    System.arraycopy(idx, 0, trimmed, 0, k);
    return trimmed;
  }

  @Override
  public String toString() {
    return String.join(" ", names);
  }
}
