package edu.jhu.hlt.nonproj.features;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.common.collect.Iterables;

import edu.jhu.hlt.nonproj.parse.ParseState;

/**
 * Maps a {@link ParseState} to categorical feature names. Implementations must
 * not modify the state and should be safe to share between threads.
 *
 * @author travis
 */
public interface FeatureGenerator {

  Iterable<String> generate(ParseState state);

  /**
   * Lets you chain together {@link FeatureGenerator}s, preserving their order.
   */
  public static class Composite implements FeatureGenerator {
    private final List<FeatureGenerator> pieces;

    public Composite(FeatureGenerator... pieces) {
      this(Arrays.asList(pieces));
    }

    public Composite(List<? extends FeatureGenerator> pieces) {
      this.pieces = new ArrayList<>(pieces);
    }

    public int numPieces() {
      return pieces.size();
    }

    @Override
    public Iterable<String> generate(ParseState state) {
      List<Iterable<String>> all = new ArrayList<>(pieces.size());
      for (FeatureGenerator fg : pieces)
        all.add(fg.generate(state));
      return Iterables.concat(all);
    }
  }
}
