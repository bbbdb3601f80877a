package edu.jhu.hlt.nonproj.features;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Assigns ints to feature names. Grows until {@link #freeze()} is called, after
 * which unknown names map to -1 (and are dropped by {@link StateFeatures}).
 *
 * If built with a positive hash dimension no table is kept: names are hashed
 * into [0, dimension) and every name gets an index.
 *
 * Lookups are synchronized so that one alphabet can be grown by several
 * sentences being parsed in parallel.
 *
 * @author travis
 */
public class FeatureAlphabet {

  private static final HashFunction HASH = Hashing.murmur3_32_fixed(9001);

  private final int hashDimension;
  private final Map<String, Integer> index;
  private final List<String> names;
  private boolean frozen;

  public FeatureAlphabet() {
    this(0);
  }

  /**
   * @param hashDimension if positive, hash names into this many buckets
   * rather than storing them.
   */
  public FeatureAlphabet(int hashDimension) {
    if (hashDimension < 0)
      throw new IllegalArgumentException("hashDimension=" + hashDimension);
    this.hashDimension = hashDimension;
    this.index = new HashMap<>();
    this.names = new ArrayList<>();
  }

  public boolean isHashing() {
    return hashDimension > 0;
  }

  public synchronized void freeze() {
    frozen = true;
  }

  public synchronized boolean isFrozen() {
    return frozen;
  }

  /** Adds f if the alphabet is not frozen */
  public synchronized int lookupIndex(String f) {
    return lookupIndex(f, !frozen);
  }

  public synchronized int lookupIndex(String f, boolean addIfNotPresent) {
    if (hashDimension > 0) {
      int h = HASH.hashUnencodedChars(f).asInt();
      return Math.floorMod(h, hashDimension);
    }
    Integer i = index.get(f);
    if (i != null)
      return i;
    if (!addIfNotPresent)
      return -1;
    if (frozen)
      throw new IllegalStateException("alphabet is frozen, can't add " + f);
    int ni = names.size();
    index.put(f, ni);
    names.add(f);
    return ni;
  }

  public synchronized String lookupObject(int i) {
    if (hashDimension > 0)
      throw new UnsupportedOperationException("hashed alphabets don't keep names");
    return names.get(i);
  }

  /** Number of indices in use (or the hash dimension) */
  public synchronized int size() {
    return hashDimension > 0 ? hashDimension : names.size();
  }
}
