package edu.jhu.hlt.nonproj.datatypes;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A labeled dependency tree indexed the same way as a parser's token array:
 * index 0 is ROOT and words are 1..n. heads[0] is {@link #NO_HEAD}, and a word
 * whose head is {@link #ROOT} hangs off the root. Words which were not given a
 * head (e.g. an incomplete parse) also have {@link #NO_HEAD}.
 *
 * @author travis
 */
public class DependencyParse implements Serializable {
  private static final long serialVersionUID = -2871032295741902315L;

  public static final int ROOT = 0;
  public static final int NO_HEAD = -1;

  private int[] heads;
  private String[] labels;

  private transient int[][] children;
  private transient int hashCode = 0;

  public DependencyParse(int[] heads, String[] labels) {
    if (heads.length != labels.length)
      throw new IllegalArgumentException("heads=" + heads.length + " labels=" + labels.length);
    if (heads.length == 0 || heads[0] != NO_HEAD)
      throw new IllegalArgumentException("index 0 is ROOT and can't have a head");
    for (int i = 1; i < heads.length; i++) {
      if (heads[i] < NO_HEAD || heads[i] >= heads.length || heads[i] == i)
        throw new IllegalArgumentException("bad head for " + i + ": " + heads[i]);
    }
    this.heads = heads;
    this.labels = labels;
  }

  /**
   * Builds a parse from CoNLL-X rows (one String[] of 10 columns per word), in
   * which HEAD (column 7) is 1-based with 0 meaning the root. Those are exactly
   * the indices used here.
   */
  public static DependencyParse fromConllx(List<String[]> conllx) {
    int n = conllx.size();
    int[] heads = new int[n + 1];
    String[] labels = new String[n + 1];
    heads[0] = NO_HEAD;
    labels[0] = "";
    for (int i = 0; i < n; i++) {
      String[] ar = conllx.get(i);
      heads[i + 1] = "_".equals(ar[6]) ? NO_HEAD : Integer.parseInt(ar[6]);
      labels[i + 1] = ar[7];
    }
    return new DependencyParse(heads, labels);
  }

  /** Number of entries, including ROOT */
  public int size() {
    return heads.length;
  }

  public int getHead(int i) {
    return heads[i];
  }

  public String getLabel(int i) {
    return labels[i];
  }

  public boolean hasHead(int i) {
    return heads[i] != NO_HEAD;
  }

  /** Every word has a head and following heads from any word reaches ROOT. */
  public boolean isTree() {
    int n = size();
    for (int i = 1; i < n; i++) {
      int ptr = i;
      int steps = 0;
      while (ptr != ROOT) {
        ptr = heads[ptr];
        if (ptr == NO_HEAD || ++steps > n)
          return false;
      }
    }
    return true;
  }

  /**
   * An arc (h, d) is projective if every word strictly between h and d is a
   * descendant of h. Returns true if every arc is.
   */
  public boolean isProjective() {
    int n = size();
    for (int d = 1; d < n; d++) {
      int h = heads[d];
      if (h == NO_HEAD)
        continue;
      int lo = Math.min(h, d), hi = Math.max(h, d);
      for (int k = lo + 1; k < hi; k++) {
        if (!dominates(h, k))
          return false;
      }
    }
    return true;
  }

  private boolean dominates(int ancestor, int k) {
    int n = size();
    int ptr = k;
    for (int steps = 0; steps < n && ptr != NO_HEAD; steps++) {
      if (ptr == ancestor)
        return true;
      ptr = ptr == ROOT ? NO_HEAD : heads[ptr];
    }
    return false;
  }

  /** Dependents of i in increasing order */
  public int[] getChildren(int i) {
    if (children == null) {
      int n = size();
      List<List<Integer>> c = new ArrayList<>();
      for (int j = 0; j < n; j++)
        c.add(new ArrayList<>());
      for (int j = 1; j < n; j++) {
        if (heads[j] != NO_HEAD)
          c.get(heads[j]).add(j);
      }
      int[][] ch = new int[n][];
      for (int j = 0; j < n; j++)
        ch[j] = c.get(j).stream().mapToInt(Integer::intValue).toArray();
      children = ch;
    }
    return children[i];
  }

  @Override
  public int hashCode() {
    if (hashCode == 0) {
      int n = size();
      for (int i = 0; i < n; i++)
        hashCode = hashCode * 83 + heads[i];
    }
    return hashCode;
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof DependencyParse) {
      DependencyParse d = (DependencyParse) other;
      return Arrays.equals(heads, d.heads)
          && Arrays.equals(labels, d.labels);
    }
    return false;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(DependencyParse");
    for (int i = 1; i < heads.length; i++)
      sb.append(' ').append(heads[i]).append("->").append(i).append(':').append(labels[i]);
    sb.append(')');
    return sb.toString();
  }
}
