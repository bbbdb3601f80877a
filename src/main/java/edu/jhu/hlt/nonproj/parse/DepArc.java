package edu.jhu.hlt.nonproj.parse;

/**
 * A labeled head pointer, owned by the dependent it is stored for in
 * {@link ParseState}. Heads are referenced by index.
 */
public final class DepArc {
  public final int head;
  public final String label;

  public DepArc(int head, String label) {
    if (head < 0)
      throw new IllegalArgumentException("head=" + head);
    this.head = head;
    this.label = label == null ? "" : label;
  }

  @Override
  public int hashCode() {
    return 31 * head + label.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof DepArc) {
      DepArc a = (DepArc) other;
      return head == a.head && label.equals(a.label);
    }
    return false;
  }

  @Override
  public String toString() {
    return "(DepArc head=" + head + " label=" + label + ")";
  }
}
