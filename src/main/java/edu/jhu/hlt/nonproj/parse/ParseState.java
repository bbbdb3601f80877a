package edu.jhu.hlt.nonproj.parse;

import java.util.Arrays;
import java.util.BitSet;

/**
 * The configuration of the list-based non-projective parser, stored as two
 * cursors over a fixed token array rather than explicit stack/list/buffer
 * containers:
 * <ul>
 * <li>lambda1 (the stack): non-reduced indices {@code <= stack}</li>
 * <li>lambda2 (passed tokens): non-reduced indices in {@code (stack, input)}</li>
 * <li>beta (the buffer): indices {@code >= input}</li>
 * </ul>
 *
 * Reduced tokens stay in the array so they can still be read (e.g. as heads of
 * other tokens), they are just skipped by {@link #stackToken(int)} and by the
 * stack pointer.
 *
 * This class only does the bookkeeping. Whether a transition is allowed is
 * decided by {@link TransitionSystem}, which calls the mutators here only after
 * it has checked the whole decision.
 *
 * Not thread safe: one state per sentence.
 *
 * @author travis
 */
public class ParseState {

  private final DepToken[] tokens;
  private int stack;
  private int input;
  private final BitSet reduced;

  // arcs[i] is the head of token i, or null
  private final DepArc[] arcs;
  private final int[] leftmostDeps;
  private final int[] rightmostDeps;
  private int numArcs;

  public ParseState(DepToken[] tokens) {
    if (tokens.length == 0 || tokens[0] != DepToken.ROOT)
      throw new IllegalArgumentException("token array must start with ROOT");
    for (int i = 1; i < tokens.length; i++) {
      if (tokens[i].idx != i)
        throw new IllegalArgumentException("token at " + i + " has idx " + tokens[i].idx);
    }
    this.tokens = tokens;
    this.stack = 0;
    this.input = 1;
    this.reduced = new BitSet(tokens.length);
    this.arcs = new DepArc[tokens.length];
    this.leftmostDeps = new int[tokens.length];
    this.rightmostDeps = new int[tokens.length];
    Arrays.fill(leftmostDeps, -1);
    Arrays.fill(rightmostDeps, -1);
  }

  /** Number of tokens including ROOT */
  public int size() {
    return tokens.length;
  }

  public DepToken getToken(int i) {
    return tokens[i];
  }

  public int getStack() {
    return stack;
  }

  public int getInput() {
    return input;
  }

  public boolean isReduced(int i) {
    return reduced.get(i);
  }

  public int numReduced() {
    return reduced.cardinality();
  }

  public int numArcs() {
    return numArcs;
  }

  /** The buffer is exhausted: no transition applies any more. */
  public boolean isTerminal() {
    return input >= tokens.length;
  }

  /* LOOKUPS ****************************************************************/

  /** Token at input+offset, or {@link DepToken#NULL} */
  public DepToken inputToken(int offset) {
    int i = input + offset;
    if (i < 0 || i >= tokens.length)
      return DepToken.NULL;
    return tokens[i];
  }

  /** Token at stack+offset without regard to reduction, or {@link DepToken#NULL} */
  public DepToken lambdaToken(int offset) {
    int i = stack + offset;
    if (i < 0 || i >= tokens.length)
      return DepToken.NULL;
    return tokens[i];
  }

  /**
   * The offset-th non-reduced token to the left (negative) or right (positive)
   * of the stack top, never looking at or past the input. Offset 0 is the stack
   * top itself.
   */
  public DepToken stackToken(int offset) {
    if (offset == 0)
      return tokens[stack];
    int dir = offset < 0 ? -1 : 1;
    int remaining = Math.abs(offset);
    for (int i = stack + dir; i >= 0 && i < input; i += dir) {
      if (!reduced.get(i)) {
        remaining--;
        if (remaining == 0)
          return tokens[i];
      }
    }
    return DepToken.NULL;
  }

  public DepToken leftmostDependent(int i) {
    int d = leftmostDeps[i];
    return d < 0 ? DepToken.NULL : tokens[d];
  }

  public DepToken rightmostDependent(int i) {
    int d = rightmostDeps[i];
    return d < 0 ? DepToken.NULL : tokens[d];
  }

  public int leftmostDependentIndex(int i) {
    return leftmostDeps[i];
  }

  public int rightmostDependentIndex(int i) {
    return rightmostDeps[i];
  }

  /* ARCS *******************************************************************/

  public boolean hasHead(int i) {
    return arcs[i] != null;
  }

  /** May return null */
  public DepArc getArc(int i) {
    return arcs[i];
  }

  /** Head of token i, or -1 */
  public int headIndex(int i) {
    DepArc a = arcs[i];
    return a == null ? -1 : a.head;
  }

  public DepToken headToken(int i) {
    DepArc a = arcs[i];
    return a == null ? DepToken.NULL : tokens[a.head];
  }

  /**
   * Records that head is the head of dep. A token may only receive one head and
   * ROOT may never receive one; both are checked before anything is changed.
   */
  public void setHead(int dep, int head, String label) {
    if (dep <= 0 || dep >= tokens.length)
      throw new IllegalStateException("dep=" + dep + " can't take a head, n=" + tokens.length);
    if (head < 0 || head >= tokens.length || head == dep)
      throw new IllegalStateException("head=" + head + " dep=" + dep + " n=" + tokens.length);
    if (arcs[dep] != null)
      throw new IllegalStateException("token " + dep + " already has a head: " + arcs[dep]);
    arcs[dep] = new DepArc(head, label);
    numArcs++;
    if (dep < head) {
      if (leftmostDeps[head] < 0 || dep < leftmostDeps[head])
        leftmostDeps[head] = dep;
    } else {
      if (rightmostDeps[head] < 0 || dep > rightmostDeps[head])
        rightmostDeps[head] = dep;
    }
  }

  public void setHead(DepToken dep, DepToken head, String label) {
    checkOwned(dep);
    checkOwned(head);
    setHead(dep.idx, head.idx, label);
  }

  /**
   * True if b is a proper ancestor of a (following head pointers up from a).
   * The walk is bounded by the sentence length, and running past the bound
   * means the arcs contain a cycle, which is reported as an error.
   */
  public boolean isDescendantOf(int a, int b) {
    int ptr = a;
    for (int steps = 0; steps < tokens.length; steps++) {
      if (ptr == 0 || arcs[ptr] == null)
        return false;
      ptr = arcs[ptr].head;
      if (ptr == b)
        return true;
    }
    throw new IllegalStateException("cycle in head pointers starting at " + a);
  }

  public boolean isDescendantOf(DepToken a, DepToken b) {
    if (a.isNull() || b.isNull())
      return false;
    checkOwned(a);
    checkOwned(b);
    return isDescendantOf(a.idx, b.idx);
  }

  private void checkOwned(DepToken t) {
    if (t.idx < 0 || t.idx >= tokens.length || tokens[t.idx] != t)
      throw new IllegalArgumentException(t + " is not in this sentence");
  }

  /* MOVES ******************************************************************/

  /** Moves the input token (and everything passed) onto the stack. */
  public void shift() {
    if (isTerminal())
      throw new IllegalStateException("can't shift, buffer is empty: " + this);
    stack = input;
    input++;
  }

  /** Leaves the stack top un-reduced but moves it behind the stack pointer. */
  public void pass() {
    if (stack <= 0)
      throw new IllegalStateException("can't pass ROOT: " + this);
    stack = previousNonReduced(stack);
  }

  /** Retires the stack top for good. */
  public void reduce() {
    if (stack <= 0)
      throw new IllegalStateException("can't reduce ROOT: " + this);
    reduced.set(stack);
    stack = previousNonReduced(stack);
  }

  private int previousNonReduced(int i) {
    int j = reduced.previousClearBit(i - 1);
    // ROOT is never reduced, so we always land somewhere
    assert j >= 0;
    return j;
  }

  @Override
  public String toString() {
    return "[ParseState: " + stack + ", " + input + " reduced=" + reduced + "]";
  }
}
