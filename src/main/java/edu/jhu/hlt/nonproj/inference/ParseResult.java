package edu.jhu.hlt.nonproj.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import edu.jhu.hlt.nonproj.datatypes.DepSentence;
import edu.jhu.hlt.nonproj.datatypes.DependencyParse;
import edu.jhu.hlt.nonproj.parse.DepArc;
import edu.jhu.hlt.nonproj.parse.ParseState;

/**
 * What came out of parsing one sentence. A parse can be:
 * <ul>
 * <li>COMPLETE: every word got exactly one head</li>
 * <li>INCOMPLETE: the parser reached the end of the sentence but some words
 *     have no head (see {@link #getHeadless()})</li>
 * <li>FAILED: the decision function asked for an illegal transition, the
 *     sentence was abandoned (see {@link #getError()})</li>
 * </ul>
 * Arcs built before a failure are still reported.
 *
 * @author travis
 */
public class ParseResult {

  public enum Status {
    COMPLETE, INCOMPLETE, FAILED;
  }

  /** A (dependent, head, label) triple, indices as in the token array (ROOT = 0) */
  public static final class Arc {
    public final int dependent;
    public final int head;
    public final String label;

    public Arc(int dependent, int head, String label) {
      this.dependent = dependent;
      this.head = head;
      this.label = label;
    }

    @Override
    public int hashCode() {
      return (dependent * 31 + head) * 31 + label.hashCode();
    }

    @Override
    public boolean equals(Object other) {
      if (other instanceof Arc) {
        Arc a = (Arc) other;
        return dependent == a.dependent && head == a.head && label.equals(a.label);
      }
      return false;
    }

    @Override
    public String toString() {
      return head + "->" + dependent + ":" + label;
    }
  }

  private final DepSentence sentence;
  private final Status status;
  private final List<Arc> arcs;
  private final DependencyParse parse;
  private final int[] headless;
  private final int numTransitions;
  private final RuntimeException error;

  private ParseResult(DepSentence sentence, Status status, List<Arc> arcs,
      DependencyParse parse, int[] headless, int numTransitions, RuntimeException error) {
    this.sentence = sentence;
    this.status = status;
    this.arcs = arcs;
    this.parse = parse;
    this.headless = headless;
    this.numTransitions = numTransitions;
    this.error = error;
  }

  /**
   * Reads the arcs out of a state.
   * @param headless words which had no head when the parser finished, may be
   * different from the words without heads in state if they were attached
   * after the fact.
   */
  static ParseResult finished(DepSentence sentence, ParseState state, int[] headless, int numTransitions) {
    Status st = headless.length == 0 ? Status.COMPLETE : Status.INCOMPLETE;
    return build(sentence, state, st, headless, numTransitions, null);
  }

  static ParseResult failed(DepSentence sentence, ParseState state, int numTransitions, RuntimeException error) {
    return build(sentence, state, Status.FAILED, headlessWords(state), numTransitions, error);
  }

  private static ParseResult build(DepSentence sentence, ParseState state, Status status,
      int[] headless, int numTransitions, RuntimeException error) {
    int n = state.size();
    List<Arc> arcs = new ArrayList<>();
    int[] heads = new int[n];
    String[] labels = new String[n];
    heads[0] = DependencyParse.NO_HEAD;
    labels[0] = "";
    for (int i = 1; i < n; i++) {
      DepArc a = state.getArc(i);
      if (a == null) {
        heads[i] = DependencyParse.NO_HEAD;
        labels[i] = "";
      } else {
        heads[i] = a.head;
        labels[i] = a.label;
        arcs.add(new Arc(i, a.head, a.label));
      }
    }
    return new ParseResult(sentence, status, Collections.unmodifiableList(arcs),
        new DependencyParse(heads, labels), headless, numTransitions, error);
  }

  static int[] headlessWords(ParseState state) {
    int n = state.size();
    int c = 0;
    int[] h = new int[n];
    for (int i = 1; i < n; i++) {
      if (!state.hasHead(i))
        h[c++] = i;
    }
    int[] r = new int[c];
    System.arraycopy(h, 0, r, 0, c);
    return r;
  }

  public DepSentence getSentence() {
    return sentence;
  }

  public Status getStatus() {
    return status;
  }

  public boolean isComplete() {
    return status == Status.COMPLETE;
  }

  public List<Arc> getArcs() {
    return arcs;
  }

  public DependencyParse getParse() {
    return parse;
  }

  public int[] getHeadless() {
    return headless;
  }

  public int getNumTransitions() {
    return numTransitions;
  }

  /** null unless FAILED */
  public RuntimeException getError() {
    return error;
  }

  @Override
  public String toString() {
    String id = sentence == null ? "?" : sentence.getId();
    return "(ParseResult " + id + " " + status + " arcs=" + arcs.size()
        + " transitions=" + numTransitions
        + (error == null ? "" : " error=" + error.getMessage()) + ")";
  }
}
