package edu.jhu.hlt.nonproj.parse;

/**
 * A word as seen by the parser: surface form, lemma, part of speech and its
 * index in the sentence. Index 0 is reserved for {@link #ROOT}, and
 * {@link #NULL} (index -1) is returned by lookups which fall off the sentence.
 *
 * Tokens are immutable and never point at other tokens. Arcs live in
 * {@link ParseState}, which is why many states may share one token array.
 *
 * Equality is identity.
 *
 * @author travis
 */
public final class DepToken {

  public static final DepToken ROOT = new DepToken("<ROOT>-f", "<ROOT>-m", "<ROOT>-p", 0);
  public static final DepToken NULL = new DepToken("<NULL>-f", "<NULL>-m", "<NULL>-p", -1);

  public final String form;
  public final String lemma;
  public final String pos;
  public final int idx;

  public DepToken(String form, String lemma, String pos, int idx) {
    if (form == null || lemma == null || pos == null)
      throw new IllegalArgumentException("form=" + form + " lemma=" + lemma + " pos=" + pos);
    if (idx < -1)
      throw new IllegalArgumentException("idx=" + idx);
    this.form = form;
    this.lemma = lemma;
    this.pos = pos;
    this.idx = idx;
  }

  public boolean isRoot() {
    return this == ROOT;
  }

  public boolean isNull() {
    return this == NULL;
  }

  /**
   * Builds the token array a {@link ParseState} runs over, with {@link #ROOT}
   * prepended (so word i of the input ends up at index i+1).
   */
  public static DepToken[] sentence(String[] forms, String[] lemmas, String[] pos) {
    int n = forms.length;
    if (lemmas.length != n || pos.length != n)
      throw new IllegalArgumentException("forms=" + n + " lemmas=" + lemmas.length + " pos=" + pos.length);
    DepToken[] toks = new DepToken[n + 1];
    toks[0] = ROOT;
    for (int i = 0; i < n; i++)
      toks[i + 1] = new DepToken(forms[i], lemmas[i], pos[i], i + 1);
    return toks;
  }

  @Override
  public String toString() {
    return "(" + idx + ", f: " + form + ", l: " + lemma + ", p: " + pos + ")";
  }
}
