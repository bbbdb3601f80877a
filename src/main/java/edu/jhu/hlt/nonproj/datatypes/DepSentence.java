package edu.jhu.hlt.nonproj.datatypes;

import edu.jhu.hlt.nonproj.parse.DepToken;

/**
 * A tokenized and POS tagged sentence, optionally with a gold
 * {@link DependencyParse}. Arrays here are over words only (no ROOT); see
 * {@link #toDepTokens()} for the parser's view.
 *
 * @author travis
 */
public class DepSentence {

  private final String id;
  private final String[] forms;
  private final String[] lemmas;
  private final String[] pos;
  private final DependencyParse gold;   // may be null

  public DepSentence(String id, String[] forms, String[] lemmas, String[] pos) {
    this(id, forms, lemmas, pos, null);
  }

  public DepSentence(String id, String[] forms, String[] lemmas, String[] pos, DependencyParse gold) {
    if (forms.length != lemmas.length || forms.length != pos.length)
      throw new IllegalArgumentException("id=" + id + " forms=" + forms.length
          + " lemmas=" + lemmas.length + " pos=" + pos.length);
    if (gold != null && gold.size() != forms.length + 1)
      throw new IllegalArgumentException("id=" + id + " gold.size=" + gold.size()
          + " but there are " + forms.length + " words");
    this.id = id;
    this.forms = forms;
    this.lemmas = lemmas;
    this.pos = pos;
    this.gold = gold;
  }

  public String getId() {
    return id;
  }

  /** Number of words, not counting ROOT */
  public int size() {
    return forms.length;
  }

  /** i is a word index (0-based, ROOT not counted) */
  public String getWord(int i) {
    return forms[i];
  }

  public String getLemma(int i) {
    return lemmas[i];
  }

  public String getPos(int i) {
    return pos[i];
  }

  public boolean hasGoldParse() {
    return gold != null;
  }

  public DependencyParse getGoldParse() {
    return gold;
  }

  /** A fresh token array with ROOT at index 0 */
  public DepToken[] toDepTokens() {
    return DepToken.sentence(forms, lemmas, pos);
  }

  @Override
  public String toString() {
    return "(DepSentence " + id + " " + String.join(" ", forms) + ")";
  }
}
