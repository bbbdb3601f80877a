package edu.jhu.hlt.nonproj.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Small hand-built sentences (and random trees) shared by tests.
 */
public class SentenceFixtures {

  public static DepSentence make(String id, String[] forms, String[] pos, int[] wordHeads, String[] wordLabels) {
    int n = forms.length;
    String[] lemmas = new String[n];
    for (int i = 0; i < n; i++)
      lemmas[i] = forms[i].toLowerCase();
    DependencyParse gold = null;
    if (wordHeads != null) {
      int[] heads = new int[n + 1];
      String[] labels = new String[n + 1];
      heads[0] = DependencyParse.NO_HEAD;
      labels[0] = "";
      for (int i = 0; i < n; i++) {
        heads[i + 1] = wordHeads[i];
        labels[i + 1] = wordLabels[i];
      }
      gold = new DependencyParse(heads, labels);
    }
    return new DepSentence(id, forms, lemmas, pos, gold);
  }

  /** the(1) <-det- dog(2) <-nsubj- barks(3) <-root- ROOT */
  public static DepSentence theDogBarks() {
    return make("theDogBarks",
        new String[] {"the", "dog", "barks"},
        new String[] {"DT", "NN", "VBZ"},
        new int[] {2, 3, 0},
        new String[] {"det", "nsubj", "root"});
  }

  /** John saw a dog yesterday, projective */
  public static DepSentence johnSawADog() {
    return make("johnSawADog",
        new String[] {"John", "saw", "a", "dog", "yesterday"},
        new String[] {"NNP", "VBD", "DT", "NN", "NN"},
        new int[] {2, 0, 4, 2, 2},
        new String[] {"nsubj", "root", "det", "dobj", "tmod"});
  }

  /** Arcs 1->3 and 2->4 cross */
  public static DepSentence crossing() {
    return make("crossing",
        new String[] {"A", "B", "C", "D"},
        new String[] {"X", "Y", "Z", "W"},
        new int[] {0, 1, 1, 2},
        new String[] {"root", "a", "b", "c"});
  }

  /** 1 <- 3, 3 <- 2, 2 <- ROOT: the ROOT arc crosses 3->1 */
  public static DepSentence crossingRoot() {
    return make("crossingRoot",
        new String[] {"x", "y", "z"},
        new String[] {"P", "Q", "R"},
        new int[] {3, 0, 2},
        new String[] {"l1", "root", "l3"});
  }

  /**
   * A uniformly shaped random tree: words are attached in random order, each
   * to ROOT or to a word already in the tree.
   */
  public static DepSentence randomTree(String id, int n, Random rand) {
    List<Integer> order = new ArrayList<>();
    for (int i = 1; i <= n; i++)
      order.add(i);
    Collections.shuffle(order, rand);
    int[] heads = new int[n];
    String[] labels = new String[n];
    List<Integer> placed = new ArrayList<>();
    placed.add(0);
    for (int w : order) {
      int h = placed.get(rand.nextInt(placed.size()));
      heads[w - 1] = h;
      labels[w - 1] = "L" + rand.nextInt(3);
      placed.add(w);
    }
    String[] forms = new String[n];
    String[] pos = new String[n];
    for (int i = 0; i < n; i++) {
      forms[i] = "w" + (i + 1);
      pos[i] = "P" + rand.nextInt(4);
    }
    return make(id, forms, pos, heads, labels);
  }
}
