package edu.jhu.hlt.nonproj.inference;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import edu.jhu.hlt.nonproj.datatypes.DepSentence;
import edu.jhu.hlt.nonproj.datatypes.DependencyParse;
import edu.jhu.hlt.nonproj.datatypes.SentenceFixtures;
import edu.jhu.hlt.nonproj.features.FeatureAlphabet;
import edu.jhu.hlt.nonproj.features.ParserFeatureTemplates;
import edu.jhu.hlt.nonproj.inference.ParseResult.Arc;
import edu.jhu.hlt.nonproj.inference.ParseResult.Status;
import edu.jhu.hlt.nonproj.inference.TransitionParser.Replay;
import edu.jhu.hlt.nonproj.parse.IllegalTransitionException;
import edu.jhu.hlt.nonproj.parse.ParseDecision;
import edu.jhu.hlt.nonproj.parse.TransitionSystem;

public class TransitionParserTest {

  private static TransitionParser parser() {
    return new TransitionParser(
        ParserFeatureTemplates.defaultTemplates(),
        TransitionSystem.DEFAULT);
  }

  @Test
  public void replayReproducesGold() {
    TransitionParser p = parser();
    for (DepSentence s : Arrays.asList(
        SentenceFixtures.theDogBarks(),
        SentenceFixtures.johnSawADog(),
        SentenceFixtures.crossing(),
        SentenceFixtures.crossingRoot())) {
      Replay r = p.replay(s);
      assertTrue(s.getId(), r.matchesGold());
      assertEquals(Status.COMPLETE, r.result.getStatus());
      assertEquals(0, r.result.getHeadless().length);
      assertEquals(r.result.getNumTransitions(), r.examples.size());
      assertEquals(s.size(), r.result.getArcs().size());
    }
  }

  @Test
  public void arcTriples() {
    Replay r = parser().replay(SentenceFixtures.johnSawADog());
    Set<Arc> expected = new HashSet<>(Arrays.asList(
        new Arc(1, 2, "nsubj"),
        new Arc(2, 0, "root"),
        new Arc(3, 4, "det"),
        new Arc(4, 2, "dobj"),
        new Arc(5, 2, "tmod")));
    assertEquals(expected, new HashSet<>(r.result.getArcs()));
  }

  @Test
  public void examplesSeeStateBeforeDecision() {
    Replay r = parser().replay(SentenceFixtures.theDogBarks());
    TrainingExample first = r.examples.get(0);
    assertEquals(ParseDecision.NO_SHIFT, first.decision);
    List<String> f = first.features.getNames();
    assertTrue(f.contains("s0.form=<ROOT>-f"));
    assertTrue(f.contains("i0.form=the"));
    assertTrue(f.contains("i1.pos=NN"));
    assertTrue(f.contains("s-1.pos=<NULL>-p"));
    assertTrue(f.contains("dist=1"));
    assertTrue(first.toLine().startsWith("no-shift\t"));

    // after no-shift and left-reduce:det, dog is the input and its leftmost dependent is the
    TrainingExample third = r.examples.get(2);
    assertTrue(third.features.getNames().contains("i0.lmd.label=det"));
    assertTrue(third.features.getNames().contains("i0.form=dog"));
  }

  @Test
  public void alwaysShiftingLeavesWordsHeadless() {
    TransitionParser p = parser();
    DepSentence s = SentenceFixtures.johnSawADog();
    ParseResult r = p.parse(s, (state, f) -> ParseDecision.NO_SHIFT);
    assertEquals(Status.INCOMPLETE, r.getStatus());
    assertEquals(5, r.getHeadless().length);
    assertEquals(5, r.getNumTransitions());
    assertTrue(r.getArcs().isEmpty());
    assertEquals(DependencyParse.NO_HEAD, r.getParse().getHead(3));

    p.setAttachOrphansToRoot(true, "orphan");
    r = p.parse(s, (state, f) -> ParseDecision.NO_SHIFT);
    assertEquals(Status.INCOMPLETE, r.getStatus());
    assertEquals(5, r.getHeadless().length);
    for (int i = 1; i <= 5; i++) {
      assertEquals(0, r.getParse().getHead(i));
      assertEquals("orphan", r.getParse().getLabel(i));
    }
  }

  @Test
  public void illegalDecisionAbandonsSentence() {
    TransitionParser p = parser();
    DepSentence s = SentenceFixtures.theDogBarks();
    List<ParseDecision> script = new ArrayList<>(Arrays.asList(
        ParseDecision.NO_SHIFT,
        ParseDecision.left(ParseDecision.Action.REDUCE, "det"),
        ParseDecision.NO_REDUCE));  // can't reduce ROOT
    ParseResult r = p.parse(s, (state, f) -> script.remove(0));
    assertEquals(Status.FAILED, r.getStatus());
    assertTrue(r.getError() instanceof IllegalTransitionException);
    assertEquals(2, r.getNumTransitions());
    // the arc made before the failure is still reported
    assertEquals(Arrays.asList(new Arc(1, 2, "det")), r.getArcs());
  }

  @Test
  public void nullDecisionFails() {
    ParseResult r = parser().parse(SentenceFixtures.theDogBarks(), (state, f) -> null);
    assertEquals(Status.FAILED, r.getStatus());
    assertEquals(0, r.getNumTransitions());
  }

  @Test
  public void parallelMatchesSequential() {
    Random rand = new Random(42);
    List<DepSentence> sents = new ArrayList<>();
    for (int i = 0; i < 50; i++)
      sents.add(SentenceFixtures.randomTree("r" + i, 1 + rand.nextInt(15), rand));

    TransitionParser p = parser();
    List<ParseResult> seq = p.parseAll(sents, s -> new GoldOracle(s.getGoldParse()));
    p.setThreads(4);
    List<ParseResult> par = p.parseAll(sents, s -> new GoldOracle(s.getGoldParse()));
    assertEquals(sents.size(), par.size());
    for (int i = 0; i < sents.size(); i++) {
      assertSame(sents.get(i), par.get(i).getSentence());
      assertTrue(par.get(i).isComplete());
      assertEquals(sents.get(i).getGoldParse(), par.get(i).getParse());
      assertEquals(seq.get(i).getParse(), par.get(i).getParse());
    }
  }

  @Test
  public void sharedAlphabetGrows() {
    TransitionParser p = parser();
    FeatureAlphabet alph = new FeatureAlphabet();
    p.setAlphabet(alph);
    p.replay(SentenceFixtures.johnSawADog());
    int size = alph.size();
    assertTrue(size > 0);
    alph.freeze();
    p.replay(SentenceFixtures.crossing());
    assertEquals(size, alph.size());
  }

  @Test
  public void decisionFunctionSeesIndices() {
    TransitionParser p = parser();
    FeatureAlphabet alph = new FeatureAlphabet();
    p.setAlphabet(alph);
    GoldOracle oracle = new GoldOracle(SentenceFixtures.theDogBarks().getGoldParse());
    List<int[]> seen = new ArrayList<>();
    ParseResult r = p.parse(SentenceFixtures.theDogBarks(), (state, f) -> {
      int[] idx = f.getIndices();
      assertNotNull(idx);
      assertEquals(f.size(), idx.length);
      for (int i = 0; i < idx.length; i++)
        assertEquals(f.getNames().get(i), alph.lookupObject(idx[i]));
      seen.add(idx);
      return oracle.decide(state, f);
    });
    assertTrue(r.isComplete());
    assertEquals(r.getNumTransitions(), seen.size());

    p.setAlphabet(null);
    p.parse(SentenceFixtures.theDogBarks(), (state, f) -> {
      assertNull(f.getIndices());
      return oracle.decide(state, f);
    });
  }

  @Test
  public void hashedIndicesStayInRange() {
    TransitionParser p = parser();
    p.setAlphabet(new FeatureAlphabet(32));
    GoldOracle oracle = new GoldOracle(SentenceFixtures.johnSawADog().getGoldParse());
    p.parse(SentenceFixtures.johnSawADog(), (state, f) -> {
      assertEquals(f.size(), f.getIndices().length);
      for (int i : f.getIndices())
        assertTrue(i >= 0 && i < 32);
      return oracle.decide(state, f);
    });
  }

  @Test
  public void replayAllKeepsOrder() {
    Random rand = new Random(3);
    List<DepSentence> sents = new ArrayList<>();
    for (int i = 0; i < 30; i++)
      sents.add(SentenceFixtures.randomTree("r" + i, 1 + rand.nextInt(10), rand));
    TransitionParser p = parser();
    p.setThreads(3);
    List<Replay> reps = p.replayAll(sents);
    assertEquals(sents.size(), reps.size());
    for (int i = 0; i < sents.size(); i++) {
      assertSame(sents.get(i), reps.get(i).result.getSentence());
      assertTrue(reps.get(i).matchesGold());
    }
  }
}
