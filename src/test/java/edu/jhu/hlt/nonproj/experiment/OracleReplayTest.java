package edu.jhu.hlt.nonproj.experiment;

import static org.junit.Assert.*;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import edu.jhu.hlt.nonproj.datatypes.DepSentence;
import edu.jhu.hlt.nonproj.datatypes.SentenceFixtures;
import edu.jhu.hlt.nonproj.features.ParserFeatureTemplates;
import edu.jhu.hlt.nonproj.inference.TransitionParser;
import edu.jhu.hlt.nonproj.parse.ParseDecision;
import edu.jhu.hlt.nonproj.parse.TransitionSystem;

public class OracleReplayTest {

  @Test
  public void writesOneLinePerTransition() throws IOException {
    TransitionParser p = new TransitionParser(
        ParserFeatureTemplates.fromLines(Arrays.asList("s0.pos", "i0.pos")),
        TransitionSystem.DEFAULT);
    List<DepSentence> sents = Arrays.asList(
        SentenceFixtures.johnSawADog(),
        SentenceFixtures.crossing(),
        SentenceFixtures.make("noGold", new String[] {"hi"}, new String[] {"UH"}, null, null));
    StringWriter sw = new StringWriter();
    OracleReplay.Stats st;
    try (BufferedWriter w = new BufferedWriter(sw)) {
      st = new OracleReplay(p).run(sents, w);
    }
    assertEquals(2, st.sentences);
    assertEquals(1, st.nonProjective);
    assertEquals(0, st.mismatches);
    assertEquals(8 + 6, st.transitions);
    assertEquals(Integer.valueOf(1), st.decisionCounts.get("no-pass"));

    String[] lines = sw.toString().split("\n");
    assertEquals("no-shift\ts0.pos=<ROOT>-p i0.pos=NNP", lines[0]);
    int examples = 0;
    for (String line : lines) {
      if (line.isEmpty())
        continue;
      examples++;
      String[] parts = line.split("\t");
      assertEquals(2, parts.length);
      ParseDecision.fromShortString(parts[0]);
    }
    assertEquals(st.transitions, examples);
  }

  @Test
  public void skipsGoldParsesWhichAreNotTrees() throws IOException {
    TransitionParser p = new TransitionParser(
        ParserFeatureTemplates.fromLines(Arrays.asList("s0.pos", "i0.pos")),
        TransitionSystem.DEFAULT);
    DepSentence cycle = SentenceFixtures.make("cycle",
        new String[] {"a", "b"}, new String[] {"X", "Y"},
        new int[] {2, 1}, new String[] {"x", "y"});
    StringWriter sw = new StringWriter();
    OracleReplay.Stats st;
    try (BufferedWriter w = new BufferedWriter(sw)) {
      st = new OracleReplay(p).run(Arrays.asList(cycle, SentenceFixtures.theDogBarks()), w);
    }
    assertEquals(1, st.notTrees);
    assertEquals(1, st.sentences);
    assertEquals(0, st.mismatches);
    assertEquals(5, st.transitions);
    assertTrue(sw.toString().startsWith("no-shift\ts0.pos=<ROOT>-p i0.pos=DT"));
  }

  @Test
  public void parallelOutputMatchesSequential() throws IOException {
    Random rand = new Random(7);
    List<DepSentence> sents = new ArrayList<>();
    for (int i = 0; i < 40; i++)
      sents.add(SentenceFixtures.randomTree("r" + i, 1 + rand.nextInt(12), rand));

    TransitionParser p = new TransitionParser(
        ParserFeatureTemplates.defaultTemplates(), TransitionSystem.DEFAULT);
    StringWriter seq = new StringWriter();
    try (BufferedWriter w = new BufferedWriter(seq)) {
      new OracleReplay(p).run(sents, w);
    }
    p.setThreads(4);
    StringWriter par = new StringWriter();
    OracleReplay.Stats st;
    try (BufferedWriter w = new BufferedWriter(par)) {
      st = new OracleReplay(p).run(sents, w);
    }
    assertEquals(40, st.sentences);
    assertEquals(0, st.mismatches);
    assertEquals(seq.toString(), par.toString());
  }
}
