package edu.jhu.hlt.nonproj.experiment;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.jhu.hlt.nonproj.data.ConllxReader;
import edu.jhu.hlt.nonproj.datatypes.DepSentence;
import edu.jhu.hlt.nonproj.inference.TrainingExample;
import edu.jhu.hlt.nonproj.inference.TransitionParser;
import edu.jhu.hlt.nonproj.inference.TransitionParser.Replay;
import edu.jhu.hlt.nonproj.util.ExperimentProperties;

/**
 * Replays the gold oracle over a CoNLL-X treebank and writes out one training
 * example per transition ("decision TAB features"), which is what a classifier
 * for the parser gets trained on.
 *
 * Usage: OracleReplay conllx train.conll output train.examples [features my-features.txt] [threads 4]
 *
 * Sentences without a gold parse, or whose gold heads don't form a tree, are
 * skipped (and counted).
 *
 * @author travis
 */
public class OracleReplay {
  public static final Logger LOG = Logger.getLogger(OracleReplay.class);

  /** Summary counts from one run */
  public static class Stats {
    public int sentences;
    public int notTrees;
    public int nonProjective;
    public int transitions;
    public int mismatches;
    public final Map<String, Integer> decisionCounts = new HashMap<>();

    @Override
    public String toString() {
      return "sentences=" + sentences + " notTrees=" + notTrees
          + " nonProjective=" + nonProjective
          + " transitions=" + transitions + " mismatches=" + mismatches
          + " decisions=" + decisionCounts;
    }
  }

  private final TransitionParser parser;

  public OracleReplay(TransitionParser parser) {
    this.parser = parser;
  }

  /**
   * Replays every sentence which has a gold tree, writing examples to w (if not
   * null) in input order.
   */
  public Stats run(List<DepSentence> sentences, BufferedWriter w) throws IOException {
    Stats st = new Stats();
    List<DepSentence> usable = new ArrayList<>(sentences.size());
    for (DepSentence s : sentences) {
      if (!s.hasGoldParse()) {
        LOG.debug("skipping " + s.getId() + " which has no gold parse");
      } else if (!s.getGoldParse().isTree()) {
        LOG.warn("skipping " + s.getId() + " whose gold parse is not a tree: " + s.getGoldParse());
        st.notTrees++;
      } else {
        usable.add(s);
      }
    }
    for (Replay r : parser.replayAll(usable)) {
      st.sentences++;
      if (!r.result.getSentence().getGoldParse().isProjective())
        st.nonProjective++;
      if (!r.matchesGold())
        st.mismatches++;
      for (TrainingExample e : r.examples) {
        st.transitions++;
        String k = e.decision.buildsArc()
            ? e.decision.direction.name().toLowerCase() + "-" + e.decision.action.name().toLowerCase()
            : e.decision.toShortString();
        st.decisionCounts.merge(k, 1, Integer::sum);
        if (w != null) {
          w.write(e.toLine());
          w.newLine();
        }
      }
      if (w != null)
        w.newLine();
    }
    return st;
  }

  public static void main(String[] args) throws IOException {
    ExperimentProperties config = ExperimentProperties.init(args);
    File conllx = config.getExistingFile("conllx");
    File output = config.getFile("output");
    TransitionParser parser = TransitionParser.fromConfig(config);

    List<DepSentence> sentences = ConllxReader.readAll(conllx);
    OracleReplay or = new OracleReplay(parser);
    Stats st;
    try (BufferedWriter w = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
      st = or.run(sentences, w);
    }
    LOG.info("[main] wrote examples to " + output.getPath() + ": " + st);
    if (st.mismatches > 0)
      LOG.warn("[main] " + st.mismatches + " sentences were not reproduced by the oracle");
  }
}
