package edu.jhu.hlt.nonproj.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

import org.apache.log4j.Logger;

import edu.jhu.hlt.nonproj.datatypes.DepSentence;
import edu.jhu.hlt.nonproj.features.FeatureAlphabet;
import edu.jhu.hlt.nonproj.features.FeatureGenerator;
import edu.jhu.hlt.nonproj.features.ParserFeatureTemplates;
import edu.jhu.hlt.nonproj.features.StateFeatures;
import edu.jhu.hlt.nonproj.parse.IllegalTransitionException;
import edu.jhu.hlt.nonproj.parse.ParseDecision;
import edu.jhu.hlt.nonproj.parse.ParseState;
import edu.jhu.hlt.nonproj.parse.TransitionSystem;
import edu.jhu.hlt.nonproj.parse.TransitionSystem.ReducePolicy;
import edu.jhu.hlt.nonproj.util.ExperimentProperties;
import edu.jhu.hlt.nonproj.util.Timer;

/**
 * Drives a {@link ParseState} from its initial configuration to a terminal one
 * by repeatedly computing features, asking a {@link DecisionFunction} for a
 * transition and applying it.
 *
 * The parser doesn't know whether it is training or predicting: for training
 * data use {@link #replay(DepSentence)}, which drives it with a
 * {@link GoldOracle} and records what it saw.
 *
 * One sentence is parsed sequentially, but a parser (its feature generators,
 * transition system and alphabet) can be shared by many threads, see
 * {@link #parseAll(List, Function)}.
 *
 * @author travis
 */
public class TransitionParser {
  public static final Logger LOG = Logger.getLogger(TransitionParser.class);

  /** Called after features are computed and a decision made, before it is applied */
  public interface StepListener {
    void observe(ParseState state, StateFeatures features, ParseDecision decision);
  }

  private final FeatureGenerator features;
  private final TransitionSystem transitions;
  private FeatureAlphabet alphabet;         // may be null
  private boolean attachOrphansToRoot = false;
  private String orphanLabel = "root";
  private int threads = 1;

  public TransitionParser(FeatureGenerator features, TransitionSystem transitions) {
    if (features == null || transitions == null)
      throw new IllegalArgumentException();
    this.features = features;
    this.transitions = transitions;
  }

  /**
   * Reads: features (file or classpath resource), reducePolicy,
   * attachOrphansToRoot, orphanLabel, threads, features.hashDimension
   * (0 means don't index features).
   */
  public static TransitionParser fromConfig(ExperimentProperties config) {
    FeatureGenerator fg = ParserFeatureTemplates.load(
        config.getString("features", ParserFeatureTemplates.DEFAULT_RESOURCE));
    ReducePolicy rp = config.getEnum("reducePolicy", ReducePolicy.class, ReducePolicy.REQUIRE_HEAD);
    TransitionParser p = new TransitionParser(fg, new TransitionSystem(rp));
    p.attachOrphansToRoot = config.getBoolean("attachOrphansToRoot", false);
    p.orphanLabel = config.getString("orphanLabel", "root");
    p.threads = config.getInt("threads", 1);
    int dim = config.getInt("features.hashDimension", 0);
    if (dim > 0)
      p.alphabet = new FeatureAlphabet(dim);
    LOG.info("[fromConfig] reducePolicy=" + rp
        + " attachOrphansToRoot=" + p.attachOrphansToRoot
        + " threads=" + p.threads
        + " hashDimension=" + dim);
    return p;
  }

  public TransitionSystem getTransitionSystem() {
    return transitions;
  }

  public FeatureGenerator getFeatures() {
    return features;
  }

  /**
   * If set, every state's features are also looked up in this alphabet (which
   * grows until frozen) and the decision function sees their indices through
   * {@link StateFeatures#getIndices()}.
   */
  public void setAlphabet(FeatureAlphabet alphabet) {
    this.alphabet = alphabet;
  }

  public FeatureAlphabet getAlphabet() {
    return alphabet;
  }

  public void setAttachOrphansToRoot(boolean attach, String label) {
    this.attachOrphansToRoot = attach;
    this.orphanLabel = label;
  }

  public void setThreads(int threads) {
    if (threads < 1)
      throw new IllegalArgumentException("threads=" + threads);
    this.threads = threads;
  }

  public ParseResult parse(DepSentence sentence, DecisionFunction df) {
    return parse(sentence, df, null);
  }

  /**
   * Runs the transition loop on a fresh state for this sentence. Illegal
   * decisions are not thrown, they abandon the sentence and come back as a
   * {@link ParseResult.Status#FAILED} result.
   */
  public ParseResult parse(DepSentence sentence, DecisionFunction df, StepListener listener) {
    ParseState state = new ParseState(sentence.toDepTokens());
    int steps = 0;
    while (!state.isTerminal()) {
      StateFeatures f = StateFeatures.extract(state, features);
      if (alphabet != null)
        f = f.withIndices(alphabet);
      ParseDecision d = df.decide(state, f);
      if (d == null) {
        return ParseResult.failed(sentence, state, steps,
            new IllegalStateException("decision function returned null at " + state));
      }
      if (listener != null)
        listener.observe(state, f, d);
      try {
        transitions.apply(state, d);
      } catch (IllegalTransitionException e) {
        LOG.warn("[parse] abandoning " + sentence.getId() + " after " + steps
            + " transitions: " + e.getMessage());
        return ParseResult.failed(sentence, state, steps, e);
      }
      steps++;
    }

    int[] headless = ParseResult.headlessWords(state);
    if (headless.length > 0) {
      if (LOG.isDebugEnabled())
        LOG.debug("[parse] " + sentence.getId() + " has " + headless.length + " words without heads");
      if (attachOrphansToRoot) {
        for (int i : headless)
          state.setHead(i, 0, orphanLabel);
      }
    }
    return ParseResult.finished(sentence, state, headless, steps);
  }

  /** The oracle's decisions on one sentence along with the features it saw. */
  public static class Replay {
    public final List<TrainingExample> examples;
    public final ParseResult result;

    public Replay(List<TrainingExample> examples, ParseResult result) {
      this.examples = examples;
      this.result = result;
    }

    /** True if the oracle rebuilt exactly the gold tree */
    public boolean matchesGold() {
      return result.isComplete()
          && result.getParse().equals(result.getSentence().getGoldParse());
    }
  }

  /**
   * Drives the parser with a {@link GoldOracle} for the sentence's gold parse,
   * recording one {@link TrainingExample} per transition.
   */
  public Replay replay(DepSentence sentence) {
    if (!sentence.hasGoldParse())
      throw new IllegalArgumentException("no gold parse for " + sentence.getId());
    List<TrainingExample> examples = new ArrayList<>();
    ParseResult r = parse(sentence, new GoldOracle(sentence.getGoldParse()),
        (state, f, d) -> examples.add(new TrainingExample(f, d)));
    Replay rep = new Replay(examples, r);
    if (!rep.matchesGold())
      LOG.warn("[replay] oracle did not reproduce the gold parse for " + sentence.getId() + ": " + r);
    return rep;
  }

  /**
   * Parses many sentences, in parallel if threads > 1. Each sentence gets its
   * own {@link DecisionFunction} from dfs (which may hand back the same
   * instance every time if it is thread safe). Results are in input order.
   */
  public List<ParseResult> parseAll(List<DepSentence> sentences,
      Function<DepSentence, DecisionFunction> dfs) {
    Timer t = new Timer("parseAll", 0);
    t.start();
    List<ParseResult> results = mapAll(sentences, s -> parse(s, dfs.apply(s)));
    t.stop();
    int failed = 0, incomplete = 0;
    for (ParseResult r : results) {
      if (r.getStatus() == ParseResult.Status.FAILED)
        failed++;
      else if (r.getStatus() == ParseResult.Status.INCOMPLETE)
        incomplete++;
    }
    LOG.info("[parseAll] parsed " + results.size() + " sentences, failed=" + failed
        + " incomplete=" + incomplete + " " + t);
    return results;
  }

  /**
   * {@link #replay(DepSentence)} for every sentence, in parallel if threads > 1.
   * Every sentence needs a gold parse which is a tree. Results are in input order.
   */
  public List<Replay> replayAll(List<DepSentence> sentences) {
    Timer t = new Timer("replayAll", 0);
    t.start();
    List<Replay> replays = mapAll(sentences, this::replay);
    t.stop();
    LOG.info("[replayAll] replayed " + replays.size() + " sentences " + t);
    return replays;
  }

  private <T> List<T> mapAll(List<DepSentence> sentences, Function<DepSentence, T> f) {
    List<T> results = new ArrayList<>(sentences.size());
    if (threads <= 1) {
      for (DepSentence s : sentences)
        results.add(f.apply(s));
      return results;
    }
    LOG.info("[mapAll] using " + threads + " threads for " + sentences.size() + " sentences");
    ExecutorService es = Executors.newWorkStealingPool(threads);
    try {
      List<Future<T>> futures = new ArrayList<>();
      for (DepSentence s : sentences)
        futures.add(es.submit(() -> f.apply(s)));
      for (Future<T> fut : futures)
        results.add(fut.get());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("interrupted after " + results.size() + " sentences", e);
    } catch (ExecutionException e) {
      throw new RuntimeException(e.getCause());
    } finally {
      es.shutdownNow();
    }
    return results;
  }
}
