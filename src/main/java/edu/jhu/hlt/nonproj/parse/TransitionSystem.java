package edu.jhu.hlt.nonproj.parse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import edu.jhu.hlt.nonproj.parse.ParseDecision.Action;
import edu.jhu.hlt.nonproj.parse.ParseDecision.Direction;

/**
 * Checks and applies {@link ParseDecision}s to a {@link ParseState}.
 *
 * A decision is validated in full (arc and move) before the state is touched,
 * so a rejected decision never leaves a half-built arc behind. The arc is built
 * first, then the move:
 * <ul>
 * <li>SHIFT: stack := input, input++</li>
 * <li>PASS: the stack pointer retreats to the previous non-reduced token</li>
 * <li>REDUCE: the stack top is marked reduced, then the pointer retreats</li>
 * </ul>
 *
 * Instances are immutable and can be shared between threads.
 *
 * @author travis
 */
public class TransitionSystem {

  /** When REDUCE may pop a stack token. */
  public enum ReducePolicy {
    /** The stack top (after any arc in the same decision) must have a head. */
    REQUIRE_HEAD,
    /** Tokens may be reduced without a head, e.g. when they are known to be unattachable. */
    ALLOW_HEADLESS;
  }

  public static final TransitionSystem DEFAULT = new TransitionSystem(ReducePolicy.REQUIRE_HEAD);

  private final ReducePolicy reducePolicy;

  public TransitionSystem(ReducePolicy reducePolicy) {
    if (reducePolicy == null)
      throw new IllegalArgumentException();
    this.reducePolicy = reducePolicy;
  }

  public ReducePolicy getReducePolicy() {
    return reducePolicy;
  }

  /**
   * Returns null if d can be applied to s, otherwise a reason why it can't.
   */
  public String whyIllegal(ParseState s, ParseDecision d) {
    if (s.isTerminal())
      return "state is terminal";
    int stack = s.getStack();
    int input = s.getInput();

    boolean stackHeaded = s.hasHead(stack);
    switch (d.direction) {
    case LEFT:
      if (stack == 0)
        return "ROOT can't take a head";
      if (stackHeaded)
        return "stack token already has a head";
      if (s.isDescendantOf(input, stack))
        return "arc would form a cycle";
      stackHeaded = true;
      break;
    case RIGHT:
      if (s.hasHead(input))
        return "input token already has a head";
      if (s.isDescendantOf(stack, input))
        return "arc would form a cycle";
      break;
    case NO:
      break;
    default:
      throw new RuntimeException("unknown direction: " + d.direction);
    }

    switch (d.action) {
    case SHIFT:
      break;
    case PASS:
      if (stack == 0)
        return "can't pass ROOT";
      break;
    case REDUCE:
      if (stack == 0)
        return "can't reduce ROOT";
      if (reducePolicy == ReducePolicy.REQUIRE_HEAD && !stackHeaded)
        return "can't reduce a token without a head";
      break;
    default:
      throw new RuntimeException("unknown action: " + d.action);
    }
    return null;
  }

  public boolean isLegal(ParseState s, ParseDecision d) {
    return whyIllegal(s, d) == null;
  }

  /**
   * @throws IllegalTransitionException if d can't be applied, in which case s
   * is unchanged.
   */
  public void apply(ParseState s, ParseDecision d) {
    String reason = whyIllegal(s, d);
    if (reason != null)
      throw new IllegalTransitionException(d, s, reason);

    int stack = s.getStack();
    int input = s.getInput();
    if (d.direction == Direction.LEFT)
      s.setHead(stack, input, d.label);
    else if (d.direction == Direction.RIGHT)
      s.setHead(input, stack, d.label);

    if (d.action == Action.SHIFT)
      s.shift();
    else if (d.action == Action.PASS)
      s.pass();
    else
      s.reduce();
  }

  /**
   * All legal decisions in s, building arcs with each of the given labels.
   */
  public List<ParseDecision> legalDecisions(ParseState s, Collection<String> labels) {
    List<ParseDecision> legal = new ArrayList<>();
    for (Action a : Action.values()) {
      ParseDecision d = new ParseDecision(Direction.NO, a, "");
      if (isLegal(s, d))
        legal.add(d);
    }
    for (String l : labels) {
      for (Direction dir : new Direction[] {Direction.LEFT, Direction.RIGHT}) {
        for (Action a : Action.values()) {
          ParseDecision d = new ParseDecision(dir, a, l);
          if (isLegal(s, d))
            legal.add(d);
        }
      }
    }
    return legal;
  }
}
