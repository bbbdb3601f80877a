package edu.jhu.hlt.nonproj.parse;

/**
 * One transition: an attachment direction paired with a stack/input action.
 *
 * LEFT means the input token becomes the head of the stack token, RIGHT means
 * the stack token becomes the head of the input token, and NO means no arc is
 * built. The label is only meaningful when an arc is built, and is normalized
 * to "" otherwise so that decisions can be compared and counted.
 *
 * @author travis
 */
public final class ParseDecision {

  public enum Direction {
    LEFT, RIGHT, NO;
  }

  public enum Action {
    SHIFT, REDUCE, PASS;
  }

  public static final ParseDecision NO_SHIFT = new ParseDecision(Direction.NO, Action.SHIFT, "");
  public static final ParseDecision NO_REDUCE = new ParseDecision(Direction.NO, Action.REDUCE, "");
  public static final ParseDecision NO_PASS = new ParseDecision(Direction.NO, Action.PASS, "");

  public final Direction direction;
  public final Action action;
  public final String label;

  public ParseDecision(Direction direction, Action action, String label) {
    if (direction == null || action == null)
      throw new IllegalArgumentException("direction=" + direction + " action=" + action);
    this.direction = direction;
    this.action = action;
    this.label = direction == Direction.NO || label == null ? "" : label;
  }

  public static ParseDecision left(Action action, String label) {
    return new ParseDecision(Direction.LEFT, action, label);
  }

  public static ParseDecision right(Action action, String label) {
    return new ParseDecision(Direction.RIGHT, action, label);
  }

  public boolean isShift() { return action == Action.SHIFT; }
  public boolean isReduce() { return action == Action.REDUCE; }
  public boolean isPass() { return action == Action.PASS; }

  public boolean isLeft() { return direction == Direction.LEFT; }
  public boolean isRight() { return direction == Direction.RIGHT; }
  public boolean buildsArc() { return direction != Direction.NO; }

  /**
   * e.g. "left-reduce:nsubj" or "no-shift". Inverse of {@link #fromShortString(String)}.
   */
  public String toShortString() {
    String s = direction.name().toLowerCase() + "-" + action.name().toLowerCase();
    if (buildsArc())
      s += ":" + label;
    return s;
  }

  public static ParseDecision fromShortString(String s) {
    int dash = s.indexOf('-');
    if (dash < 0)
      throw new IllegalArgumentException("not a decision: " + s);
    int colon = s.indexOf(':', dash);
    String dir = s.substring(0, dash);
    String act = colon < 0 ? s.substring(dash + 1) : s.substring(dash + 1, colon);
    String label = colon < 0 ? "" : s.substring(colon + 1);
    try {
      return new ParseDecision(
          Direction.valueOf(dir.toUpperCase()),
          Action.valueOf(act.toUpperCase()),
          label);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("not a decision: " + s, e);
    }
  }

  @Override
  public int hashCode() {
    return (direction.ordinal() * 3 + action.ordinal()) * 31 + label.hashCode();
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof ParseDecision) {
      ParseDecision d = (ParseDecision) other;
      return direction == d.direction
          && action == d.action
          && label.equals(d.label);
    }
    return false;
  }

  @Override
  public String toString() {
    return "[Decision: " + direction.name().toLowerCase()
        + "-" + action.name().toLowerCase()
        + " label: " + label + "]";
  }
}
