package edu.jhu.hlt.nonproj.parse;

/**
 * Thrown when a {@link ParseDecision} cannot be applied to a {@link ParseState}.
 * The state is guaranteed to be unchanged when this is thrown.
 */
public class IllegalTransitionException extends RuntimeException {
  private static final long serialVersionUID = 3390485175306012911L;

  private final ParseDecision decision;

  public IllegalTransitionException(ParseDecision decision, ParseState state, String reason) {
    super(reason + ": " + decision + " at " + state);
    this.decision = decision;
  }

  public ParseDecision getDecision() {
    return decision;
  }
}
