package edu.jhu.hlt.nonproj.parse;

import static org.junit.Assert.*;

import org.junit.Test;

import edu.jhu.hlt.nonproj.parse.ParseDecision.Action;
import edu.jhu.hlt.nonproj.parse.ParseDecision.Direction;

public class ParseDecisionTest {

  @Test
  public void labelOnlyMattersForArcs() {
    ParseDecision a = new ParseDecision(Direction.NO, Action.PASS, "nsubj");
    assertEquals("", a.label);
    assertEquals(ParseDecision.NO_PASS, a);
    assertEquals(ParseDecision.NO_PASS.hashCode(), a.hashCode());
    assertNotEquals(ParseDecision.left(Action.PASS, "a"), ParseDecision.left(Action.PASS, "b"));
  }

  @Test
  public void shortStrings() {
    assertEquals("left-reduce:det", ParseDecision.left(Action.REDUCE, "det").toShortString());
    assertEquals("no-shift", ParseDecision.NO_SHIFT.toShortString());
    assertEquals(ParseDecision.right(Action.PASS, "a:b"), ParseDecision.fromShortString("right-pass:a:b"));
    assertEquals(ParseDecision.NO_REDUCE, ParseDecision.fromShortString("no-reduce"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void badShortString() {
    ParseDecision.fromShortString("sideways-shift");
  }
}
