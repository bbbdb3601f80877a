package edu.jhu.hlt.nonproj.util;

import static org.junit.Assert.*;

import org.junit.After;
import org.junit.Test;

import edu.jhu.hlt.nonproj.parse.TransitionSystem.ReducePolicy;

public class ExperimentPropertiesTest {

  @After
  public void cleanup() {
    ExperimentProperties.clearInstance();
  }

  @Test
  public void defaultsAreRecorded() {
    ExperimentProperties p = new ExperimentProperties();
    assertEquals(7, p.getInt("k", 7));
    assertEquals("7", p.getProperty("k"));
    assertEquals(7, p.getInt("k", 8));
    assertTrue(p.getBoolean("b", true));
    assertEquals(ReducePolicy.REQUIRE_HEAD, p.getEnum("rp", ReducePolicy.class, ReducePolicy.REQUIRE_HEAD));
    p.put("rp2", "allow_headless");
    assertEquals(ReducePolicy.ALLOW_HEADLESS, p.getEnum("rp2", ReducePolicy.class, ReducePolicy.REQUIRE_HEAD));
  }

  @Test
  public void mainArgs() {
    ExperimentProperties p = ExperimentProperties.init(new String[] {"threads", "3", "conllx", "x.conll"});
    assertSame(p, ExperimentProperties.getInstance());
    assertEquals(3, p.getInt("threads"));
    assertEquals("x.conll", p.getString("conllx"));
    // from nonproj.properties on the classpath
    assertEquals("/parser-features.txt", p.getString("features"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void oddArgs() {
    new ExperimentProperties().putAll(new String[] {"a"});
  }

  @Test(expected = RuntimeException.class)
  public void noOverwrites() {
    new ExperimentProperties().putAll(new String[] {"a", "1", "a", "2"});
  }

  @Test(expected = RuntimeException.class)
  public void missingKey() {
    new ExperimentProperties().getString("nope");
  }
}
