package edu.jhu.hlt.nonproj.util;

import org.apache.log4j.Logger;

/**
 * Accumulates time over start/stop pairs and logs a summary every
 * printInterval calls to stop (if printInterval > 0).
 */
public class Timer {
  public static final Logger LOG = Logger.getLogger(Timer.class);

  private String id;
  private int count;
  private long time;
  private long lastStart = -1;
  private int printInterval;

  public Timer(String id) {
    this(id, -1);
  }

  public Timer(String id, int printInterval) {
    this.id = id;
    this.printInterval = printInterval;
  }

  public void start() {
    lastStart = System.currentTimeMillis();
  }

  /** returns the time taken between the last start/stop pair */
  public long stop() {
    if (lastStart < 0)
      throw new IllegalStateException("stop called before start: " + id);
    long t = System.currentTimeMillis() - lastStart;
    time += t;
    count++;
    if (printInterval > 0 && count % printInterval == 0)
      LOG.info(this);
    return t;
  }

  public double totalTimeInSec() { return time / 1000d; }

  @Override
  public String toString() {
    double secs = totalTimeInSec();
    if (secs > 0 && count / secs >= 0.5d) {
      double rate = count / secs;
      String rateStr = rate > 1100d
          ? String.format("%.1f k", rate/1000d)
          : String.format("%.1f", rate);
      return String.format("<Timer %s %.2f sec and %d calls total, %s call/sec>", id, secs, count, rateStr);
    }
    return String.format("<Timer %s %.2f sec and %d calls total>", id, secs, count);
  }
}
