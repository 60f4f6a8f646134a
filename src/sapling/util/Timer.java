package sapling.util;

import java.util.concurrent.TimeUnit;

/** Elapsed-time stopwatch for log lines. */
public class Timer {
  private final long _start = System.nanoTime();

  /** Milliseconds since the timer was created. */
  public long time() { return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - _start); }

  public String toString() { return toHuman(time()); }

  /** Formats a duration as "mm min ss.mmm sec", dropping zero minutes. */
  public static String toHuman(long msecs) {
    final long min = TimeUnit.MILLISECONDS.toMinutes(msecs);  msecs -= TimeUnit.MINUTES.toMillis(min);
    final long sec = TimeUnit.MILLISECONDS.toSeconds(msecs);  msecs -= TimeUnit.SECONDS.toMillis(sec);
    if( min != 0 ) return String.format("%02d min %02d.%03d sec", min, sec, msecs);
    return String.format("%02d.%03d sec", sec, msecs);
  }
}
