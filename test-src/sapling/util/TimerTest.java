package sapling.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class TimerTest {

  @Test public void testToHuman() {
    assertEquals("00.000 sec", Timer.toHuman(0));
    assertEquals("01.234 sec", Timer.toHuman(1234));
    assertEquals("01 min 01.005 sec", Timer.toHuman(61005));
    assertEquals("61 min 00.000 sec", Timer.toHuman(61 * 60 * 1000));
  }

  @Test public void testTime() {
    Timer t = new Timer();
    assertTrue(t.time() >= 0);
    assertTrue(t.toString().endsWith(" sec"));
  }
}
