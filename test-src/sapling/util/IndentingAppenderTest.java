package sapling.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class IndentingAppenderTest {

  @Test public void testIndent() throws Exception {
    StringBuilder sb = new StringBuilder();
    IndentingAppender a = new IndentingAppender(sb);
    a.append("a\n");
    a.incrementIndent().append("b\n");
    a.incrementIndent().append("c").append('\n');
    a.decrementIndent().decrementIndent().append("d\n");
    assertEquals("a\n  b\n    c\nd\n", sb.toString());
    assertEquals(0, a.level());
  }

  @Test public void testIndentIsWrittenLazily() throws Exception {
    StringBuilder sb = new StringBuilder();
    IndentingAppender a = new IndentingAppender(sb, "\t");
    a.append("x\n");
    a.incrementIndent();
    assertEquals("x\n", sb.toString());
    a.append("\n");
    assertEquals("x\n\n", sb.toString());
    a.append("yz", 1, 2);
    assertEquals("x\n\n\tz", sb.toString());
  }

  @Test public void testDecrementBelowZero() {
    IndentingAppender a = new IndentingAppender(new StringBuilder());
    try {
      a.decrementIndent();
      fail("An exception should have been thrown.");
    } catch( IllegalStateException e ) {
      assertEquals(0, a.level());
    }
  }
}
