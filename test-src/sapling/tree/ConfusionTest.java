package sapling.tree;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import sapling.arff.Example;

import com.google.gson.JsonObject;

public class ConfusionTest {
  static final List<String> CLASSES = Arrays.asList("Yes", "No");

  @Test public void testMake() {
    Tree t = TreeTest.restaurant();
    List<Example> test = Arrays.asList(
        Example.of("Patrons", "None", "Hungry", "Yes", Example.CLASSIFICATION, "No"),
        Example.of("Patrons", "Some", "Hungry", "No",  Example.CLASSIFICATION, "Yes"),
        Example.of("Patrons", "Full", "Hungry", "Yes", Example.CLASSIFICATION, "No"),
        Example.of("Patrons", "Full", "Hungry", "No",  Example.CLASSIFICATION, "No"),
        Example.of("Patrons", "Crowded",               Example.CLASSIFICATION, "Yes"));
    Confusion cm = Confusion.make(t, test, CLASSES);
    assertEquals(4, cm.rows());
    assertEquals(1, cm.errors());
    assertEquals(3, cm.correct());
    assertEquals(1, cm.unknown());
    assertEquals(0.25, cm.errorRate(), 0.0);
    // [actual][predicted]
    assertEquals(1, cm._matrix[0][0]);
    assertEquals(0, cm._matrix[0][1]);
    assertEquals(1, cm._matrix[1][0]);
    assertEquals(2, cm._matrix[1][1]);
  }

  @Test public void testUnlabeledExamplesAreNotScored() {
    Tree t = TreeTest.restaurant();
    List<Example> test = Arrays.asList(
        Example.of("Patrons", "Some", Example.CLASSIFICATION, "?"),
        Example.of("Patrons", "None", Example.CLASSIFICATION, "Maybe"),
        Example.of("Patrons", "None", Example.CLASSIFICATION, "No"));
    Confusion cm = Confusion.make(t, test, CLASSES);
    assertEquals(1, cm.rows());
    assertEquals(0, cm.errors());
    assertEquals(2, cm.unknown());
    assertEquals(1, cm._matrix[1][1]);
  }

  @Test public void testEmpty() {
    Confusion cm = new Confusion(CLASSES);
    assertEquals(0, cm.rows());
    assertEquals(0.0, cm.errorRate(), 0.0);
  }

  @Test public void testReport() {
    Confusion cm = new Confusion(CLASSES);
    cm.add("Yes", "Yes");
    cm.add("No", "Yes");
    String r = cm.report();
    assertTrue(r.contains("Classified (rows): 2\n"));
    assertTrue(r.contains("Unknown values: 0\n"));
    assertTrue(r.contains("Estimate of err. rate:"));
    assertTrue(r.contains("Confusion matrix:\n"));
    String[] lines = cm.confusionMatrix().split("\n");
    assertEquals(3, lines.length);
    assertEquals("           Yes     No", lines[0]);
    assertEquals("    Yes      1      0", lines[1]);
    assertEquals("     No      1      0", lines[2]);
  }

  @Test public void testJson() {
    Confusion cm = new Confusion(CLASSES);
    cm.add("Yes", "No");
    JsonObject o = cm.toJson();
    assertEquals(1, o.get(Confusion.JSON_ROWS).getAsLong());
    assertEquals(1, o.get(Confusion.JSON_ERRORS).getAsLong());
    assertEquals(0, o.get(Confusion.JSON_UNKNOWN).getAsLong());
    assertEquals(1.0, o.get(Confusion.JSON_ERROR_RATE).getAsDouble(), 0.0);
    JsonObject m = o.getAsJsonObject(Confusion.JSON_CM);
    assertEquals("[\"Yes\",\"No\"]", m.get(Confusion.JSON_CM_HEADER).toString());
    assertEquals("[[0,1],[0,0]]", m.get(Confusion.JSON_CM_MATRIX).toString());
    assertEquals(o.toString(), cm.toString());
  }

  @Test public void testUnknownLabel() {
    Confusion cm = new Confusion(CLASSES);
    try {
      cm.add("Maybe", "Yes");
      fail("An exception should have been thrown.");
    } catch( IllegalArgumentException e ) {
      assertTrue(e.getMessage().contains("Maybe"));
    }
    assertEquals(0, cm.rows());
  }
}
