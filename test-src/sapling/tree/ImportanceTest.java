package sapling.tree;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import sapling.arff.Example;

public class ImportanceTest {
  static final List<Example> RESTAURANT = Arrays.asList(
      Example.of("Patrons", "None", "Hungry", "Yes", Example.CLASSIFICATION, "No"),
      Example.of("Patrons", "Some", "Hungry", "Yes", Example.CLASSIFICATION, "Yes"),
      Example.of("Patrons", "Full", "Hungry", "Yes", Example.CLASSIFICATION, "Yes"),
      Example.of("Patrons", "Full", "Hungry", "No",  Example.CLASSIFICATION, "No"));

  @Test public void testBinaryEntropy() {
    assertEquals(0.0, Utils.binaryEntropy(0), 0.0);
    assertEquals(0.0, Utils.binaryEntropy(1), 0.0);
    assertEquals(1.0, Utils.binaryEntropy(0.5), 1e-15);
    assertEquals(Utils.binaryEntropy(0.25), Utils.binaryEntropy(0.75), 1e-15);
    assertTrue(Utils.binaryEntropy(0.25) < 1.0);
  }

  @Test public void testEntropyGain() {
    EntropyImportance imp = new EntropyImportance("Yes", "No");
    assertEquals(0.5, imp.score("Patrons", RESTAURANT), 1e-12);
    double hungry = 1.0 - 0.75 * Utils.binaryEntropy(2 / 3.0);
    assertEquals(hungry, imp.score("Hungry", RESTAURANT), 1e-12);
    assertTrue(imp.score("Patrons", RESTAURANT) > imp.score("Hungry", RESTAURANT));
  }

  @Test public void testBinaryAndMultiClassAgree() {
    EntropyImportance binary = new EntropyImportance("Yes", "No");
    MultiClassImportance multi = new MultiClassImportance(Arrays.asList("Yes", "No"));
    assertEquals(binary.score("Patrons", RESTAURANT), multi.score("Patrons", RESTAURANT), 0.0);
    assertEquals(binary.score("Hungry", RESTAURANT), multi.score("Hungry", RESTAURANT), 1e-12);
  }

  @Test public void testMultiClassEntropyIsNormalized() {
    List<Example> ex = Arrays.asList(
        Example.of("a", "p", "b", "x", Example.CLASSIFICATION, "red"),
        Example.of("a", "q", "b", "x", Example.CLASSIFICATION, "green"),
        Example.of("a", "r", "b", "y", Example.CLASSIFICATION, "blue"));
    MultiClassImportance imp = new MultiClassImportance(Arrays.asList("red", "green", "blue"));
    assertArrayEquals(new int[] {1, 1, 1}, imp.distribution(ex));
    assertEquals(1.0, Utils.entropy(imp.distribution(ex), 3), 1e-12);
    // 'a' separates every class, leaving nothing uncertain
    assertEquals(1.0, imp.score("a", ex), 1e-12);
    // 'b' leaves red/green mixed in two thirds of the examples
    assertEquals(1.0 - (2 / 3.0) * Utils.log(2, 3), imp.score("b", ex), 1e-12);
  }

  @Test public void testEmptySubsetClassContributesNothing() {
    List<Example> ex = Arrays.asList(
        Example.of("a", "p", Example.CLASSIFICATION, "Yes"),
        Example.of("a", "p", Example.CLASSIFICATION, "Yes"));
    assertEquals(0.0, new EntropyImportance().score("a", ex), 0.0);
    assertEquals(0.0, new MultiClassImportance(Arrays.asList("Yes", "No")).score("a", ex), 0.0);
  }

  @Test public void testConstant() {
    ConstantImportance imp = new ConstantImportance(3.0);
    assertEquals(3.0, imp.score("Patrons", RESTAURANT), 0.0);
    assertEquals(3.0, imp.score("Hungry", RESTAURANT), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMultiClassNeedsTwoClasses() {
    new MultiClassImportance(Arrays.asList("only"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBinaryLabelsMustDiffer() {
    new EntropyImportance("Yes", "Yes");
  }
}
