package sapling.tree;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import sapling.TestUtil;
import sapling.arff.ArffParser;
import sapling.arff.Example;

public class ChiSquaredPruningTest {
  static List<Example> _restaurant;

  @BeforeClass public static void load() throws Exception {
    _restaurant = ArffParser.parse(TestUtil.read_test_file(TestUtil.RESTAURANT)).examples();
  }

  @Test public void testGammaFunctions() {
    assertEquals(Math.log(24), Utils.lnGamma(5), 1e-9);
    assertEquals(Math.log(Math.sqrt(Math.PI)), Utils.lnGamma(0.5), 1e-9);
    assertEquals(Math.exp(-2.5), Utils.gammaQ(1, 2.5), 1e-12);
    assertEquals(1.0, Utils.gammaQ(3, 0), 0.0);
  }

  @Test public void testChiSquaredSurvival() {
    // the textbook 5% critical values
    assertEquals(0.05, Utils.chiSquaredSurvival(3.841459, 1), 1e-6);
    assertEquals(0.05, Utils.chiSquaredSurvival(5.991465, 2), 1e-6);
    assertEquals(0.05, Utils.chiSquaredSurvival(11.070498, 5), 1e-6);
    assertEquals(1.0, Utils.chiSquaredSurvival(0, 3), 0.0);
    assertEquals(1.0, Utils.chiSquaredSurvival(4.2, 0), 0.0);
  }

  @Test public void testSignificantSplitIsKept() {
    ChiSquaredPruning p = new ChiSquaredPruning();
    int[][] table = p.contingency("Pat", _restaurant);
    // Full, None, Some
    assertArrayEquals(new int[] {2, 0, 4}, table[0]);
    assertArrayEquals(new int[] {4, 2, 0}, table[1]);
    assertEquals(20 / 3.0, p.statistic("Pat", _restaurant), 1e-12);
    assertEquals(Math.exp(-10 / 3.0), p.pValue("Pat", _restaurant), 1e-9);
    assertFalse(p.prune("Pat", _restaurant));
  }

  @Test public void testIrrelevantSplitIsPruned() {
    ChiSquaredPruning p = new ChiSquaredPruning();
    assertEquals(0.0, p.statistic("Type", _restaurant), 1e-12);
    assertEquals(1.0, p.pValue("Type", _restaurant), 1e-12);
    assertTrue(p.prune("Type", _restaurant));
  }

  @Test public void testSingleValuedAttributeIsPruned() {
    List<Example> ex = Arrays.asList(
        Example.of("a", "p", Example.CLASSIFICATION, "Yes"),
        Example.of("a", "p", Example.CLASSIFICATION, "No"));
    assertTrue(new ChiSquaredPruning().prune("a", ex));
  }

  @Test public void testThresholdIsConfigurable() {
    // p is about 0.036 for Pat: kept at 5%, pruned at 1%
    assertTrue(new ChiSquaredPruning("Yes", "No", 0.01).prune("Pat", _restaurant));
    assertFalse(new ChiSquaredPruning("Yes", "No", 0.05).prune("Pat", _restaurant));
  }

  @Test public void testNeverPrune() {
    assertFalse(Pruning.NONE.prune("Type", _restaurant));
  }
}
