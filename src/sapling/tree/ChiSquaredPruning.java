package sapling.tree;

import java.util.List;

import sapling.arff.Example;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedSet;

/** Chi-squared significance test for a two-class split.
 *
 * Builds the 2 x k table of positive and negative counts for each of the k
 * values of the attribute, compares it with the counts expected if the
 * attribute were independent of the class (row total x column total / grand
 * total) and converts the statistic to a p-value with k-1 degrees of freedom.
 * The split is pruned when the p-value is above the threshold.
 */
public class ChiSquaredPruning implements Pruning {
  public static final double DEFAULT_THRESHOLD = 0.05;

  private final String _positive;
  private final String _negative;
  private final double _threshold;

  public ChiSquaredPruning() { this("Yes", "No", DEFAULT_THRESHOLD); }

  public ChiSquaredPruning(String positive, String negative, double threshold) {
    Preconditions.checkArgument(threshold > 0 && threshold < 1, "threshold must be in (0,1): %s", threshold);
    _positive = Preconditions.checkNotNull(positive);
    _negative = Preconditions.checkNotNull(negative);
    _threshold = threshold;
  }

  @Override public boolean prune(String attribute, List<Example> examples) {
    return pValue(attribute, examples) > _threshold;
  }

  /** Observed counts, [0][k] positives and [1][k] negatives for the k-th
   * attribute value in sorted order. */
  int[][] contingency(String attribute, List<Example> examples) {
    ImmutableSortedSet<String> values = TreeBuilder.attributeValues(attribute, examples);
    int[][] table = new int[2][values.size()];
    for( Example e : examples ) {
      String v = e.get(attribute);
      if( v == null ) continue;
      int k = values.headSet(v).size();
      String c = e.classification();
      if( _positive.equals(c) ) table[0][k]++;
      else if( _negative.equals(c) ) table[1][k]++;
    }
    return table;
  }

  /** The chi-squared statistic of the attribute's contingency table. */
  public double statistic(String attribute, List<Example> examples) {
    int[][] obs = contingency(attribute, examples);
    int k = obs[0].length;
    int[] rowTotal = { Utils.sum(obs[0]), Utils.sum(obs[1]) };
    int grand = rowTotal[0] + rowTotal[1];
    if( grand == 0 ) return 0;
    double chi = 0;
    for( int j = 0; j < k; ++j ) {
      int colTotal = obs[0][j] + obs[1][j];
      for( int i = 0; i < 2; ++i ) {
        double expected = rowTotal[i] * (double) colTotal / grand;
        if( expected == 0 ) continue;
        double d = obs[i][j] - expected;
        chi += d * d / expected;
      }
    }
    return chi;
  }

  /** Probability of a statistic at least this large if the attribute were
   * irrelevant. */
  public double pValue(String attribute, List<Example> examples) {
    int df = TreeBuilder.attributeValues(attribute, examples).size() - 1;
    return Utils.chiSquaredSurvival(statistic(attribute, examples), df);
  }

  public String toString() { return "chi2(p>" + _threshold + ")"; }
}
