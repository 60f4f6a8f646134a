package sapling.tree;

import java.util.List;

import sapling.arff.Example;

import com.google.common.base.Preconditions;

/** Information gain for two-class problems.
 *
 * With p positive and n negative examples the starting uncertainty is
 * B(p/(p+n)), where B is the binary entropy. Splitting on an attribute leaves
 *
 *   sum_k (p_k + n_k)/(p + n) * B(p_k/(p_k + n_k))
 *
 * over the attribute's values k, and the score is the difference. Examples
 * carrying neither label are ignored.
 */
public class EntropyImportance implements Importance {
  private final String _positive;
  private final String _negative;

  public EntropyImportance() { this("Yes", "No"); }

  public EntropyImportance(String positive, String negative) {
    _positive = Preconditions.checkNotNull(positive);
    _negative = Preconditions.checkNotNull(negative);
    Preconditions.checkArgument(!positive.equals(negative), "labels must differ");
  }

  @Override public double score(String attribute, List<Example> examples) {
    int[] total = count(examples);
    int all = total[0] + total[1];
    if( all == 0 ) return 0;
    double remainder = 0;
    for( String v : TreeBuilder.attributeValues(attribute, examples) ) {
      int[] pn = count(TreeBuilder.filter(attribute, v, examples));
      int sub = pn[0] + pn[1];
      if( sub == 0 ) continue;
      remainder += (sub / (double) all) * Utils.binaryEntropy(pn[0] / (double) sub);
    }
    return Utils.binaryEntropy(total[0] / (double) all) - remainder;
  }

  // {positives, negatives}
  private int[] count(List<Example> examples) {
    int[] pn = new int[2];
    for( Example e : examples ) {
      String c = e.classification();
      if( _positive.equals(c) ) pn[0]++;
      else if( _negative.equals(c) ) pn[1]++;
    }
    return pn;
  }

  public String toString() { return "entropy(" + _positive + "/" + _negative + ")"; }
}
