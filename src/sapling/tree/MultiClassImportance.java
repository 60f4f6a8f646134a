package sapling.tree;

import java.util.List;

import sapling.arff.Example;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Information gain over an arbitrary, fixed list of classes.
 *
 * The entropy is taken with logarithm base equal to the number of classes, so
 * an even spread over all classes has entropy 1 no matter how many there are:
 *
 *   H(E) = - sum_c p_c * log_C(p_c)
 *
 * The score is H(E) minus the example-weighted average of H over the subsets
 * produced by the attribute's values. Labels outside the class list are
 * ignored.
 */
public class MultiClassImportance implements Importance {
  private final ImmutableList<String> _classes;

  public MultiClassImportance(List<String> classes) {
    Preconditions.checkArgument(classes.size() >= 2, "at least two classes are needed, got %s", classes);
    _classes = ImmutableList.copyOf(classes);
  }

  @Override public double score(String attribute, List<Example> examples) {
    int[] dist = distribution(examples);
    int all = Utils.sum(dist);
    if( all == 0 ) return 0;
    double remainder = 0;
    for( String v : TreeBuilder.attributeValues(attribute, examples) ) {
      int[] sub = distribution(TreeBuilder.filter(attribute, v, examples));
      int n = Utils.sum(sub);
      if( n == 0 ) continue;
      remainder += (n / (double) all) * Utils.entropy(sub, _classes.size());
    }
    return Utils.entropy(dist, _classes.size()) - remainder;
  }

  /** Counts the examples of each class, in class-list order. */
  int[] distribution(List<Example> examples) {
    int[] dist = new int[_classes.size()];
    for( Example e : examples ) {
      int i = _classes.indexOf(e.classification());
      if( i >= 0 ) dist[i]++;
    }
    return dist;
  }


  public String toString() { return "multiclass" + _classes; }
}
