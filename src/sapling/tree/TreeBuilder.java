package sapling.tree;

import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import sapling.arff.Dataset;
import sapling.arff.Example;
import sapling.tree.Tree.INode;
import sapling.tree.Tree.LeafNode;
import sapling.tree.Tree.SplitNode;
import sapling.util.Timer;

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

/** Recursive top-down induction of a decision tree.
 *
 * At each node the examples are checked in this order:
 * <ol>
 * <li>no examples: a leaf with the plurality label of the parent's examples;</li>
 * <li>a single label: a leaf with that label;</li>
 * <li>no attributes left: a leaf with the plurality label of the examples;</li>
 * <li>otherwise the best scoring attribute is split on, one branch per value
 *     observed in the examples, unless the pruning policy rejects the split,
 *     which makes a plurality leaf instead.</li>
 * </ol>
 * Children use the examples of the node that created them as their parent
 * examples, not the root's.
 *
 * Each level removes one attribute, so the recursion is at most as deep as the
 * attribute list is long.
 */
public class TreeBuilder {
  private static final Logger LOG = Logger.getLogger(TreeBuilder.class.getName());

  private final Importance _importance;
  private final Pruning _pruning;

  public TreeBuilder(Importance importance) { this(importance, Pruning.NONE); }

  public TreeBuilder(Importance importance, Pruning pruning) {
    _importance = Preconditions.checkNotNull(importance);
    _pruning = Preconditions.checkNotNull(pruning);
  }

  /** Builds a tree over all input attributes of the dataset. */
  public Tree build(Dataset data) {
    Timer t = new Timer();
    Tree tree = build(data.examples(), data.inputAttributes());
    LOG.info("Tree " + data.relation() + " d=" + tree.depth() + " leaves=" + tree.leaves()
        + " (" + _importance + ", pruning " + _pruning + ") built in " + t);
    return tree;
  }

  /** Builds a tree; the examples double as the fallback for an empty root. */
  public Tree build(List<Example> examples, List<String> attributes) {
    Preconditions.checkArgument(!examples.isEmpty(), "cannot build a tree without examples");
    return new Tree(learn(examples, attributes, examples));
  }

  /** One step of the induction. The result is either a {@link LeafNode}, the
   * label outcome, or a {@link SplitNode} with all its branches built. */
  public INode learn(List<Example> examples, List<String> attributes, List<Example> parentExamples) {
    if( examples.isEmpty() )
      return new LeafNode(pluralityValue(parentExamples));
    if( sameClassification(examples) )
      return new LeafNode(examples.get(0).classification());
    if( attributes.isEmpty() )
      return new LeafNode(pluralityValue(examples));

    String best = chooseAttribute(attributes, examples);
    if( _pruning.prune(best, examples) ) {
      String label = pluralityValue(examples);
      if( LOG.isLoggable(Level.FINE) )
        LOG.fine("Pruned split on " + best + " over " + examples.size() + " examples, leaf " + label);
      return new LeafNode(label);
    }
    if( LOG.isLoggable(Level.FINE) )
      LOG.fine("Split on " + best + " over " + examples.size() + " examples");

    ImmutableList.Builder<String> rest = ImmutableList.builder();
    for( String a : attributes ) if( !a.equals(best) ) rest.add(a);
    List<String> remaining = rest.build();

    Map<String, INode> branches = Maps.newLinkedHashMap();
    for( String v : attributeValues(best, examples) )
      branches.put(v, learn(filter(best, v, examples), remaining, examples));
    return new SplitNode(best, branches);
  }

  /** The attribute with the highest score; the earliest listed wins a tie. */
  String chooseAttribute(List<String> attributes, List<Example> examples) {
    double[] scores = new double[attributes.size()];
    for( int i = 0; i < scores.length; ++i )
      scores[i] = _importance.score(attributes.get(i), examples);
    return attributes.get(Utils.maxIndex(scores));
  }

  // ---------------------------------------------------------------------------
  // Helpers over example lists

  /** True iff every example has the first example's label. */
  public static boolean sameClassification(List<Example> examples) {
    if( examples.isEmpty() ) return true;
    String first = examples.get(0).classification();
    for( Example e : examples )
      if( !Objects.equal(first, e.classification()) ) return false;
    return true;
  }

  /** The most frequent label. A tie goes to the label that appears first in
   * the examples. */
  public static String pluralityValue(List<Example> examples) {
    Preconditions.checkArgument(!examples.isEmpty(), "plurality of no examples");
    Multiset<String> counts = LinkedHashMultiset.create();
    for( Example e : examples ) counts.add(e.classification());
    String best = null;
    int bestCount = 0;
    for( Multiset.Entry<String> en : counts.entrySet() ) {
      if( en.getCount() > bestCount ) {
        best = en.getElement();
        bestCount = en.getCount();
      }
    }
    return best;
  }

  /** The distinct values the examples carry for the attribute, sorted. */
  public static ImmutableSortedSet<String> attributeValues(String attribute, List<Example> examples) {
    ImmutableSortedSet.Builder<String> b = ImmutableSortedSet.naturalOrder();
    for( Example e : examples ) {
      String v = e.get(attribute);
      if( v != null ) b.add(v);
    }
    return b.build();
  }

  /** The examples whose attribute equals the value, in their original order. */
  public static List<Example> filter(String attribute, String value, List<Example> examples) {
    ImmutableList.Builder<Example> b = ImmutableList.builder();
    for( Example e : examples )
      if( value.equals(e.get(attribute)) ) b.add(e);
    return b.build();
  }
}
