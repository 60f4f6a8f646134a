package sapling.tree;

import java.util.List;

import sapling.arff.Example;

/** Decides whether a chosen split is worth keeping. {@link TreeBuilder}
 * consults it before emitting a split node; a pruned split becomes a leaf
 * labeled with the plurality class of the examples.
 */
public interface Pruning {
  /** True when the split on the attribute should be dropped. */
  boolean prune(String attribute, List<Example> examples);

  /** Keeps every split. */
  Pruning NONE = new Pruning() {
    @Override public boolean prune(String attribute, List<Example> examples) { return false; }
    public String toString() { return "none"; }
  };
}
