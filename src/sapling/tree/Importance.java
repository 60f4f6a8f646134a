package sapling.tree;

import java.util.List;

import sapling.arff.Example;

/** Scores a candidate split attribute over a set of examples. Higher is
 * better; {@link TreeBuilder} splits on the best scoring candidate, taking the
 * first one listed when scores tie.
 *
 * @see ConstantImportance
 * @see EntropyImportance
 * @see MultiClassImportance
 */
public interface Importance {
  double score(String attribute, List<Example> examples);
}
