package sapling.tree;

import java.util.List;

import sapling.arff.Example;

/** Gives every attribute the same score, so the tree splits on attributes in
 * the order they are listed. */
public class ConstantImportance implements Importance {
  private final double _value;

  public ConstantImportance() { this(1.0); }
  public ConstantImportance(double value) { _value = value; }

  @Override public double score(String attribute, List<Example> examples) { return _value; }

  public String toString() { return "constant(" + _value + ")"; }
}
