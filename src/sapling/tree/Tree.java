package sapling.tree;

import java.io.IOException;
import java.util.Map;

import sapling.arff.Example;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableSortedMap;

/** A decision tree: split nodes that branch on the value of one attribute and
 * leaves that carry a class label.
 *
 * Nodes are immutable. A split node receives its finished branch map when it is
 * built and owns its children exclusively, so a tree has no shared nodes and no
 * cycles.
 */
public class Tree {
  final INode _tree;            // Root of decision tree

  public Tree(INode root) { _tree = Preconditions.checkNotNull(root); }

  public INode root() { return _tree; }

  /** Walks the tree down to a leaf and returns its label. */
  public String classify(Example e) throws UnknownValueException { return _tree.classify(e); }

  public int leaves() { return _tree.leaves(); }
  public int depth()  { return _tree.depth(); }

  public void print(TreePrinter p) throws IOException { p.printTree(this); }

  /** Indented text form, see {@link TextTreePrinter}. */
  public String toString() {
    StringBuilder sb = new StringBuilder();
    try {
      new TextTreePrinter(sb).printTree(this);
    } catch( IOException e ) { throw Throwables.propagate(e); }
    return sb.toString();
  }

  /** Either a leaf carrying a label or a split over an attribute. */
  public static abstract class INode {
    abstract String classify(Example e) throws UnknownValueException;
    abstract int depth();       // Depth of deepest leaf
    abstract int leaves();      // Number of leaves
    public abstract boolean isLeaf();
    public abstract void print(TreePrinter treePrinter) throws IOException;
  }

  /** Leaf node that returns its label for any example. */
  public static class LeafNode extends INode {
    final String _class;
    public LeafNode(String c) { _class = Preconditions.checkNotNull(c); }
    public String label() { return _class; }
    @Override public boolean isLeaf() { return true; }
    @Override int depth()  { return 0; }
    @Override int leaves() { return 1; }
    @Override String classify(Example e) { return _class; }
    @Override public void print(TreePrinter p) throws IOException { p.printNode(this); }
    public String toString() { return "[" + _class + "]"; }
  }

  /** Inner node: one branch per attribute value seen in training, kept in
   * sorted value order. */
  public static class SplitNode extends INode {
    final String _attribute;
    final ImmutableSortedMap<String, INode> _branches;
    private int _depth, _leaves;

    public SplitNode(String attribute, Map<String, INode> branches) {
      Preconditions.checkArgument(!branches.isEmpty(), "split on %s without branches", attribute);
      _attribute = Preconditions.checkNotNull(attribute);
      _branches = ImmutableSortedMap.copyOf(branches);
    }

    public String attribute() { return _attribute; }
    public ImmutableSortedMap<String, INode> branches() { return _branches; }
    @Override public boolean isLeaf() { return false; }

    @Override String classify(Example e) throws UnknownValueException {
      String v = e.get(_attribute);
      INode child = v == null ? null : _branches.get(v);
      if( child == null ) throw new UnknownValueException(_attribute, v);
      return child.classify(e);
    }
    @Override int depth() {
      if( _depth != 0 ) return _depth;
      int d = 0;
      for( INode n : _branches.values() ) d = Math.max(d, n.depth());
      return (_depth = d + 1);
    }
    @Override int leaves() {
      if( _leaves != 0 ) return _leaves;
      int l = 0;
      for( INode n : _branches.values() ) l += n.leaves();
      return (_leaves = l);
    }
    @Override public void print(TreePrinter p) throws IOException { p.printNode(this); }
    public String toString() { return _attribute + _branches; }
  }
}
