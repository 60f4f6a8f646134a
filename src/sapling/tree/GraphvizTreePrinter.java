package sapling.tree;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import sapling.tree.Tree.INode;
import sapling.tree.Tree.LeafNode;
import sapling.tree.Tree.SplitNode;

/** Renders a tree in Graphviz DOT format. Edges are labeled with the
 * attribute value they stand for. */
public class GraphvizTreePrinter extends TreePrinter {
  private final Appendable _dest;

  public GraphvizTreePrinter(OutputStream dest) {
    this(new OutputStreamWriter(dest, StandardCharsets.UTF_8));
  }

  public GraphvizTreePrinter(Appendable dest) {
    _dest = dest;
  }

  public void printTree(Tree t) throws IOException {
    _dest.append("digraph {\n");
    t._tree.print(this);
    _dest.append("}\n");
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  void printNode(LeafNode t) throws IOException {
    int obj = System.identityHashCode(t);
    _dest.append(String.format("%d [label=\"%s\" shape=box];\n", obj, escape(t._class)));
  }

  void printNode(SplitNode t) throws IOException {
    int obj = System.identityHashCode(t);
    _dest.append(String.format("%d [label=\"%s\"];\n", obj, escape(t._attribute)));
    for( Map.Entry<String, INode> b : t._branches.entrySet() ) {
      b.getValue().print(this);
      _dest.append(String.format("%d -> %d [label=\"%s\"];\n",
          obj, System.identityHashCode(b.getValue()), escape(b.getKey())));
    }
  }

  private static String escape(String s) { return s.replace("\\", "\\\\").replace("\"", "\\\""); }
}
