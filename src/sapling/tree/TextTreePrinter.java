package sapling.tree;

import java.io.IOException;
import java.util.Map;

import sapling.tree.Tree.INode;
import sapling.tree.Tree.LeafNode;
import sapling.tree.Tree.SplitNode;
import sapling.util.IndentingAppender;

/** Depth-first text rendering, one line per attribute value:
 *
 * <pre>
 * Patrons = Full
 *   Hungry = No: No
 *   Hungry = Yes: Yes
 * Patrons = None: No
 * Patrons = Some: Yes
 * </pre>
 *
 * A tree that is a single leaf prints just its label.
 */
public class TextTreePrinter extends TreePrinter {
  private final IndentingAppender _dest;

  public TextTreePrinter(Appendable dest) {
    _dest = new IndentingAppender(dest);
  }

  public void printTree(Tree t) throws IOException {
    t._tree.print(this);
    _dest.flush();
  }

  void printNode(LeafNode t) throws IOException {
    _dest.append(t._class).append('\n');
  }

  void printNode(SplitNode t) throws IOException {
    for( Map.Entry<String, INode> b : t._branches.entrySet() ) {
      _dest.append(t._attribute).append(" = ").append(b.getKey());
      INode child = b.getValue();
      if( child.isLeaf() ) {
        _dest.append(": ").append(((LeafNode) child)._class).append('\n');
      } else {
        _dest.append('\n').incrementIndent();
        child.print(this);
        _dest.decrementIndent();
      }
    }
  }
}
