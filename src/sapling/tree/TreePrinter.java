package sapling.tree;

import java.io.IOException;

import sapling.tree.Tree.LeafNode;
import sapling.tree.Tree.SplitNode;

/** Visitor that renders a tree node by node. */
public abstract class TreePrinter {
  public abstract void printTree(Tree t) throws IOException;
  abstract void printNode(LeafNode t) throws IOException;
  abstract void printNode(SplitNode t) throws IOException;
}
