package hex.dtree;

import hex.dtree.Tree.BranchNode;
import hex.dtree.Tree.LeafNode;

import java.io.IOException;

public abstract class TreePrinter {
  public abstract void printTree(Tree t) throws IOException;
  abstract void printNode(LeafNode t) throws IOException;
  abstract void printNode(BranchNode t) throws IOException;
}
