package hex.dtree;

import hex.dtree.Tree.BranchNode;
import hex.dtree.Tree.INode;
import hex.dtree.Tree.LeafNode;

import java.io.Flushable;
import java.io.IOException;
import java.util.Map;

/** Indented dump of a tree, one node per line. */
public class TextTreePrinter extends TreePrinter {
  private final Appendable _dest;
  private int _depth;

  public TextTreePrinter(Appendable dest) {
    _dest = dest;
  }

  public void printTree(Tree t) throws IOException {
    _depth = 0;
    t.root().print(this);
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  void printNode(LeafNode t) throws IOException {
    _dest.append(Utils.indent(_depth)).append("Leaf ").append(t._label).append('\n');
  }

  void printNode(BranchNode t) throws IOException {
    String ind = Utils.indent(_depth);
    _dest.append(String.format("%sBranch %s: %s, default=%s\n", ind, t._feature, t._arg, t._default));
    for( Map.Entry<Object,INode> c : t._children.entrySet() ) {
      _dest.append(String.format("%s Value: %s ->\n", ind, c.getKey()));
      _depth++;
      c.getValue().print(this);
      _depth--;
    }
  }
}
