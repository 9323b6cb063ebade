package hex.dtree;

import hex.dtree.Tree.BranchNode;
import hex.dtree.Tree.INode;
import hex.dtree.Tree.LeafNode;

import java.io.Flushable;
import java.io.IOException;
import java.util.Map;


public class GraphvizTreePrinter extends TreePrinter {
  private final Appendable _dest;

  public GraphvizTreePrinter(Appendable dest) {
    _dest = dest;
  }

  public void printTree(Tree t) throws IOException {
    _dest.append("digraph {\n");
    t.root().print(this);
    _dest.append("}\n");
    if( _dest instanceof Flushable ) ((Flushable) _dest).flush();
  }

  void printNode(LeafNode t) throws IOException {
    int obj = System.identityHashCode(t);
    _dest.append(String.format("%d [label=\"%s\\n%s\"];\n",
        obj, "Leaf Node", escape(t._label)));
  }

  @Override
  void printNode(BranchNode t) throws IOException {
    int obj = System.identityHashCode(t);

    String test = t._arg == null
      ? t._feature.name()
      : t._feature.name() + " " + t._arg;
    _dest.append(String.format("%d [label=\"%s\\n%s\"];\n",
        obj, escape(test), "default " + escape(t._default)));

    for( Map.Entry<Object,INode> c : t._children.entrySet() ) {
      c.getValue().print(this);
      int child = System.identityHashCode(c.getValue());
      _dest.append(String.format("%d -> %d [label=\"%s\"];\n", obj, child, escape(String.valueOf(c.getKey()))));
    }
  }

  static String escape(String s) { return s.replace("\\", "\\\\").replace("\"", "\\\""); }
}
