package hex.dtree;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;

/** A decision tree.
 *
 * The tree has leaf nodes and branch nodes. A branch node asks its feature for
 * the branch value of the entity and descends into the matching child; if the
 * value was never seen during training, the branch answers its default label,
 * the majority label of the entities it was built from. Leaves always answer
 * their label.
 */
public class Tree {
  final INode _tree;            // Root of decision tree

  public Tree(INode root) {
    Preconditions.checkNotNull(root);
    _tree = root;
  }

  public abstract static class INode {
    abstract String classify(Entity e);
    abstract int depth();       // Depth of deepest leaf
    abstract int leaves();      // Number of leaves
    abstract StringBuilder toString(StringBuilder sb, int len);
    public abstract void print(TreePrinter p) throws IOException;
    @Override public String toString() { return toString(new StringBuilder(), Integer.MAX_VALUE).toString(); }
  }

  /** Leaf node that returns its label for any entity. */
  public static class LeafNode extends INode {
    final String _label;
    public LeafNode(String label) {
      Preconditions.checkNotNull(label, "leaf label");
      _label = label;
    }
    public String label() { return _label; }
    @Override String classify(Entity e) { return _label; }
    @Override int depth()  { return 0; }
    @Override int leaves() { return 1; }
    @Override StringBuilder toString(StringBuilder sb, int n) { return sb.append('[').append(_label).append(']'); }
    @Override public void print(TreePrinter p) throws IOException { p.printNode(this); }
  }

  /** Inner node. Routes an entity by the branch value its feature assigns. */
  public static class BranchNode extends INode {
    final Feature _feature;
    final Object _arg;
    final String _default;
    final Map<Object,INode> _children;
    int _depth, _leaves;

    public BranchNode(Feature feature, Object arg, String dflt, Map<Object,INode> children) {
      Preconditions.checkNotNull(feature);
      Preconditions.checkNotNull(dflt, "default label");
      _feature = feature;
      _arg = arg;
      _default = dflt;
      _children = Collections.unmodifiableMap(new LinkedHashMap<Object,INode>(children));
    }

    public Feature feature() { return _feature; }
    public Object arg() { return _arg; }
    public String defaultLabel() { return _default; }
    public Map<Object,INode> children() { return _children; }

    @Override String classify(Entity e) {
      INode child = _children.get(_feature.identify(_arg, e));
      return child == null ? _default : child.classify(e);
    }
    @Override int depth() {
      if( _depth != 0 ) return _depth;
      int d = 0;
      for( INode c : _children.values() ) d = Math.max(d, c.depth());
      return (_depth = d + 1);
    }
    @Override int leaves() {
      if( _leaves != 0 ) return _leaves;
      int l = 0;
      for( INode c : _children.values() ) l += c.leaves();
      return (_leaves = l);
    }
    @Override StringBuilder toString(StringBuilder sb, int n) {
      sb.append(_feature.name());
      if( _arg != null ) sb.append(' ').append(_arg);
      sb.append(" (");
      boolean first = true;
      for( Map.Entry<Object,INode> c : _children.entrySet() ) {
        if( sb.length() > n ) return sb;
        if( !first ) sb.append(',');
        first = false;
        c.getValue().toString(sb.append(c.getKey()).append('='), n);
      }
      return sb.append(')');
    }
    @Override public void print(TreePrinter p) throws IOException { p.printNode(this); }
  }

  public INode root()   { return _tree; }
  public String classify(Entity e) { return _tree.classify(e); }
  public int leaves()   { return _tree.leaves(); }
  public int depth()    { return _tree.depth(); }
  @Override public String toString() { return _tree.toString(); }
}
