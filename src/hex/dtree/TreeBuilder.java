package hex.dtree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

/** Greedy top-down tree induction.
 *
 * At every node all registered features propose a split of the current
 * entities and the one with the lowest weighted entropy wins; ties go to the
 * feature registered first. Each partition is then built recursively. The
 * recursion stops when the entities are pure enough, too few, or no feature
 * can split them any more; such subsets become leaves holding their majority
 * label.
 */
public class TreeBuilder {
  static final Logger LOG = Logger.getLogger(TreeBuilder.class.getName());

  public static final int    DEFAULT_MIN_KEYS    = 10;
  public static final double DEFAULT_MIN_ENTROPY = 0.10;

  final FeatureRegistry _features;
  final int _minKeys;           // Fewer entities than this are not split
  final double _minEntropy;     // Entropy below which a split isn't worth it

  public TreeBuilder(FeatureRegistry features) {
    this(features, DEFAULT_MIN_KEYS, DEFAULT_MIN_ENTROPY);
  }

  public TreeBuilder(FeatureRegistry features, int minKeys, double minEntropy) {
    Preconditions.checkNotNull(features);
    Preconditions.checkArgument(minKeys >= 0, "negative minKeys %s", minKeys);
    Preconditions.checkArgument(minEntropy >= 0, "negative minEntropy %s", minEntropy);
    _features = features;
    _minKeys = minKeys;
    _minEntropy = minEntropy;
  }

  public FeatureRegistry features() { return _features; }

  /** Builds a tree, falling back to a single leaf with the majority label when
   * the entities cannot be split at all. */
  public Tree train(List<? extends Entity> ents) {
    Tree.INode root = build(ents);
    if( root == null ) root = new Tree.LeafNode(Entropy.majorityLabel(Entropy.labelCounts(ents)));
    Tree t = new Tree(root);
    LOG.fine("Tree: d=" + t.depth() + " leaves=" + t.leaves());
    return t;
  }

  /** Builds the subtree for the entities, or returns null if they should not
   * be split. */
  public Tree.INode build(List<? extends Entity> ents) { return build(ents, 0); }

  Tree.INode build(List<? extends Entity> ents, int depth) {
    Preconditions.checkArgument(!ents.isEmpty(), "cannot build a tree from no entities");
    Map<String,Integer> keys = Entropy.labelCounts(ents);
    double etp = Entropy.entropy(keys.values());
    String ind = Utils.indent(depth);
    if( LOG.isLoggable(Level.FINE) ) LOG.fine(ind + "Build: " + keys + ", etp=" + Utils.p3d(etp));
    if( etp < _minEntropy ) {
      LOG.fine(ind + " Too little entropy. Stopping.");
      return null;
    }
    if( ents.size() < _minKeys ) {
      LOG.fine(ind + " Too few keys. Stopping.");
      return null;
    }
    Split best = null;
    for( Feature f : _features.features() ) {
      Split s;
      try {
        s = f.split(ents);
      } catch( InvalidSplitException e ) {
        LOG.finest(ind + " Skipped " + e.getMessage());
        continue;
      }
      if( s.betterThan(best) ) best = s;
    }
    if( best == null ) {
      LOG.fine(ind + " No discerning feature. Stopping.");
      return null;
    }
    if( LOG.isLoggable(Level.FINE) )
      LOG.fine(ind + "Feature: " + best._feature + ", arg=" + best._arg + ", etp=" + Utils.p3d(best._entropy));

    String dflt = Entropy.majorityLabel(keys);
    Map<Object,Tree.INode> children = new LinkedHashMap<Object,Tree.INode>();
    int i = 0;
    for( Split.Part p : best._parts ) {
      assert p.size() < ents.size();
      if( LOG.isLoggable(Level.FINER) )
        LOG.finer(ind + " Split" + (i++) + " (" + p.size() + "): " + p._value + ", " + Entropy.labelCounts(p._ents));
      LOG.fine(ind + " Value: " + p._value + " ->");
      Tree.INode child = build(p._ents, depth + 1);
      if( child == null ) {
        String label = Entropy.majorityLabel(Entropy.labelCounts(p._ents));
        LOG.fine(ind + " Leaf: " + p._value + " -> " + label);
        child = new Tree.LeafNode(label);
      }
      children.put(p._value, child);
    }
    return new Tree.BranchNode(best._feature, best._arg, dflt, children);
  }
}
