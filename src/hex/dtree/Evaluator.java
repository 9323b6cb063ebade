package hex.dtree;

import java.util.Collection;

import com.google.common.base.Preconditions;

/** Classifies entities with a tree and scores the predictions. */
public class Evaluator {
  private Evaluator() { }

  /** Label the tree predicts for the entity. Branch values unseen during
   * training fall back to the branch default, so this never fails. */
  public static String classify(Tree.INode node, Entity e) { return node.classify(e); }

  public static String classify(Tree t, Entity e) { return classify(t.root(), e); }

  public static Scores scoreAll(Tree.INode node, Collection<? extends Entity> ents) {
    Preconditions.checkArgument(!ents.isEmpty(), "nothing to score");
    Scores s = new Scores();
    for( Entity e : ents ) s.add(e.label(), node.classify(e));
    return s;
  }

  public static Scores scoreAll(Tree t, Collection<? extends Entity> ents) { return scoreAll(t.root(), ents); }
}
