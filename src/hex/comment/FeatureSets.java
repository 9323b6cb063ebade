package hex.comment;

import hex.dtree.DiscreteFeature;
import hex.dtree.DiscreteIndexedFeature;
import hex.dtree.FeatureRegistry;
import hex.dtree.MembershipFeature;
import hex.dtree.MembershipIndexedFeature;
import hex.dtree.QuantitativeFeature;

/** The feature sets comment trees are trained with. */
public class FeatureSets {
  private FeatureSets() { }

  /** Features predicting the category of a comment. */
  public static FeatureRegistry addCategoryFeatures(FeatureRegistry reg) {
    reg.add(new DiscreteFeature("type"));
    reg.add(new DiscreteIndexedFeature("parentTypes"));
    reg.add(new MembershipIndexedFeature("parentTypes"));
    reg.add(new MembershipFeature("parentTypes"));
    reg.add(new DiscreteIndexedFeature("leftTypes"));
    reg.add(new MembershipIndexedFeature("leftTypes"));
    reg.add(new MembershipFeature("leftTypes"));
    reg.add(new DiscreteFeature("codeLike"));
    reg.add(new DiscreteFeature("empty"));
    reg.add(new DiscreteIndexedFeature("posTags"));
    reg.add(new MembershipIndexedFeature("posTags"));
    reg.add(new MembershipFeature("posTags"));
    return reg;
  }

  /** Features predicting what a comment refers to, mostly positional. */
  public static FeatureRegistry addTargetFeatures(FeatureRegistry reg) {
    reg.add(new QuantitativeFeature("deltaLine"));
    reg.add(new QuantitativeFeature("deltaCols"));
    reg.add(new QuantitativeFeature("deltaLeft"));
    reg.add(new QuantitativeFeature("deltaRight"));
    reg.add(new DiscreteIndexedFeature("rightTypes"));
    reg.add(new MembershipIndexedFeature("rightTypes"));
    reg.add(new MembershipFeature("rightTypes"));
    reg.add(new MembershipIndexedFeature("words"));
    return reg;
  }

  /** Registry for the named set, {@code cat} or {@code target}. */
  public static FeatureRegistry forName(String name) {
    if( "cat".equals(name) ) return addCategoryFeatures(new FeatureRegistry());
    if( "target".equals(name) ) return addTargetFeatures(new FeatureRegistry());
    throw new IllegalArgumentException("unknown feature set: " + name);
  }
}
