package test.dtree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static test.dtree.Ents.e;
import static test.dtree.Ents.list;
import hex.dtree.DiscreteFeature;
import hex.dtree.Entity;
import hex.dtree.Evaluator;
import hex.dtree.FeatureRegistry;
import hex.dtree.Scores;
import hex.dtree.Tree;
import hex.dtree.TreeBuilder;
import hex.dtree.TreeCodec;
import hex.dtree.TreeParseException;

import java.util.Collections;
import java.util.List;

import org.junit.Test;

public class EvaluatorTest {

  static Tree.INode swapped() throws TreeParseException {
    FeatureRegistry reg = new FeatureRegistry().add(new DiscreteFeature("type"));
    return TreeCodec.parse(reg, "[\"DF:type\", null, \"A\", [[\"x\", \"B\"], [\"y\", \"A\"]]]");
  }

  @Test public void testConstantTree() {
    Tree t = new Tree(new Tree.LeafNode("A"));
    List<Entity> ents = list(e("A"), e("A"), e("B"), e("C"));
    Scores s = Evaluator.scoreAll(t, ents);
    assertEquals(2, s.correct());
    assertEquals(4, s.total());
    assertEquals(0.5, s.accuracy(), 1e-12);
    assertEquals(s.accuracy(), s.precision("A"), 1e-12);
    assertEquals(1.0, s.recall("A"), 0.0);
    assertEquals(0.0, s.recall("B"), 0.0);
    assertEquals(0.0, s.recall("C"), 0.0);
    // never predicted
    assertTrue(Double.isNaN(s.precision("B")));
    assertTrue(Double.isNaN(s.f1("B")));
    assertEquals(2.0 / 3.0, s.f1("A"), 1e-12);
    assertEquals(3, s.labels().size());
    assertEquals("A", s.labels().get(0).label());
    assertEquals(4, s.get("A").predicted());
    assertEquals(2, s.get("A").actual());
  }

  @Test public void testReport() {
    Tree t = new Tree(new Tree.LeafNode("A"));
    Scores s = Evaluator.scoreAll(t, list(e("A"), e("A"), e("B"), e("C")));
    assertEquals("A: prec=0.500(2/4), recl=1.000(2/2), F=0.667\n2/4\n", s.report());
  }

  @Test public void testZeroF1() throws TreeParseException {
    Tree.INode t = swapped();
    Scores s = Evaluator.scoreAll(t, list(e("A").with("type", "x"), e("B").with("type", "y")));
    assertEquals(0, s.correct());
    assertEquals(0.0, s.precision("A"), 0.0);
    assertEquals(0.0, s.recall("A"), 0.0);
    assertEquals(0.0, s.f1("A"), 0.0);
    assertEquals("0/2\n", s.report());
  }

  @Test public void testConfusion() throws TreeParseException {
    Tree.INode t = swapped();
    Scores s = Evaluator.scoreAll(t, list(
        e("A").with("type", "x"), e("A").with("type", "x"), e("A").with("type", "y"),
        e("B").with("type", "x"), e("B").with("type", "z")));
    assertEquals(2, s.confusion("A", "B"));
    assertEquals(1, s.confusion("A", "A"));
    assertEquals(1, s.confusion("B", "B"));
    // unseen value z answers the default
    assertEquals(1, s.confusion("B", "A"));
    assertEquals(0, s.confusion("C", "A"));
    assertEquals(Integer.valueOf(2), s.confusionTable().get("A", "B"));
    assertEquals(2, s.correct());
    assertNull(s.get("C"));
    assertTrue(Double.isNaN(s.recall("C")));
  }

  @Test public void testTrainedTreeScoresItsTrainingSet() {
    List<Entity> ents = TreeBuilderTest.dataset(200, 11);
    Tree t = new TreeBuilder(TreeBuilderTest.registry(), 1, 0.0).train(ents);
    Scores s = Evaluator.scoreAll(t, ents);
    assertEquals(ents.size(), s.correct());
    assertEquals(1.0, s.accuracy(), 0.0);
    for( Scores.LabelScore l : s.labels() ) assertEquals(1.0, l.f1(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyInput() {
    Evaluator.scoreAll(new Tree(new Tree.LeafNode("A")), Collections.<Entity>emptyList());
  }
}
