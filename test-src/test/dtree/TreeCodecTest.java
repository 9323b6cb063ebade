package test.dtree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static test.dtree.Ents.e;
import hex.dtree.DiscreteFeature;
import hex.dtree.Entity;
import hex.dtree.Evaluator;
import hex.dtree.FeatureRegistry;
import hex.dtree.MembershipFeature;
import hex.dtree.QuantitativeFeature;
import hex.dtree.Tree;
import hex.dtree.TreeBuilder;
import hex.dtree.TreeCodec;
import hex.dtree.TreeParseException;
import hex.dtree.UnknownFeatureException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;

public class TreeCodecTest {

  static FeatureRegistry registry() {
    return new FeatureRegistry()
      .add(new DiscreteFeature("type"))
      .add(new MembershipFeature("words"))
      .add(new QuantitativeFeature("delta"));
  }

  static void assertRejected(String json) {
    try {
      TreeCodec.parse(registry(), json);
      fail("accepted " + json);
    } catch( UnknownFeatureException e ) {
      fail("wrong failure for " + json + ": " + e);
    } catch( TreeParseException e ) {
      // expected
    }
  }

  @Test public void testExportShape() throws TreeParseException {
    Tree.INode t = TreeCodec.parse(registry(),
        "[\"QF:delta\", 5.0, \"A\", [[\"lt\", \"A\"], [\"ge\", [\"MF:words\", \"x\", \"B\", [[true, \"B\"], [false, \"C\"]]]]]]");
    JsonElement data = TreeCodec.export(t);
    assertTrue(data.isJsonArray());
    JsonArray a = data.getAsJsonArray();
    assertEquals(4, a.size());
    assertEquals("QF:delta", a.get(0).getAsString());
    assertEquals(5.0, a.get(1).getAsDouble(), 0.0);
    assertEquals("A", a.get(2).getAsString());
    JsonArray ge = a.get(3).getAsJsonArray().get(1).getAsJsonArray();
    assertEquals("ge", ge.get(0).getAsString());
    assertEquals("MF:words", ge.get(1).getAsJsonArray().get(0).getAsString());
    assertEquals("A", Evaluator.classify(t, e("?").with("delta", 1)));
    assertEquals("B", Evaluator.classify(t, e("?").with("delta", 7).with("words", "y,x")));
    assertEquals("C", Evaluator.classify(t, e("?").with("delta", 7).with("words", "y")));
    // no "un" child: the default answers
    assertEquals("A", Evaluator.classify(t, e("?")));
  }

  @Test public void testLeafIsBareLabel() throws TreeParseException {
    Tree.INode leaf = TreeCodec.parse(registry(), "\"comment\"");
    assertTrue(leaf instanceof Tree.LeafNode);
    assertEquals("\"comment\"", TreeCodec.toJson(leaf));
  }

  @Test public void testRoundTripOfBuiltTree() throws TreeParseException {
    List<Entity> ents = TreeBuilderTest.dataset(250, 3);
    FeatureRegistry reg = TreeBuilderTest.registry();
    Tree.INode root = new TreeBuilder(reg, 2, 0.0).build(ents);
    JsonElement once = TreeCodec.export(root);
    Tree.INode back = TreeCodec.importTree(reg, once);
    assertEquals(once, TreeCodec.export(back));
    Tree.INode parsed = TreeCodec.parse(reg, TreeCodec.toJson(root));
    assertEquals(once, TreeCodec.export(parsed));
    for( Entity e : ents ) assertEquals(Evaluator.classify(root, e), Evaluator.classify(parsed, e));
  }

  @Test public void testNonFiniteValuesRoundTrip() throws TreeParseException {
    FeatureRegistry reg = new FeatureRegistry().add(new QuantitativeFeature("v"));
    List<Entity> ents = Ents.of("v", new Object[] { "1", "3", "NaN", "Infinity" }, new String[] { "A", "B", "C", "C" });
    Tree.INode root = new TreeBuilder(reg, 1, 0.0).build(ents);
    for( Entity e : ents ) assertEquals(e.label(), Evaluator.classify(root, e));
    String json = TreeCodec.toJson(root);
    assertEquals("[\"QF:v\",3.0,\"C\",[[\"lt\",\"A\"],[\"ge\",\"B\"],[\"un\",\"C\"]]]", json);
    Tree.INode back = TreeCodec.parse(reg, json);
    for( Entity e : ents ) assertEquals(e.label(), Evaluator.classify(back, e));
  }

  @Test public void testExportRejectsNonFiniteArgument() {
    Map<Object,Tree.INode> children = new LinkedHashMap<Object,Tree.INode>();
    children.put(QuantitativeFeature.LT, new Tree.LeafNode("A"));
    children.put(QuantitativeFeature.GE, new Tree.LeafNode("B"));
    for( double d : new double[] { Double.NaN, Double.POSITIVE_INFINITY } ) {
      Tree.INode t = new Tree.BranchNode(new QuantitativeFeature("v"), d, "A", children);
      try {
        TreeCodec.export(t);
        fail("exported threshold " + d);
      } catch( IllegalArgumentException e ) {
        // expected
      }
    }
  }

  @Test public void testBranchValuesChecked() {
    assertRejected("[\"QF:delta\", 5.0, \"A\", [[\"xx\", \"A\"]]]");
    assertRejected("[\"QF:delta\", 5.0, \"A\", [[1.0, \"A\"]]]");
    assertRejected("[\"MF:words\", \"x\", \"A\", [[\"x\", \"A\"]]]");
    assertRejected("[\"DF:type\", null, \"A\", [[true, \"A\"]]]");
    assertRejected("[\"DF:type\", null, \"A\", [[3, \"A\"]]]");
  }

  @Test public void testNullBranchValueSurvives() throws TreeParseException {
    Tree.INode t = TreeCodec.parse(registry(), "[\"DF:type\", null, \"A\", [[null, \"N\"], [\"doc\", \"D\"]]]");
    assertEquals("N", Evaluator.classify(t, e("?")));
    assertEquals("D", Evaluator.classify(t, e("?").with("type", "doc")));
    assertEquals("A", Evaluator.classify(t, e("?").with("type", "line")));
  }

  @Test(expected = UnknownFeatureException.class)
  public void testUnknownFeature() throws TreeParseException {
    TreeCodec.parse(registry(), "[\"DF:nope\", null, \"A\", [[\"x\", \"A\"]]]");
  }

  @Test public void testMalformedShapes() {
    assertRejected("[\"DF:type\", null, \"A\"]");
    assertRejected("[\"DF:type\", null, \"A\", [[\"x\"]]]");
    assertRejected("[\"DF:type\", null, \"A\", [\"x\", \"A\"]]");
    assertRejected("[\"DF:type\", null, \"A\", {\"x\": \"A\"}]");
    assertRejected("[\"DF:type\", null, [\"A\"], [[\"x\", \"A\"]]]");
    assertRejected("[17, null, \"A\", [[\"x\", \"A\"]]]");
    assertRejected("[\"DF:type\", null, \"A\", [[[\"x\"], \"A\"]]]");
    assertRejected("[\"DF:type\", null, \"A\", [[\"x\", null]]]");
    assertRejected("[\"DF:type\", null, \"A\", [[\"x\", \"A\"], [\"x\", \"B\"]]]");
    assertRejected("{\"leaf\": \"A\"}");
    assertRejected("null");
  }

  @Test public void testArgumentTypesChecked() {
    assertRejected("[\"QF:delta\", \"five\", \"A\", [[\"lt\", \"A\"]]]");
    assertRejected("[\"MF:words\", 3, \"A\", [[true, \"A\"]]]");
    assertRejected("[\"DF:type\", \"x\", \"A\", [[\"x\", \"A\"]]]");
  }

  @Test public void testStrictSyntax() {
    assertRejected("");
    assertRejected("('DF:type', None, 'A', [('x', 'A')])");
    assertRejected("[\"DF:type\", null, \"A\", [[\"x\", \"A\"]]] trailing");
    assertRejected("[\"DF:type\", null, \"A\", [[\"x\", \"A\"]],]");
    assertRejected("[\"DF:type\", null, \"A\", [[x, \"A\"]]]");
  }
}
