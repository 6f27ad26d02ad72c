package exm.iet.rewrite;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.iet.IETFixtures;
import exm.iet.common.Logging;
import exm.iet.tree.IETUtil;
import exm.iet.tree.IETree.Block;
import exm.iet.tree.IETree.Callable;
import exm.iet.tree.IETree.Element;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.Parameter;

public class TransformerTest {

  private static final String OPEN = "// This is the opening comment";
  private static final String CLOSE = "// This is the closing comment";
  private static final String REPLACED = "// Replaced expression";
  private static final String ADDED = "// Adding a simple line";

  private static final String E0_TEXT = "<Expression a[i] = a[i] + b[i] + 5.0>";

  private IETFixtures f;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("", false);
  }

  @Before
  public void setUp() {
    f = new IETFixtures();
  }

  private static int lines(Node n) {
    return IETUtil.printAST(n).split("\n").length;
  }

  private Block wrap(Node n) {
    return new Block(new Element(OPEN), n, new Element(CLOSE));
  }

  @Test
  public void testWrap() {
    Transformer transformer = new Transformer(
                      new RewriteMapping().replace(f.e0, wrap(f.e0)));
    for (Node block: Arrays.<Node>asList(f.block1, f.block2, f.block3)) {
      Node result = transformer.visit(block);
      String text = IETUtil.printAST(result);
      assertEquals(lines(block) + 2, lines(result));
      assertTrue(text.contains(OPEN));
      assertTrue(text.contains(CLOSE));
      assertTrue(text.contains(E0_TEXT));
    }
  }

  @Test
  public void testWrapPrint() {
    Node result = new Transformer(
        new RewriteMapping().replace(f.e0, wrap(f.e0))).visit(f.block1);
    assertEquals(
        "<Iteration i::i::(0, 3, 1)::(0, 0)>\n" +
        "  <Iteration j::j::(0, 5, 1)::(0, 0)>\n" +
        "    <Iteration k::k::(0, 7, 1)::(0, 0)>\n" +
        "      " + OPEN + "\n" +
        "      " + E0_TEXT + "\n" +
        "      " + CLOSE,
        IETUtil.printAST(result));
  }

  @Test
  public void testReplace() {
    Transformer transformer = new Transformer(new RewriteMapping()
                    .replace(f.e0, new Block(new Element(REPLACED))));
    for (Node block: Arrays.<Node>asList(f.block1, f.block2, f.block3)) {
      Node result = transformer.visit(block);
      String text = IETUtil.printAST(result);
      assertEquals(lines(block), lines(result));
      assertTrue(text.contains(REPLACED));
      assertFalse(text.contains(E0_TEXT));
    }
  }

  @Test
  public void testAddAndReplace() {
    Map<Node, Node> mapping = new LinkedHashMap<Node, Node>();
    mapping.put(f.e0, new Block(new Element(REPLACED)));
    mapping.put(f.e1, new Block(new Element(ADDED), f.e1));
    Transformer transformer = new Transformer(mapping);
    for (Node block: Arrays.<Node>asList(f.block2, f.block3)) {
      Node result = transformer.visit(block);
      String text = IETUtil.printAST(result);
      assertEquals(lines(block) + 1, lines(result));
      assertTrue(text.contains(REPLACED));
      assertTrue(text.contains(ADDED));
      assertFalse(text.contains(E0_TEXT));
      assertTrue(text.contains("<Expression a[i] = -a[i] + b[i]>"));
    }
  }

  @Test
  public void testReplaceFunctionBody() {
    Callable fn = new Callable("foo", f.block1, "void");
    Node result = new Transformer(
          new RewriteMapping().replace(f.block1, f.block2)).visit(fn);
    Callable newFn = (Callable)result;
    assertNotSame(fn, newFn);
    assertSame(f.block2, newFn.body());
    assertEquals("foo", newFn.name());
    List<String> names = new ArrayList<String>();
    for (Parameter p: newFn.parameters()) {
      names.add(p.name());
    }
    assertEquals(Arrays.asList("a", "b", "i_size"), names);
    assertEquals("<Callable foo>\n" +
                 "  <Iteration i::i::(0, 3, 1)::(0, 0)>\n" +
                 "    " + E0_TEXT + "\n" +
                 "    <Iteration j::j::(0, 5, 1)::(0, 0)>\n" +
                 "      <Iteration k::k::(0, 7, 1)::(0, 0)>\n" +
                 "        <Expression a[i] = -a[i] + b[i]>",
                 IETUtil.printAST(newFn));
  }

  @Test
  public void testDelete() {
    Node result = new Transformer(new RewriteMapping().delete(f.e0))
                                                    .visit(f.block2);
    assertEquals(
        "<Iteration i::i::(0, 3, 1)::(0, 0)>\n" +
        "  <Iteration j::j::(0, 5, 1)::(0, 0)>\n" +
        "    <Iteration k::k::(0, 7, 1)::(0, 0)>\n" +
        "      <Expression a[i] = -a[i] + b[i]>",
        IETUtil.printAST(result));
  }

  @Test
  public void testDeleteViaNullValue() {
    Map<Node, Node> mapping = new LinkedHashMap<Node, Node>();
    mapping.put(f.e2, null);
    Node result = new Transformer(mapping).visit(f.block3);
    assertEquals(lines(f.block3) - 1, lines(result));
    assertFalse(IETUtil.printAST(result).contains("4*a[i]*b[i]"));
  }

  @Test
  public void testDeleteRoot() {
    assertNull(new Transformer(new RewriteMapping().delete(f.block1))
                                                      .visit(f.block1));
  }

  @Test
  public void testEmptyMappingReturnsInput() {
    assertSame(f.block3, new Transformer(new RewriteMapping()).visit(f.block3));
  }

  @Test
  public void testUntouchedSubtreesShared() {
    Node result = new Transformer(new RewriteMapping()
        .replace(f.e1, f.e3)).visit(f.block3);
    assertNotSame(f.block3, result);
    assertSame(f.block3.getChildren().get(0), result.getChildren().get(0));
    assertSame(f.block3.getChildren().get(2), result.getChildren().get(2));
    assertNotSame(f.block3.getChildren().get(1), result.getChildren().get(1));
    // Input is unchanged
    assertSame(f.e1,
        f.block3.getChildren().get(1).getChildren().get(0).getChildren().get(0));
  }

  @Test
  public void testMappingOrderIrrelevant() {
    Block r0 = new Block(new Element(REPLACED));
    Block r1 = new Block(new Element(ADDED), f.e1);
    Node forward = new Transformer(new RewriteMapping()
        .replace(f.e0, r0).replace(f.e1, r1)).visit(f.block3);
    Node backward = new Transformer(new RewriteMapping()
        .replace(f.e1, r1).replace(f.e0, r0)).visit(f.block3);
    assertEquals(IETUtil.printAST(forward), IETUtil.printAST(backward));
  }

  @Test
  public void testReplacementNotRewritten() {
    // e1 inside the replacement for e0 is left alone
    Node result = new Transformer(new RewriteMapping()
        .replace(f.e0, new Block(f.e1))
        .replace(f.e1, f.e2)).visit(f.iterI(f.e0));
    assertEquals("<Iteration i::i::(0, 3, 1)::(0, 0)>\n" +
                 "  <Expression a[i] = -a[i] + b[i]>",
                 IETUtil.printAST(result));
  }

  @Test
  public void testOuterMappingWins() {
    // Shallow: the k loop is replaced as given, e1 below it is not seen
    Node result = new Transformer(new RewriteMapping()
        .replace(f.block2.getChildren().get(1), f.iterS(f.e1))
        .replace(f.e1, f.e3)).visit(f.block2);
    assertTrue(IETUtil.printAST(result).contains("-a[i] + b[i]"));
    assertFalse(IETUtil.printAST(result).contains("8.0*a[i]"));
  }
}
