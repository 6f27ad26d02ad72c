package exm.iet.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.iet.IETFixtures;
import exm.iet.common.Logging;
import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.common.lang.Dimension;
import exm.iet.common.lang.Equation;
import exm.iet.common.lang.Exprs;
import exm.iet.common.lang.Symbol;
import exm.iet.tree.Conditionals.Conditional;
import exm.iet.tree.IETree.Block;
import exm.iet.tree.IETree.Callable;
import exm.iet.tree.IETree.Element;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeType;
import exm.iet.tree.IETree.ParamKind;
import exm.iet.tree.IETree.Parameter;
import exm.iet.tree.Iterations.Iteration;

public class IETreeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private IETFixtures f;

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("", false);
  }

  @Before
  public void setUp() {
    f = new IETFixtures();
  }

  @Test
  public void testIdentityNotStructure() {
    Expression copy = new Expression(f.e0.equation());
    assertEquals("Same text", f.e0.toString(), copy.toString());
    assertNotEquals("Distinct handles", f.e0.id(), copy.id());
    assertEquals(f.e0.id(), f.e0.id());
  }

  @Test
  public void testChildren() {
    List<Node> children = f.block3.getChildren();
    assertEquals(3, children.size());
    assertEquals(NodeType.ITERATION, children.get(0).type());
    assertSame(f.s, children.get(0).iteration().dim());
    assertSame(f.e0, children.get(0).getChildren().get(0));
    assertTrue(f.e0.isLeaf());
    assertFalse(f.block3.isLeaf());
  }

  @Test
  public void testChildrenNotModifiable() {
    exception.expect(UnsupportedOperationException.class);
    f.block1.getChildren().add(f.e1);
  }

  @Test
  public void testNullChildRejected() {
    exception.expect(IETRuntimeError.class);
    new Block(Arrays.<Node>asList(f.e0, null));
  }

  @Test
  public void testWrongCast() {
    exception.expect(IETRuntimeError.class);
    f.e0.iteration();
  }

  @Test
  public void testInvalidLimits() {
    exception.expect(IETRuntimeError.class);
    new Iteration(f.i, 4, 3, 1, f.e0);
  }

  @Test
  public void testInvalidStep() {
    exception.expect(IETRuntimeError.class);
    new Iteration(f.i, 0, 3, 0, f.e0);
  }

  @Test
  public void testSingleTripLoop() {
    Iteration iter = new Iteration(f.i, 2, 2, 1, f.e0);
    assertEquals(2, iter.start());
    assertEquals(2, iter.end());
  }

  @Test
  public void testDerivedDimensionIndex() {
    Dimension xs = Dimension.derived("xs", f.i);
    Iteration iter = new Iteration(xs, 0, 3, 1, f.e0);
    assertEquals("<Iteration xs::i::(0, 3, 1)::(0, 0)>\n" +
                 "  <Expression a[i] = a[i] + b[i] + 5.0>",
                 IETUtil.printAST(iter));
    assertSame(f.i, xs.root());
  }

  @Test
  public void testRebuildKeepsAttributes() {
    Iteration iter = new Iteration(f.i, 0, 3, 1, 1, 1,
        Collections.singletonList("parallel"),
        Collections.<Node>singletonList(f.e0));
    Iteration rebuilt = iter.rebuild(Collections.<Node>singletonList(f.e1));
    assertNotSame(iter, rebuilt);
    assertNotEquals(iter.id(), rebuilt.id());
    assertSame(f.i, rebuilt.dim());
    assertEquals(1, rebuilt.lowerOffset());
    assertEquals(Collections.singletonList("parallel"), rebuilt.properties());
    assertSame(f.e1, rebuilt.getChildren().get(0));
  }

  @Test
  public void testLeafRebuildRejectsChildren() {
    exception.expect(IETRuntimeError.class);
    new Element("// x").rebuild(Collections.<Node>singletonList(f.e0));
  }

  @Test
  public void testConditionalBranches() {
    Conditional cond = f.block4.getChildren().get(0).conditional();
    assertFalse(cond.hasElse());
    assertEquals(1, cond.getChildren().size());
    assertEquals(NodeType.BLOCK, cond.thenBody().type());

    // A deleted then branch leaves an empty branch, not the else
    Conditional withElse = new Conditional(f.evenI(),
        Collections.<Node>singletonList(f.e0),
        Collections.<Node>singletonList(f.e1));
    Conditional rebuilt = withElse.rebuildWith(
        Arrays.<Node>asList(null, withElse.elseBody()));
    assertTrue(rebuilt.thenBody().isEmpty());
    assertSame(f.e1, rebuilt.elseBody().getChildren().get(0));
  }

  @Test
  public void testCallableParameters() {
    Callable fn = new Callable("foo", f.block1, "void");
    List<String> names = new ArrayList<String>();
    for (Parameter p: fn.parameters()) {
      names.add(p.name());
    }
    assertEquals(Arrays.asList("a", "b", "i_size"), names);
    assertEquals(ParamKind.SYMBOL, fn.parameters().get(0).kind());
    assertSame(f.a, fn.parameters().get(0).getSymbol());
    assertEquals(ParamKind.SIZE, fn.parameters().get(2).kind());
    assertSame(f.i, fn.parameters().get(2).getDimension());
  }

  @Test
  public void testCallableParametersScalar() {
    Symbol alpha = Symbol.scalar("alpha", "float");
    Symbol c = Symbol.array("c", "float", f.i, f.j);
    Expression e = new Expression(new Equation(c.indexed(f.i, f.j),
        Exprs.mul(alpha.indexed(), f.ai)));
    List<Parameter> params = Callable.inferParameters(f.iterI(f.iterJ(e)));
    List<String> names = new ArrayList<String>();
    for (Parameter p: params) {
      names.add(p.name());
    }
    assertEquals(Arrays.asList("c", "alpha", "a", "i_size", "j_size"), names);
  }

  @Test
  public void testCallableRebuild() {
    Callable fn = new Callable("foo", f.block1, "void");
    Callable rebuilt = fn.rebuild(Collections.<Node>singletonList(f.block2));
    assertSame(f.block2, rebuilt.body());
    assertEquals("foo", rebuilt.name());
    assertEquals("void", rebuilt.returnType());
    assertEquals(fn.parameters(), rebuilt.parameters());
  }

  @Test
  public void testCountNodes() {
    // i, s, e0, j, k, e1, e2, q, e3
    assertEquals(9, IETUtil.countNodes(f.block3));
  }
}
