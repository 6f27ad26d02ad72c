package exm.iet;

import static exm.iet.common.lang.Exprs.add;
import static exm.iet.common.lang.Exprs.apply;
import static exm.iet.common.lang.Exprs.div;
import static exm.iet.common.lang.Exprs.lit;
import static exm.iet.common.lang.Exprs.mul;
import static exm.iet.common.lang.Exprs.neg;

import java.util.Arrays;

import exm.iet.common.lang.Dimension;
import exm.iet.common.lang.Equation;
import exm.iet.common.lang.Expr;
import exm.iet.common.lang.Exprs.Indexed;
import exm.iet.common.lang.Symbol;
import exm.iet.tree.Conditionals.Conditional;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.Iterations.Iteration;

/**
 * Small loop nests shared by the tree, visitor and rewrite tests.
 * Every instance builds fresh nodes.
 */
public class IETFixtures {

  public final Dimension i = Dimension.create("i");
  public final Dimension j = Dimension.create("j");
  public final Dimension k = Dimension.create("k");
  public final Dimension s = Dimension.create("s");
  public final Dimension q = Dimension.create("q");

  public final Symbol a = Symbol.array("a", "float", i);
  public final Symbol b = Symbol.array("b", "float", i);

  public final Indexed ai = a.indexed(i);
  public final Indexed bi = b.indexed(i);

  /** a[i] = a[i] + b[i] + 5.0 */
  public final Expression e0 =
      new Expression(new Equation(ai, add(add(ai, bi), lit(5.0))));
  /** a[i] = -a[i] + b[i] */
  public final Expression e1 =
      new Expression(new Equation(ai, add(neg(ai), bi)));
  /** a[i] = 4*a[i]*b[i] */
  public final Expression e2 =
      new Expression(new Equation(ai, mul(mul(lit(4), ai), bi)));
  /** a[i] = 8.0*a[i] + 6.0/b[i] */
  public final Expression e3 =
      new Expression(new Equation(ai, add(mul(lit(8.0), ai),
                                          div(lit(6.0), bi))));

  /** i(j(k(e0))) */
  public final Iteration block1 = iterI(iterJ(iterK(e0)));

  /** i[e0, j(k(e1))] */
  public final Iteration block2 = iterI(e0, iterJ(iterK(e1)));

  /** i[s(e0), j(k[e1, e2]), q(e3)] */
  public final Iteration block3 =
      iterI(iterS(e0), iterJ(iterK(e1, e2)), iterQ(e3));

  /** i(if i % 2 == 0 (j(e0))) */
  public final Iteration block4 =
      iterI(new Conditional(evenI(), iterJ(e0)));

  public Iteration iterI(Node... body) {
    return new Iteration(i, 0, 3, 1, Arrays.asList(body));
  }

  public Iteration iterJ(Node... body) {
    return new Iteration(j, 0, 5, 1, Arrays.asList(body));
  }

  public Iteration iterK(Node... body) {
    return new Iteration(k, 0, 7, 1, Arrays.asList(body));
  }

  public Iteration iterS(Node... body) {
    return new Iteration(s, 0, 4, 1, Arrays.asList(body));
  }

  public Iteration iterQ(Node... body) {
    return new Iteration(q, 0, 4, 1, Arrays.asList(body));
  }

  /** Eq(Mod(i, 2), 0) */
  public Expr evenI() {
    return apply("Eq", apply("Mod", i, lit(2)), lit(0));
  }
}
