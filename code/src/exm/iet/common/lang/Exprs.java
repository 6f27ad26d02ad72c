/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.iet.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.iet.common.lang.Operators.BinaryOp;

/**
 * Concrete expression forms used to hand equations and guards to the
 * tree.  Construct through the static builder methods.
 */
public class Exprs {

  public static Constant lit(long value) {
    return new Constant(value);
  }

  public static Constant lit(double value) {
    return new Constant(value);
  }

  public static Expr add(Expr left, Expr right) {
    return new Binary(BinaryOp.ADD, left, right);
  }

  public static Expr sub(Expr left, Expr right) {
    return new Binary(BinaryOp.SUB, left, right);
  }

  public static Expr mul(Expr left, Expr right) {
    return new Binary(BinaryOp.MUL, left, right);
  }

  public static Expr div(Expr left, Expr right) {
    return new Binary(BinaryOp.DIV, left, right);
  }

  public static Expr neg(Expr operand) {
    return new Negate(operand);
  }

  /**
   * Named function application, e.g. Eq(Mod(i, 2), 0)
   */
  public static Expr apply(String function, Expr... args) {
    return new Apply(function, Arrays.asList(args));
  }

  /** Render child, adding parentheses if it binds less tightly than needed */
  private static String wrap(Expr child, int required) {
    if (child.precedence() < required) {
      return "(" + child.toString() + ")";
    }
    return child.toString();
  }

  private static List<Indexed> concatOperands(List<? extends Expr> exprs) {
    List<Indexed> res = new ArrayList<Indexed>();
    for (Expr e: exprs) {
      res.addAll(e.operands());
    }
    return res;
  }

  public static class Constant implements Expr {
    private final Number value;

    private Constant(Number value) {
      this.value = value;
    }

    public Number value() {
      return value;
    }

    @Override
    public List<Indexed> operands() {
      return Collections.emptyList();
    }

    @Override
    public int precedence() {
      return value.doubleValue() < 0 ? PREC_NEG : PREC_ATOM;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /**
   * Access of a symbol at some index expressions.  A scalar access has no
   * indices.
   */
  public static class Indexed implements Expr {
    private final Symbol base;
    private final List<Expr> indices;

    public Indexed(Symbol base, List<Expr> indices) {
      assert(base != null);
      this.base = base;
      this.indices = Collections.unmodifiableList(new ArrayList<Expr>(indices));
    }

    public Symbol base() {
      return base;
    }

    public List<Expr> indices() {
      return indices;
    }

    @Override
    public List<Indexed> operands() {
      List<Indexed> res = new ArrayList<Indexed>();
      res.add(this);
      res.addAll(concatOperands(indices));
      return res;
    }

    @Override
    public int precedence() {
      return PREC_ATOM;
    }

    @Override
    public String toString() {
      if (indices.isEmpty()) {
        return base.name();
      }
      return base.name() + "[" + StringUtils.join(indices, ", ") + "]";
    }
  }

  public static class Binary implements Expr {
    private final BinaryOp op;
    private final Expr left;
    private final Expr right;

    private Binary(BinaryOp op, Expr left, Expr right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    public BinaryOp op() {
      return op;
    }

    public Expr left() {
      return left;
    }

    public Expr right() {
      return right;
    }

    @Override
    public List<Indexed> operands() {
      return concatOperands(Arrays.asList(left, right));
    }

    @Override
    public int precedence() {
      return op.precedence();
    }

    @Override
    public String toString() {
      int rightPrec = op.isAssociative() ? op.precedence()
                                         : op.precedence() + 1;
      return wrap(left, op.precedence()) + op.symbol() + wrap(right, rightPrec);
    }
  }

  public static class Negate implements Expr {
    private final Expr operand;

    private Negate(Expr operand) {
      this.operand = operand;
    }

    public Expr operand() {
      return operand;
    }

    @Override
    public List<Indexed> operands() {
      return operand.operands();
    }

    @Override
    public int precedence() {
      return PREC_NEG;
    }

    @Override
    public String toString() {
      return "-" + wrap(operand, PREC_NEG + 1);
    }
  }

  public static class Apply implements Expr {
    private final String function;
    private final List<Expr> args;

    private Apply(String function, List<Expr> args) {
      this.function = function;
      this.args = Collections.unmodifiableList(new ArrayList<Expr>(args));
    }

    public String function() {
      return function;
    }

    public List<Expr> args() {
      return args;
    }

    @Override
    public List<Indexed> operands() {
      return concatOperands(args);
    }

    @Override
    public int precedence() {
      return PREC_ATOM;
    }

    @Override
    public String toString() {
      return function + "(" + StringUtils.join(args, ", ") + ")";
    }
  }
}
