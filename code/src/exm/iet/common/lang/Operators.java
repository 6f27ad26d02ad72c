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

/**
 * This class serves to define details of the arithmetic operators
 * that can appear in stencil expressions
 */
public class Operators {

  public static enum BinaryOp {
    ADD(" + ", Expr.PREC_ADD, true),
    SUB(" - ", Expr.PREC_ADD, false),
    MUL("*", Expr.PREC_MUL, true),
    DIV("/", Expr.PREC_MUL, false);

    private final String symbol;
    private final int precedence;
    /** If false, a right operand of equal precedence needs parentheses */
    private final boolean associative;

    private BinaryOp(String symbol, int precedence, boolean associative) {
      this.symbol = symbol;
      this.precedence = precedence;
      this.associative = associative;
    }

    public String symbol() {
      return symbol;
    }

    public int precedence() {
      return precedence;
    }

    public boolean isAssociative() {
      return associative;
    }
  }
}
