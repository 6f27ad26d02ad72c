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

import java.util.List;

import exm.iet.common.lang.Exprs.Indexed;

/**
 * Symbolic expression handed over by the stencil front end.  The tree
 * only needs to find the indexed accesses in an expression and to render
 * it; everything else about the expression is opaque.
 */
public interface Expr {

  /** Binding strength used when rendering nested expressions */
  public static final int PREC_ADD = 10;
  public static final int PREC_NEG = 15;
  public static final int PREC_MUL = 20;
  public static final int PREC_ATOM = 100;

  /**
   * @return indexed accesses in this expression, in left-to-right
   *         order of occurrence, duplicates included
   */
  public List<Indexed> operands();

  public int precedence();

  /**
   * @return canonical rendering, e.g. "a[i] + b[i] + 5.0"
   */
  @Override
  public String toString();
}
