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
import java.util.List;

import exm.iet.common.lang.Exprs.Indexed;

/**
 * Assignment of a symbolic expression to an indexed target.
 */
public class Equation {
  private final Indexed lhs;
  private final Expr rhs;

  public Equation(Indexed lhs, Expr rhs) {
    assert(lhs != null);
    assert(rhs != null);
    this.lhs = lhs;
    this.rhs = rhs;
  }

  public Indexed lhs() {
    return lhs;
  }

  public Expr rhs() {
    return rhs;
  }

  /**
   * @return target access followed by all accesses on the right hand side,
   *         in order of occurrence
   */
  public List<Indexed> operands() {
    List<Indexed> res = new ArrayList<Indexed>();
    res.addAll(lhs.operands());
    res.addAll(rhs.operands());
    return res;
  }

  @Override
  public String toString() {
    return lhs.toString() + " = " + rhs.toString();
  }
}
