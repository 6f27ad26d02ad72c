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
package exm.iet.fd;

import exm.iet.common.lang.Dimension;
import exm.iet.common.lang.Expr;

/**
 * Builds the stencil expression of one derivative.  Implemented by the
 * symbolic front end, which owns the finite-difference weights.
 */
public interface Derivation {

  /**
   * @param function expression to differentiate
   * @param dim dimension to differentiate along
   * @param derivOrder order of the derivative
   * @param fdOrder discretisation order, i.e. stencil width
   * @param side side of the stencil shift, already adjusted for matvec
   * @param matvec direct or adjoint
   * @param staggered true if dim is staggered for this function
   */
  public Expr derive(Expr function, Dimension dim, int derivOrder,
                     int fdOrder, Side side, Transpose matvec,
                     boolean staggered);
}
