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

/**
 * Side of the shift of a finite-difference stencil
 */
public enum Side {
  LEFT(-1),
  CENTERED(0),
  RIGHT(1);

  private final int shift;

  private Side(int shift) {
    this.shift = shift;
  }

  public int shift() {
    return shift;
  }

  /**
   * The adjoint of a one-sided stencil is taken from the other side
   */
  public Side adjoint(Transpose matvec) {
    if (matvec == Transpose.DIRECT) {
      return this;
    }
    switch (this) {
      case LEFT:
        return RIGHT;
      case RIGHT:
        return LEFT;
      default:
        return CENTERED;
    }
  }

  /**
   * Side implied by a stagger value of a staggered function: 0 is
   * left, 1 is right, no stagger is centred
   */
  public static Side fromStagger(Integer stagger) {
    if (stagger == null) {
      return CENTERED;
    } else if (stagger == 0) {
      return LEFT;
    } else if (stagger == 1) {
      return RIGHT;
    } else {
      return CENTERED;
    }
  }

  @Override
  public String toString() {
    return name().toLowerCase();
  }
}
