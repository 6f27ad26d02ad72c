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
 * Whether a derivative is taken directly or as its adjoint.  Only odd
 * order derivatives change sign under transposition.
 */
public enum Transpose {
  DIRECT(1),
  TRANSPOSE(-1);

  private final int sign;

  private Transpose(int sign) {
    this.sign = sign;
  }

  public int sign() {
    return sign;
  }

  @Override
  public String toString() {
    return this == DIRECT ? "direct" : "transpose";
  }
}
