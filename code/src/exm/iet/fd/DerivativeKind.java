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
 * Derivative shortcuts offered for each dimension of a function.
 * The pattern gives the accessor name, e.g. dx, dxl, dx2.
 */
public enum DerivativeKind {
  FIRST("d%s", 1, null),
  FIRST_LEFT("d%sl", 1, Side.LEFT),
  FIRST_RIGHT("d%sr", 1, Side.RIGHT),
  SECOND("d%s2", 2, null),
  FOURTH("d%s4", 4, null);

  private final String pattern;
  private final int order;
  /** Fixed side, or null if the side follows the function's stagger */
  private final Side fixedSide;

  private DerivativeKind(String pattern, int order, Side fixedSide) {
    this.pattern = pattern;
    this.order = order;
    this.fixedSide = fixedSide;
  }

  public int order() {
    return order;
  }

  public Side fixedSide() {
    return fixedSide;
  }

  public boolean isOneSided() {
    return fixedSide != null;
  }

  public String accessorName(String dimName) {
    return String.format(pattern, dimName);
  }
}
