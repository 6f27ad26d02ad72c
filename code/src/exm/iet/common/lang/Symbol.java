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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.iet.common.lang.Exprs.Indexed;

/**
 * Base symbol of an operand: a named array (or scalar) with an element
 * type and the dimensions it is defined over.  Identity is per instance,
 * so two symbols with the same name built separately are distinct.
 */
public class Symbol {
  private final String name;
  private final String dtype;
  private final List<Dimension> dimensions;

  private Symbol(String name, String dtype, List<Dimension> dimensions) {
    this.name = name;
    this.dtype = dtype;
    this.dimensions = Collections.unmodifiableList(dimensions);
  }

  public static Symbol array(String name, String dtype,
                             Dimension... dimensions) {
    assert(dimensions.length > 0);
    return new Symbol(name, dtype, Arrays.asList(dimensions));
  }

  public static Symbol scalar(String name, String dtype) {
    return new Symbol(name, dtype, Collections.<Dimension>emptyList());
  }

  public String name() {
    return name;
  }

  public String dtype() {
    return dtype;
  }

  public List<Dimension> dimensions() {
    return dimensions;
  }

  public boolean isArray() {
    return !dimensions.isEmpty();
  }

  /**
   * Access this symbol at the given indices
   */
  public Indexed indexed(Expr... indices) {
    return new Indexed(this, Arrays.asList(indices));
  }

  @Override
  public String toString() {
    return name;
  }
}
