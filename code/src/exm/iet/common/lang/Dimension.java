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

import java.util.Collections;
import java.util.List;

import exm.iet.common.lang.Exprs.Indexed;

/**
 * An iteration-space dimension.  A derived dimension (e.g. the staggered
 * version of a grid dimension) keeps a link to its parent, whose name it
 * uses as loop index.
 *
 * Dimensions are compared by identity.
 */
public class Dimension implements Expr {
  private final String name;
  private final Dimension parent;

  private Dimension(String name, Dimension parent) {
    assert(name != null);
    this.name = name;
    this.parent = parent;
  }

  public static Dimension create(String name) {
    return new Dimension(name, null);
  }

  public static Dimension derived(String name, Dimension parent) {
    assert(parent != null);
    return new Dimension(name, parent);
  }

  public String name() {
    return name;
  }

  /**
   * @return parent dimension, or null if not derived
   */
  public Dimension parent() {
    return parent;
  }

  public boolean isDerived() {
    return parent != null;
  }

  /**
   * @return the root of the derivation chain
   */
  public Dimension root() {
    Dimension d = this;
    while (d.parent != null) {
      d = d.parent;
    }
    return d;
  }

  /**
   * @return name of the loop index variable for this dimension
   */
  public String indexName() {
    return isDerived() ? parent.name() : name;
  }

  @Override
  public List<Indexed> operands() {
    return Collections.emptyList();
  }

  @Override
  public int precedence() {
    return PREC_ATOM;
  }

  @Override
  public String toString() {
    return name;
  }
}
