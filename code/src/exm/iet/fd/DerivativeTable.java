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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.google.common.base.Supplier;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;

import exm.iet.common.Logging;
import exm.iet.common.exceptions.AmbiguousSideException;
import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.common.lang.Dimension;
import exm.iet.common.lang.Expr;

/**
 * Derivative shortcuts available for a function, computed once from
 * its dimensions, stagger and discretisation orders.
 */
public class DerivativeTable {

  private static final Logger logger = Logging.getIETLogger();

  /**
   * One shortcut: derivative order, stencil width and side
   */
  public static class DerivativeEntry {
    private final Dimension dim;
    private final DerivativeKind kind;
    private final int fdOrder;
    private final Side side;
    private final boolean staggered;

    private DerivativeEntry(Dimension dim, DerivativeKind kind, int fdOrder,
                            Side side, boolean staggered) {
      this.dim = dim;
      this.kind = kind;
      this.fdOrder = fdOrder;
      this.side = side;
      this.staggered = staggered;
    }

    public Dimension dim() {
      return dim;
    }

    public DerivativeKind kind() {
      return kind;
    }

    public int fdOrder() {
      return fdOrder;
    }

    public Side side() {
      return side;
    }

    public boolean isStaggered() {
      return staggered;
    }

    public String accessorName() {
      return DerivativeTable.accessorName(dim, kind);
    }

    @Override
    public String toString() {
      return accessorName() + "(order=" + kind.order() + ", fd=" + fdOrder +
             ", " + side + ")";
    }
  }

  private final Table<Dimension, DerivativeKind, DerivativeEntry> entries;

  /** Dimensions for which one-sided derivatives are unavailable */
  private final List<Dimension> staggeredDims;

  private final Derivation derivation;

  private DerivativeTable(Derivation derivation) {
    this.entries = Tables.newCustomTable(
        new LinkedHashMap<Dimension, Map<DerivativeKind, DerivativeEntry>>(),
        new Supplier<Map<DerivativeKind, DerivativeEntry>>() {
          @Override
          public Map<DerivativeKind, DerivativeEntry> get() {
            return new EnumMap<DerivativeKind, DerivativeEntry>(
                                          DerivativeKind.class);
          }
        });
    this.staggeredDims = new ArrayList<Dimension>();
    this.derivation = derivation;
  }

  /**
   * Build the table for a function.
   * @param time time dimension, or null if not a time function
   * @param timeOrder time discretisation order
   * @param spaceDims space dimensions in order
   * @param stagger stagger value per space dimension: null for not
   *        staggered, 0 for left, 1 for right.  May be null for an
   *        unstaggered function.
   * @param spaceOrder space discretisation order
   * @param derivation builds the stencils
   */
  public static DerivativeTable build(Dimension time, int timeOrder,
        List<Dimension> spaceDims, List<Integer> stagger, int spaceOrder,
        Derivation derivation) {
    if (stagger != null && stagger.size() != spaceDims.size()) {
      throw new IETRuntimeError("Stagger " + stagger + " does not match "
                                + "dimensions " + spaceDims);
    }
    DerivativeTable table = new DerivativeTable(derivation);

    if (time != null) {
      if (timeOrder < 1) {
        logger.debug("Time order is 0, no time derivatives generated");
      } else {
        table.add(time, DerivativeKind.FIRST, timeOrder, Side.CENTERED,
                  false);
        if (timeOrder > 1) {
          table.add(time, DerivativeKind.SECOND, timeOrder, Side.CENTERED,
                    false);
        }
      }
    }

    for (int i = 0; i < spaceDims.size(); i++) {
      Dimension dim = spaceDims.get(i);
      Integer s = stagger == null ? null : stagger.get(i);
      boolean staggered = s != null;
      Side side = Side.fromStagger(s);

      table.add(dim, DerivativeKind.FIRST, spaceOrder, side, staggered);
      if (staggered) {
        table.staggeredDims.add(dim);
      } else {
        table.add(dim, DerivativeKind.FIRST_LEFT, spaceOrder, Side.LEFT,
                  false);
        table.add(dim, DerivativeKind.FIRST_RIGHT, spaceOrder, Side.RIGHT,
                  false);
      }
      table.add(dim, DerivativeKind.SECOND, spaceOrder / 2, side, staggered);
      table.add(dim, DerivativeKind.FOURTH, Math.max(spaceOrder / 2, 2),
                side, staggered);
    }

    if (logger.isTraceEnabled()) {
      logger.trace("Derivative table: " + table.entries.values());
    }
    return table;
  }

  private void add(Dimension dim, DerivativeKind kind, int fdOrder,
                   Side side, boolean staggered) {
    entries.put(dim, kind,
                new DerivativeEntry(dim, kind, fdOrder, side, staggered));
  }

  /**
   * @return the entry for a shortcut
   * @throws AmbiguousSideException if a one-sided derivative is requested
   *          for a staggered dimension
   */
  public DerivativeEntry lookup(Dimension dim, DerivativeKind kind)
      throws AmbiguousSideException {
    DerivativeEntry entry = entries.get(dim, kind);
    if (entry != null) {
      return entry;
    }
    if (kind.isOneSided() && staggeredDims.contains(dim)) {
      throw new AmbiguousSideException(accessorName(dim, kind),
          "one-sided derivative is not available along staggered "
          + "dimension " + dim.name());
    }
    throw new IETRuntimeError("No derivative " + accessorName(dim, kind)
                              + " for dimension " + dim.name());
  }

  public boolean contains(Dimension dim, DerivativeKind kind) {
    return entries.contains(dim, kind);
  }

  /**
   * Build the stencil for a shortcut.  The stencil side is swapped for
   * the adjoint.
   */
  public Expr derive(Expr function, Dimension dim, DerivativeKind kind,
                     Transpose matvec) throws AmbiguousSideException {
    DerivativeEntry entry = lookup(dim, kind);
    return derivation.derive(function, dim, kind.order(), entry.fdOrder(),
                             entry.side().adjoint(matvec), matvec,
                             entry.isStaggered());
  }

  /**
   * @return all entries, grouped by dimension in build order
   */
  public List<DerivativeEntry> entries() {
    return Collections.unmodifiableList(
              new ArrayList<DerivativeEntry>(entries.values()));
  }

  /**
   * @return accessor names of all entries, e.g. dt, dx, dxl
   */
  public List<String> accessorNames() {
    List<String> result = new ArrayList<String>();
    for (DerivativeEntry e: entries.values()) {
      result.add(e.accessorName());
    }
    return result;
  }

  /**
   * Name of the shortcut.  Derived dimensions are named after their parent.
   */
  public static String accessorName(Dimension dim, DerivativeKind kind) {
    String name = dim.isDerived() ? dim.parent().name() : dim.name();
    return kind.accessorName(name);
  }
}
