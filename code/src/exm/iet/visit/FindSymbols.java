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
package exm.iet.visit;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.iet.common.Logging;
import exm.iet.common.lang.Dimension;
import exm.iet.common.lang.Exprs.Indexed;
import exm.iet.common.lang.Symbol;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.visit.TreeWalk.TreeWalker;

/**
 * Collect the base symbols referenced by equations in a subtree,
 * in order of first occurrence.  Index expressions are ignored, so
 * a[i] and a[i + 1] both contribute a.
 */
public class FindSymbols {

  private static final Logger logger = Logging.getIETLogger();

  public List<Symbol> visit(Node root) {
    SymbolCollector collector = new SymbolCollector();
    TreeWalk.walk(logger, root, collector);
    return new ArrayList<Symbol>(collector.symbols);
  }

  /**
   * @return distinct dimensions that the referenced array symbols are
   *         defined over, in order of first occurrence
   */
  public List<Dimension> visitDimensions(Node root) {
    Set<Dimension> dims = new LinkedHashSet<Dimension>();
    for (Symbol s: visit(root)) {
      dims.addAll(s.dimensions());
    }
    return new ArrayList<Dimension>(dims);
  }

  private static class SymbolCollector extends TreeWalker {
    // Symbols don't override equals, so this is identity-based
    private final Set<Symbol> symbols = new LinkedHashSet<Symbol>();

    @Override
    protected void visit(Expression expr) {
      for (Indexed operand: expr.equation().operands()) {
        symbols.add(operand.base());
      }
    }
  }
}
