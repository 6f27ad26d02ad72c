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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import exm.iet.common.Logging;
import exm.iet.common.lang.Dimension;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeType;

/**
 * Group the expressions of a tree into sections: runs of expressions
 * that share the same stack of enclosing loops.
 *
 * Each branch of a conditional opens a scope of its own, so expressions
 * inside a conditional never share a section with expressions outside
 * it, even when no loop lies in between.  Expressions outside any loop
 * are grouped under the empty key.
 */
public class FindSections {

  private static final Logger logger = Logging.getIETLogger();

  /**
   * @return sections in order of first encounter; expressions within a
   *         section in tree order
   */
  public ListMultimap<SectionKey, Expression> visit(Node root) {
    ListMultimap<SectionKey, Expression> sections =
              MultimapBuilder.linkedHashKeys().arrayListValues().build();
    visit(root, new ArrayList<Node>(), sections);
    if (logger.isTraceEnabled()) {
      logger.trace("Sections: " + sections.keySet());
    }
    return sections;
  }

  private void visit(Node node, List<Node> scopes,
                     ListMultimap<SectionKey, Expression> sections) {
    switch (node.type()) {
      case EXPRESSION:
        sections.put(new SectionKey(scopes), node.expression());
        break;
      case ITERATION:
        scopes.add(node);
        visitChildren(node, scopes, sections);
        scopes.remove(scopes.size() - 1);
        break;
      case CONDITIONAL:
        // Key on the branch itself so then and else never merge
        for (Node branch: node.getChildren()) {
          scopes.add(branch);
          visitChildren(branch, scopes, sections);
          scopes.remove(scopes.size() - 1);
        }
        break;
      default:
        visitChildren(node, scopes, sections);
        break;
    }
  }

  private void visitChildren(Node node, List<Node> scopes,
                             ListMultimap<SectionKey, Expression> sections) {
    for (Node child: node.getChildren()) {
      visit(child, scopes, sections);
    }
  }

  /**
   * Ordered tuple of enclosing scopes: iterations, and the branches of
   * any conditionals crossed.  Compared by node identity.
   */
  public static class SectionKey {
    private final List<Node> scopes;

    private SectionKey(List<Node> scopes) {
      this.scopes = Collections.unmodifiableList(new ArrayList<Node>(scopes));
    }

    public List<Node> getScopes() {
      return scopes;
    }

    /**
     * @return dimensions of the enclosing iterations, outermost first
     */
    public List<Dimension> getDimensions() {
      List<Dimension> dims = new ArrayList<Dimension>();
      for (Node n: scopes) {
        if (n.type() == NodeType.ITERATION) {
          dims.add(n.iteration().dim());
        }
      }
      return dims;
    }

    @Override
    public int hashCode() {
      int result = 1;
      for (Node n: scopes) {
        result = 31 * result + System.identityHashCode(n);
      }
      return result;
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof SectionKey))
        return false;
      List<Node> other = ((SectionKey)obj).scopes;
      if (other.size() != scopes.size()) {
        return false;
      }
      for (int i = 0; i < scopes.size(); i++) {
        if (scopes.get(i) != other.get(i)) {
          return false;
        }
      }
      return true;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("(");
      boolean first = true;
      for (Node n: scopes) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        if (n.type() == NodeType.ITERATION) {
          sb.append(n.iteration().dim().name());
        } else {
          sb.append("?");
        }
      }
      sb.append(")");
      return sb.toString();
    }
  }
}
