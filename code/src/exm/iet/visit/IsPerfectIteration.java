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

import java.util.List;

import exm.iet.tree.Conditionals.Conditional;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.IETree.NodeType;

/**
 * Check whether a node is a perfect loop nest: at every level the
 * body is a single nested loop or a single expression.
 *
 * A conditional is perfect if it has no else branch and its then
 * branch is perfect, but it breaks the nest of any loop around it.
 */
public class IsPerfectIteration {

  public boolean visit(Node node) {
    switch (node.type()) {
      case EXPRESSION:
        return true;
      case ITERATION:
      case BLOCK:
        return singlePerfectChild(node.getChildren());
      case CONDITIONAL:
        Conditional cond = node.conditional();
        return !cond.hasElse() &&
               singlePerfectChild(cond.thenBody().getChildren());
      case CALLABLE:
        return visit(node.getChildren().get(0));
      default:
        return false;
    }
  }

  /**
   * Check a bare node sequence, e.g. a branch body
   */
  public boolean visit(List<? extends Node> nodes) {
    return singlePerfectChild(nodes);
  }

  private boolean singlePerfectChild(List<? extends Node> children) {
    if (children.size() != 1) {
      return false;
    }
    Node child = children.get(0);
    if (child.type() == NodeType.EXPRESSION) {
      return true;
    }
    return child.type() == NodeType.ITERATION && visit(child);
  }
}
