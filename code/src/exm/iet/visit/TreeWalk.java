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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.apache.log4j.Logger;

import exm.iet.common.exceptions.IETRuntimeError;
import exm.iet.tree.Conditionals.Conditional;
import exm.iet.tree.IETree.Block;
import exm.iet.tree.IETree.Callable;
import exm.iet.tree.IETree.Element;
import exm.iet.tree.IETree.Expression;
import exm.iet.tree.IETree.Node;
import exm.iet.tree.Iterations.Iteration;

public class TreeWalk {

  /**
   * Walk pre-order, visiting children in order
   * @param logger
   * @param root
   * @param walker
   */
  public static void walk(Logger logger, Node root, TreeWalker walker) {
    walk(logger, root, walker, true);
  }

  /**
   * Walk pre-order
   * @param logger
   * @param root
   * @param walker
   * @param recursive if false, only visit root and its direct children
   */
  public static void walk(Logger logger, Node root, TreeWalker walker,
                          boolean recursive) {
    Deque<Node> stack = new ArrayDeque<Node>();
    Deque<Integer> depths = new ArrayDeque<Integer>();
    stack.push(root);
    depths.push(0);
    while (!stack.isEmpty()) {
      Node curr = stack.pop();
      int depth = depths.pop();
      walker.visit(logger, curr);

      if (recursive || depth == 0) {
        List<Node> children = curr.getChildren();
        // Push in reverse so first child is visited first
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(children.get(i));
          depths.push(depth + 1);
        }
      }
    }
  }

  public static abstract class TreeWalker {
    public void visit(Logger logger, Node node) {
      switch (node.type()) {
        case EXPRESSION:
          visit((Expression)node);
          break;
        case ELEMENT:
          visit((Element)node);
          break;
        case ITERATION:
          visit((Iteration)node);
          break;
        case CONDITIONAL:
          visit((Conditional)node);
          break;
        case BLOCK:
          visit((Block)node);
          break;
        case CALLABLE:
          visit((Callable)node);
          break;
        default:
          throw new IETRuntimeError("Unknown node type " + node.type());
      }
    }

    protected void visit(Expression expr) {
      // Nothing
    }

    protected void visit(Element elem) {
      // Nothing
    }

    protected void visit(Iteration iter) {
      // Nothing
    }

    protected void visit(Conditional cond) {
      // Nothing
    }

    protected void visit(Block block) {
      // nothing
    }

    protected void visit(Callable callable) {
      // nothing
    }
  }
}
